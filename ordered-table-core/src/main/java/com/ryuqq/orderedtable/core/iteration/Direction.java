package com.ryuqq.orderedtable.core.iteration;

import com.ryuqq.orderedtable.core.map.OrderedMap;

/**
 * 순회 방향.
 *
 * <ul>
 *   <li>FORWARD: front에서 시작, next 방향</li>
 *   <li>BACKWARD: back에서 시작, prev 방향</li>
 * </ul>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
enum Direction {

    FORWARD {
        @Override
        <K> K start(OrderedMap<K, ?> map) {
            return map.firstKey();
        }

        @Override
        <K> K step(OrderedMap<K, ?> map, K current) {
            return map.keyAfter(current);
        }
    },

    BACKWARD {
        @Override
        <K> K start(OrderedMap<K, ?> map) {
            return map.lastKey();
        }

        @Override
        <K> K step(OrderedMap<K, ?> map, K current) {
            return map.keyBefore(current);
        }
    };

    /**
     * 순회 시작 키.
     *
     * @return 시작 키, 비어 있으면 null
     */
    abstract <K> K start(OrderedMap<K, ?> map);

    /**
     * 현재 키에서 한 칸 이동한 키.
     *
     * @return 다음 키, 끝이거나 current가 더 이상 없으면 null
     */
    abstract <K> K step(OrderedMap<K, ?> map, K current);
}
