package com.ryuqq.orderedtable.core.iteration;

import com.ryuqq.orderedtable.core.map.OrderedMap;
import com.ryuqq.orderedtable.core.map.OrderedMapConfig;
import com.ryuqq.orderedtable.core.store.HashValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * 키 전용 순회의 ValueStore 접근 테스트.
 *
 * <p>keys / iterkeys / reviterkeys는 ValueStore를 조회하지 않고,
 * pairs / revpairs는 반환하는 키마다 정확히 한 번 조회하는지 검증합니다.</p>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class KeyOnlyTraversalTest {

    @Spy
    private HashValueStore<String, Integer> store = new HashValueStore<>();

    private OrderedMap<String, Integer> map;

    @BeforeEach
    void setUp() {
        map = new OrderedMap<>(new OrderedMapConfig(), store);
        map.set("a", 1);
        map.set("b", 2);
        map.set("c", 3);
        clearInvocations(store);
    }

    @Test
    void iterkeys_키만_순회하면_ValueStore_조회_없음() {
        // when
        assertThat(map.iterkeys()).containsExactly("a", "b", "c");

        // then
        verify(store, never()).get(any());
    }

    @Test
    void reviterkeys_역방향_키_순회도_ValueStore_조회_없음() {
        // when
        assertThat(map.reviterkeys()).containsExactly("c", "b", "a");

        // then
        verify(store, never()).get(any());
    }

    @Test
    void keys_스냅샷도_ValueStore_조회_없음() {
        // when
        assertThat(map.keys().length()).isEqualTo(3);

        // then
        verifyNoInteractions(store);
    }

    @Test
    void pairs_키마다_정확히_한_번_조회() {
        // when
        int yielded = 0;
        for (Pair<String, Integer> ignored : map.pairs()) {
            yielded++;
        }

        // then
        assertThat(yielded).isEqualTo(3);
        verify(store, times(1)).get("a");
        verify(store, times(1)).get("b");
        verify(store, times(1)).get("c");
        verify(store, times(3)).get(any());
    }

    @Test
    void revpairs_키마다_정확히_한_번_조회() {
        // when
        int yielded = 0;
        for (Pair<String, Integer> ignored : map.revpairs()) {
            yielded++;
        }

        // then
        assertThat(yielded).isEqualTo(3);
        verify(store, times(3)).get(any());
    }
}
