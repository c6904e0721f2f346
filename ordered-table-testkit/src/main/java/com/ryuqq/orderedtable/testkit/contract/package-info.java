/**
 * Contract test infrastructure for the ordered table.
 *
 * <p>{@link com.ryuqq.orderedtable.testkit.contract.AbstractOrderedMapContractTest} creates a
 * fresh container per test and exposes helpers that read it through every traversal protocol.
 * A custom {@link com.ryuqq.orderedtable.core.spi.ValueStore} is validated by extending the base
 * class and overriding {@code createValueStore()}.</p>
 *
 * @see com.ryuqq.orderedtable.core.map.OrderedMap
 * @see com.ryuqq.orderedtable.core.spi.ValueStore
 * @author Ordered Table Team
 * @since 1.0.0
 */
package com.ryuqq.orderedtable.testkit.contract;
