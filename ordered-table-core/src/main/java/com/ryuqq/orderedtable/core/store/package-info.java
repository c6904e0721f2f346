/**
 * In-memory ValueStore implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.orderedtable.core.store.HashValueStore}:
 *       {@link java.util.HashMap} backed implementation of
 *       {@link com.ryuqq.orderedtable.core.spi.ValueStore}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ValueStore&lt;String, Integer&gt; store = new HashValueStore&lt;&gt;(64);
 * OrderedMap&lt;String, Integer&gt; map = new OrderedMap&lt;&gt;(new OrderedMapConfig(), store);
 * </pre>
 *
 * @see com.ryuqq.orderedtable.core.spi.ValueStore
 * @author Ordered Table Team
 * @since 1.0.0
 */
package com.ryuqq.orderedtable.core.store;
