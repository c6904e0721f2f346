/**
 * Service Provider Interface (SPI) package for the ordered table.
 *
 * <p>This package defines the storage abstraction the {@code OrderedMap} facade delegates
 * value lookups to:</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.orderedtable.core.spi.ValueStore} - order-agnostic key to value table</li>
 * </ul>
 *
 * <p>The default implementation lives in {@code com.ryuqq.orderedtable.core.store}.</p>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
package com.ryuqq.orderedtable.core.spi;
