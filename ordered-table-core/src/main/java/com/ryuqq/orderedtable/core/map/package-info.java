/**
 * Ordered map facade package.
 *
 * <p>This package contains the container type and its configuration:</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderedtable.core.map.OrderedMap} - insertion-ordered key/value container</li>
 *   <li>{@link com.ryuqq.orderedtable.core.map.OrderedMapConfig} - immutable configuration record</li>
 *   <li>{@link com.ryuqq.orderedtable.core.map.DeletionPolicy} - which values {@code set} treats as delete</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Single mutation path:</strong> every write goes through {@code set} or {@code delete}</li>
 *   <li><strong>Stable position:</strong> re-setting a key never moves it</li>
 *   <li><strong>Single-threaded:</strong> no internal locking</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ordered Table Team
 */
package com.ryuqq.orderedtable.core.map;
