/**
 * Insertion order tracking package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderedtable.core.track.Node} - one key's position, with prev/next links</li>
 *   <li>{@link com.ryuqq.orderedtable.core.track.OrderTrack} - doubly linked list with front, back and length</li>
 *   <li>{@link com.ryuqq.orderedtable.core.track.NodeIndex} - key to Node side table for O(1) unlink</li>
 * </ul>
 *
 * <p>Only the {@code OrderedMap} facade mutates these structures. Iteration reads them.</p>
 *
 * @since 1.0.0
 * @author Ordered Table Team
 */
package com.ryuqq.orderedtable.core.track;
