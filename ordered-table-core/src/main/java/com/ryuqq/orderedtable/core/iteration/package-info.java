/**
 * Traversal protocols over {@link com.ryuqq.orderedtable.core.map.OrderedMap}.
 *
 * <h2>Entry Points</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orderedtable.core.iteration.OrderedTraversal#keys} - eager key snapshot</li>
 *   <li>{@link com.ryuqq.orderedtable.core.iteration.OrderedTraversal#pairs} - forward key/value pairs</li>
 *   <li>{@link com.ryuqq.orderedtable.core.iteration.OrderedTraversal#iterkeys} - forward keys</li>
 *   <li>{@link com.ryuqq.orderedtable.core.iteration.OrderedTraversal#revpairs} - backward key/value pairs</li>
 *   <li>{@link com.ryuqq.orderedtable.core.iteration.OrderedTraversal#reviterkeys} - backward keys</li>
 * </ul>
 *
 * <h2>Cursor Model</h2>
 * <p>Iterators keep only the last yielded key and re-resolve its node on every step.
 * Deleting that key mid-traversal ends the traversal early. Keys appended during a forward
 * traversal may or may not be visited; callers must not rely on either outcome.</p>
 *
 * @since 1.0.0
 * @author Ordered Table Team
 */
package com.ryuqq.orderedtable.core.iteration;
