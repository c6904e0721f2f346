/**
 * Exception types raised by the ordered table.
 *
 * <p>{@link com.ryuqq.orderedtable.core.exception.InvalidArgumentException} is the only
 * dedicated type. Every other argument problem (null keys, invalid configuration)
 * is reported with a plain {@link java.lang.IllegalArgumentException}.</p>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
package com.ryuqq.orderedtable.core.exception;
