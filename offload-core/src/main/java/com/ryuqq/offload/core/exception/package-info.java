/**
 * Exceptions raised by the Offload core.
 *
 * <h2>Taxonomy</h2>
 * <ul>
 *   <li>{@link com.ryuqq.offload.core.exception.DisposedException} - use of a closed dispatcher or an invalidated buffer handle</li>
 *   <li>{@link com.ryuqq.offload.core.exception.TaskFailedException} - value requested from a failed result; carries the original exception as cause</li>
 * </ul>
 *
 * <p>Contract violations (double completion of a result, illegal arguments) use the
 * standard {@link java.lang.IllegalStateException} and {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author Offload Team
 */
package com.ryuqq.offload.core.exception;
