/**
 * Pump-driven runtime abstractions.
 *
 * <p><strong>Core Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.offload.application.runtime.Pumpable} - work executed on explicit pump cycles</li>
 * </ul>
 *
 * <p>The implementation is provided by {@code Reactor} in the adapter-runner module.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.application.runtime;
