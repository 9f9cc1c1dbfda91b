/**
 * Service Provider Interfaces for dispatching work and reporting failures.
 *
 * <p>Implementations live in the adapter-runner module ({@code WorkerPool}, {@code Reactor})
 * and in the testkit ({@code InlineDispatcher}).</p>
 *
 * <p><strong>Core Interfaces:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.offload.core.spi.Dispatcher} - accepts work, returns results</li>
 *   <li>{@link com.ryuqq.offload.core.spi.UnobservedExceptionSink} - receives failures nobody looked at</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.core.spi;
