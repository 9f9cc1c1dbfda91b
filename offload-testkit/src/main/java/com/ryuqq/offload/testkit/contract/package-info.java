/**
 * Contract tests and test doubles for Dispatcher implementations.
 *
 * <p><strong>Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.offload.testkit.contract.AbstractDispatcherContractTest} - shared Dispatcher contract</li>
 *   <li>{@link com.ryuqq.offload.testkit.contract.InlineDispatcher} - synchronous reference Dispatcher</li>
 *   <li>{@link com.ryuqq.offload.testkit.contract.RecordingUnobservedExceptionSink} - sink that records reports</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.testkit.contract;
