/**
 * One-shot results of asynchronous work.
 *
 * <p>This package contains the future types handed back by every dispatcher.</p>
 *
 * <p><strong>Core Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.offload.core.result.Result} - untyped result (done flag, captured exception)</li>
 *   <li>{@link com.ryuqq.offload.core.result.ValueResult} - result carrying a value</li>
 *   <li>{@link com.ryuqq.offload.core.result.Completion} - sealed Success / Failure outcome</li>
 *   <li>{@link com.ryuqq.offload.core.result.ResultState} - PENDING, SUCCEEDED, FAILED</li>
 *   <li>{@link com.ryuqq.offload.core.result.StateTransition} - single completion rule</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.core.result;
