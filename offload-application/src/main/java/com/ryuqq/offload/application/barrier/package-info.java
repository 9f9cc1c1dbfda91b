/**
 * 작업 완료 대기 도구.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.offload.application.barrier.CompletionBarrier} - pending 카운트 기반 협조적 대기</li>
 *   <li>{@link com.ryuqq.offload.application.barrier.Results} - 여러 Result 블로킹 대기</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.application.barrier;
