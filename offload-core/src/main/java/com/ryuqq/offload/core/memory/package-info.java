/**
 * 재사용 가능한 바이트 버퍼 풀.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.offload.core.memory.BufferPool} - 용량 오름차순 free list 기반 first-fit 풀</li>
 *   <li>{@link com.ryuqq.offload.core.memory.Buffer} - 단일 소유 버퍼 핸들 (resize, mutate, close)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.core.memory;
