package com.ryuqq.offload.core.task;

/**
 * 반환값이 없는 작업 단위.
 *
 * <p>{@link Runnable}과 달리 checked 예외를 던질 수 있으며, 던져진 예외는
 * Result에 캡처됩니다.</p>
 *
 * @author Offload Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Work {

    /**
     * 작업 실행.
     *
     * @throws Exception 작업 실패 시 (Result에 캡처됨)
     */
    void run() throws Exception;
}
