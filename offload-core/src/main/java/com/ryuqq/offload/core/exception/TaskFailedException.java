package com.ryuqq.offload.core.exception;

/**
 * 실패한 작업의 값을 요청했을 때 발생하는 예외.
 *
 * <p>작업 내부에서 던져진 원본 예외는 {@link #getCause()}로 그대로 전달됩니다.</p>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public class TaskFailedException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param cause 작업이 던진 원본 예외
     */
    public TaskFailedException(Throwable cause) {
        super("Task failed: " + cause, cause);
    }
}
