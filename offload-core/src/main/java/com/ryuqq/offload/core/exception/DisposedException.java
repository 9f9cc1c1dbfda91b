package com.ryuqq.offload.core.exception;

/**
 * 이미 해제(dispose)된 자원을 사용하려 할 때 발생하는 예외.
 *
 * <p><strong>발생 시점:</strong></p>
 * <ul>
 *   <li>종료된 WorkerPool, Reactor, ParallelProcessor에 작업 제출</li>
 *   <li>종료된 WorkerPool의 pendingCount 조회</li>
 *   <li>resize, mutate 또는 close로 무효화된 Buffer 핸들 사용</li>
 * </ul>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public class DisposedException extends IllegalStateException {

    private final String resourceName;

    /**
     * 생성자.
     *
     * @param resourceName 해제된 자원 이름 (예: "WorkerPool")
     * @param message 상세 메시지
     */
    public DisposedException(String resourceName, String message) {
        super(message);
        this.resourceName = resourceName;
    }

    /**
     * 해제된 자원 이름 조회.
     *
     * @return 자원 이름
     */
    public String getResourceName() {
        return resourceName;
    }
}
