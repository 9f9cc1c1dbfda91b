package com.ryuqq.offload.adapter.runner;

/**
 * WorkerPool / ParallelProcessor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadCount: 워커 스레드 수 (기본 max(CPU 코어 수 - 1, 1))</li>
 *   <li>threadNamePrefix: 스레드 이름 접두어 (기본 "offload-worker-", 이름은 접두어 + 인덱스)</li>
 *   <li>daemon: 데몬 스레드 여부 (기본 true, 호스트 JVM 종료를 막지 않음)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>CPU 바운드 작업: 기본값 유지 (호스트 스레드 몫으로 코어 하나를 남김)</li>
 *   <li>I/O 바운드 작업: threadCount 증가</li>
 * </ul>
 *
 * @author Offload Team
 * @since 1.0.0
 * @param threadCount 워커 스레드 수 (1 이상이어야 함)
 * @param threadNamePrefix 스레드 이름 접두어 (null 또는 빈 문자열 불가)
 * @param daemon 데몬 스레드 여부
 */
public record WorkerPoolConfig(
    int threadCount,
    String threadNamePrefix,
    boolean daemon
) {

    /**
     * 기본 스레드 이름 접두어.
     */
    public static final String DEFAULT_THREAD_NAME_PREFIX = "offload-worker-";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadCount=max(availableProcessors - 1, 1),
     * threadNamePrefix="offload-worker-", daemon=true</p>
     */
    public WorkerPoolConfig() {
        this(defaultThreadCount(), DEFAULT_THREAD_NAME_PREFIX, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerPoolConfig {
        if (threadCount <= 0) {
            throw new IllegalArgumentException(
                "threadCount must be positive (current: " + threadCount + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * 기본 워커 수 계산.
     *
     * @return max(availableProcessors - 1, 1)
     */
    public static int defaultThreadCount() {
        return Math.max(Runtime.getRuntime().availableProcessors() - 1, 1);
    }

    /**
     * threadCount만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withThreadCount(int threadCount) {
        return new WorkerPoolConfig(threadCount, threadNamePrefix, daemon);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withThreadNamePrefix(String threadNamePrefix) {
        return new WorkerPoolConfig(threadCount, threadNamePrefix, daemon);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withDaemon(boolean daemon) {
        return new WorkerPoolConfig(threadCount, threadNamePrefix, daemon);
    }
}
