package com.ryuqq.offload.core.result;

/**
 * Result의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → SUCCEEDED (작업이 예외 없이 종료)</li>
 *   <li>PENDING → FAILED (작업이 예외를 던짐)</li>
 *   <li><strong>종료 상태에서는 어떤 전이도 불가 (one-shot)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ├─► SUCCEEDED
 *    │
 *    └─► FAILED
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public enum ResultState {

    /**
     * 완료 대기 중.
     */
    PENDING,

    /**
     * 예외 없이 완료.
     */
    SUCCEEDED,

    /**
     * 예외가 캡처된 상태로 완료.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
