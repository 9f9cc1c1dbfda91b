package com.ryuqq.offload.core.result;

/**
 * Result 상태 전이 검증.
 *
 * <p>Result는 정확히 한 번만 완료될 수 있습니다. 두 번째 완료 시도는
 * 생산자(producer) 쪽의 버그이므로 즉시 {@link IllegalStateException}으로 실패합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → SUCCEEDED</li>
 *   <li>PENDING → FAILED</li>
 * </ul>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우 (예: 이중 완료)
     */
    public static void validate(ResultState from, ResultState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Result already completed: %s → %s", from, to)
            );
        }

        if (!to.isTerminal()) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ResultState transition(ResultState current, ResultState next) {
        validate(current, next);
        return next;
    }
}
