package com.ryuqq.offload.core.result;

/**
 * 예외로 종료된 작업.
 *
 * <p>exception은 작업 내부에서 던져진 원본 객체이며, 래핑되지 않습니다.</p>
 *
 * @param exception 캡처된 예외 (non-null)
 * @param <T> 값 타입
 * @author Offload Team
 * @since 1.0.0
 */
public record Failure<T>(Throwable exception) implements Completion<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException exception이 null인 경우
     */
    public Failure {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
    }
}
