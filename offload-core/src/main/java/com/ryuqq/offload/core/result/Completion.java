package com.ryuqq.offload.core.result;

/**
 * 비동기 작업의 완료 값.
 *
 * <p>Completion은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 작업이 값을 반환하며 종료됨</li>
 *   <li>{@link Failure}: 작업이 예외를 던짐</li>
 * </ul>
 *
 * <p>작업을 실행한 스레드에서 던져진 예외는 호출자 스레드로 직접 전파되지 않고,
 * 이 태그된 값으로 Result에 저장됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Completion&lt;Integer&gt; completion = result.getCompletion();
 * if (completion instanceof Success&lt;Integer&gt; success) {
 *     use(success.value());
 * } else if (completion instanceof Failure&lt;Integer&gt; failure) {
 *     log.warn("failed", failure.exception());
 * }
 * </pre>
 *
 * @param <T> 값 타입
 * @author Offload Team
 * @since 1.0.0
 */
public sealed interface Completion<T> permits Success, Failure {

    /**
     * 성공 Completion 생성.
     *
     * @param value 작업 반환값 (null 허용)
     * @param <T> 값 타입
     * @return Success 인스턴스
     */
    static <T> Completion<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 실패 Completion 생성.
     *
     * @param exception 캡처된 예외
     * @param <T> 값 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException exception이 null인 경우
     */
    static <T> Completion<T> failure(Throwable exception) {
        return new Failure<>(exception);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 이 Completion이 도달시키는 종료 상태.
     *
     * @return SUCCEEDED 또는 FAILED
     */
    default ResultState state() {
        return isSuccess() ? ResultState.SUCCEEDED : ResultState.FAILED;
    }
}
