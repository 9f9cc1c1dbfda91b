package com.ryuqq.offload.core.result;

import com.ryuqq.offload.core.diagnostic.LoggingUnobservedExceptionSink;
import com.ryuqq.offload.core.exception.TaskFailedException;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;

/**
 * 반환값을 가지는 비동기 작업의 결과.
 *
 * <p>값은 완료 신호가 관찰된 뒤에만 읽을 수 있으며, 완료 전에 {@link #getValue()}를 호출하면
 * 완료될 때까지 블로킹됩니다.</p>
 *
 * @param <T> 반환값 타입
 * @author Offload Team
 * @since 1.0.0
 */
public class ValueResult<T> extends Result {

    private Completion<T> typedCompletion;

    /**
     * 생성자 (기본 로깅 sink 사용).
     */
    public ValueResult() {
        this(LoggingUnobservedExceptionSink.INSTANCE);
    }

    /**
     * 생성자 (커스텀 sink 주입).
     *
     * @param sink 관찰되지 않은 예외를 보고할 sink
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public ValueResult(UnobservedExceptionSink sink) {
        super(sink);
    }

    /**
     * 완료 값으로 작업 완료 처리. 작업을 실행한 스레드만 호출해야 합니다.
     *
     * @param completion Success 또는 Failure
     * @throws IllegalArgumentException completion이 null인 경우
     * @throws IllegalStateException 이미 완료된 경우
     */
    public void complete(Completion<T> completion) {
        completeWith(completion, () -> typedCompletion = completion);
    }

    /**
     * 예외 여부로 작업 완료 처리. 예외가 없으면 값은 null입니다.
     *
     * @param raised 작업이 던진 예외 (성공 시 null)
     * @throws IllegalStateException 이미 완료된 경우
     */
    @Override
    public void complete(Throwable raised) {
        complete(raised == null ? Completion.<T>success(null) : Completion.<T>failure(raised));
    }

    /**
     * 반환값으로 성공 완료 처리.
     *
     * @param value 반환값
     * @throws IllegalStateException 이미 완료된 경우
     */
    public void succeed(T value) {
        complete(Completion.success(value));
    }

    @Override
    public Completion<T> getCompletion() {
        observe();
        return typedCompletion;
    }

    /**
     * 반환값 조회 (블로킹).
     *
     * @return 작업 반환값
     * @throws TaskFailedException 작업이 예외를 던진 경우 (원본 예외는 cause)
     */
    public T getValue() {
        Completion<T> outcome = getCompletion();
        if (outcome instanceof Failure<T> failure) {
            throw new TaskFailedException(failure.exception());
        }
        return ((Success<T>) outcome).value();
    }
}
