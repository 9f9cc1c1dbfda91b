package com.ryuqq.offload.core.task;

import com.ryuqq.offload.core.result.Completion;
import com.ryuqq.offload.core.result.ValueResult;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;

import java.util.concurrent.Callable;

/**
 * 작업 단위와 그 결과를 관찰하는 Result의 쌍.
 *
 * <p>제출 1회당 하나 생성되며, 생성 후 불변이고 워커에 의해 정확히 한 번 소비됩니다.</p>
 *
 * <p><strong>실행 단계:</strong></p>
 * <ol>
 *   <li>{@link #execute()}: 콜백 실행, 예외를 {@link Completion}으로 캡처 (절대 던지지 않음)</li>
 *   <li>{@link #finish(Completion)}: Result 완료 처리 (대기 스레드 깨움, 완료 콜백 실행)</li>
 * </ol>
 *
 * <p>두 단계가 분리되어 있어 WorkerPool은 그 사이에 pending 카운터를 감소시킬 수 있습니다.
 * {@link #run()}은 두 단계를 연속으로 수행합니다.</p>
 *
 * @param <T> 반환값 타입 (값이 없는 작업은 Void)
 * @author Offload Team
 * @since 1.0.0
 */
public final class Task<T> {

    private final Callable<T> callback;
    private final ValueResult<T> result;

    private Task(Callable<T> callback, ValueResult<T> result) {
        this.callback = callback;
        this.result = result;
    }

    /**
     * 반환값이 없는 Task 생성.
     *
     * @param work 작업
     * @param sink 관찰되지 않은 예외를 보고할 sink
     * @return Task 인스턴스
     * @throws IllegalArgumentException work 또는 sink가 null인 경우
     */
    public static Task<Void> of(Work work, UnobservedExceptionSink sink) {
        if (work == null) {
            throw new IllegalArgumentException("Invalid null callback in task");
        }
        return new Task<>(() -> {
            work.run();
            return null;
        }, new ValueResult<>(sink));
    }

    /**
     * 반환값이 있는 Task 생성.
     *
     * @param callback 작업
     * @param sink 관찰되지 않은 예외를 보고할 sink
     * @param <T> 반환값 타입
     * @return Task 인스턴스
     * @throws IllegalArgumentException callback 또는 sink가 null인 경우
     */
    public static <T> Task<T> ofValue(Callable<T> callback, UnobservedExceptionSink sink) {
        if (callback == null) {
            throw new IllegalArgumentException("Invalid null callback in task");
        }
        return new Task<>(callback, new ValueResult<>(sink));
    }

    /**
     * 콜백 실행.
     *
     * <p>콜백이 던지는 모든 예외를 캡처하므로 이 메서드는 예외를 던지지 않습니다.</p>
     *
     * @return 실행 결과 (Success 또는 Failure)
     */
    public Completion<T> execute() {
        try {
            return Completion.success(callback.call());
        } catch (Throwable e) {
            return Completion.failure(e);
        }
    }

    /**
     * Result 완료 처리.
     *
     * @param completion {@link #execute()}의 반환값
     * @throws IllegalStateException Result가 이미 완료된 경우
     */
    public void finish(Completion<T> completion) {
        result.complete(completion);
    }

    /**
     * 실행 후 즉시 Result 완료 처리.
     *
     * @return 실행 결과
     */
    public Completion<T> run() {
        Completion<T> completion = execute();
        finish(completion);
        return completion;
    }

    /**
     * 이 Task를 관찰하는 Result 조회.
     *
     * @return Result
     */
    public ValueResult<T> result() {
        return result;
    }
}
