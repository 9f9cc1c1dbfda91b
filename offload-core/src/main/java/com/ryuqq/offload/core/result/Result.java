package com.ryuqq.offload.core.result;

import com.ryuqq.offload.core.diagnostic.LoggingUnobservedExceptionSink;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.function.Consumer;

/**
 * 비동기 작업의 one-shot 결과.
 *
 * <p>작업 완료 여부를 알려주고, 작업이 던진 예외에 접근할 수 있게 합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>상태는 PENDING에서 종료 상태로 정확히 한 번만 전이 ({@link StateTransition})</li>
 *   <li>예외는 완료 시점에 최대 한 번, 작업을 실행한 스레드가 설정</li>
 *   <li>완료 후에는 어떤 변경도 불가</li>
 * </ul>
 *
 * <p><strong>블로킹 특성:</strong></p>
 * <ul>
 *   <li>{@link #isDone()}, {@link #getState()}: 논블로킹 (주기적 폴링 용도)</li>
 *   <li>{@link #await()}, {@link #isSuccess()}, {@link #getException()}, {@link #getCompletion()}:
 *       완료될 때까지 호출 스레드를 블로킹 (타임아웃 없음)</li>
 * </ul>
 *
 * <p><strong>관찰되지 않은 예외:</strong> 실패한 Result가 예외를 한 번도 조회하지 않은 채
 * 도달 불가능해지면, 예외는 {@link UnobservedExceptionSink}로 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result result = pool.submit(() -&gt; writeSnapshot(path));
 *
 * // 논블로킹 폴링
 * if (result.isDone() &amp;&amp; !result.isSuccess()) {
 *     log.warn("snapshot failed", result.getException());
 * }
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public class Result {

    private static final Logger log = LoggerFactory.getLogger(Result.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final Object lock = new Object();
    private final UnobservedExceptionSink sink;

    private volatile ResultState state = ResultState.PENDING;
    private Completion<?> completion;
    private Consumer<? super Result> onComplete;
    private boolean callbackRegistered;
    private UnobservedExceptionGuard guard;

    /**
     * 생성자 (기본 로깅 sink 사용).
     */
    public Result() {
        this(LoggingUnobservedExceptionSink.INSTANCE);
    }

    /**
     * 생성자 (커스텀 sink 주입).
     *
     * @param sink 관찰되지 않은 예외를 보고할 sink
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public Result(UnobservedExceptionSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    /**
     * 작업 완료 여부 확인 (논블로킹).
     *
     * @return 완료된 경우 true
     */
    public boolean isDone() {
        synchronized (lock) {
            return state.isTerminal();
        }
    }

    /**
     * 현재 상태 조회 (논블로킹).
     *
     * @return PENDING, SUCCEEDED 또는 FAILED
     */
    public ResultState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * 작업이 완료될 때까지 대기.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    public void await() {
        synchronized (lock) {
            while (!state.isTerminal()) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Interrupted while waiting for completion", e);
                }
            }
        }
    }

    /**
     * 작업이 예외 없이 완료되었는지 확인 (블로킹).
     *
     * <p>예외를 조회한 것으로 간주합니다.</p>
     *
     * @return 예외가 없으면 true
     */
    public boolean isSuccess() {
        return getException() == null;
    }

    /**
     * 작업이 던진 예외 조회 (블로킹).
     *
     * @return 캡처된 원본 예외, 없으면 null
     */
    public Throwable getException() {
        Completion<?> outcome = observe();
        if (outcome instanceof Failure<?> failure) {
            return failure.exception();
        }
        return null;
    }

    /**
     * 태그된 완료 값 조회 (블로킹).
     *
     * @return Success 또는 Failure
     */
    public Completion<?> getCompletion() {
        return observe();
    }

    /**
     * 완료 콜백 등록.
     *
     * <p>콜백은 Result를 완료시킨 스레드에서 동기적으로 한 번 실행됩니다.
     * 이미 완료된 경우 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param callback 완료 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     * @throws IllegalStateException 콜백이 이미 등록된 경우
     */
    public void whenComplete(Consumer<? super Result> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }

        boolean runNow;
        synchronized (lock) {
            if (callbackRegistered) {
                throw new IllegalStateException("completion callback already registered");
            }
            callbackRegistered = true;
            runNow = state.isTerminal();
            if (!runNow) {
                onComplete = callback;
            }
        }

        if (runNow) {
            invoke(callback);
        }
    }

    /**
     * 작업 완료 처리. 작업을 실행한 스레드만 호출해야 합니다.
     *
     * @param raised 작업이 던진 예외, 성공한 경우 null
     * @throws IllegalStateException 이미 완료된 경우
     */
    public void complete(Throwable raised) {
        completeWith(raised == null ? Completion.success(null) : Completion.failure(raised));
    }

    /**
     * 완료 값을 기록하고 대기 중인 스레드를 깨운 뒤 완료 콜백을 실행.
     *
     * @param outcome 완료 값
     * @throws IllegalArgumentException outcome이 null인 경우
     * @throws IllegalStateException 이미 완료된 경우
     */
    protected final void completeWith(Completion<?> outcome) {
        completeWith(outcome, null);
    }

    /**
     * 완료 처리 후 신호 전에 하위 클래스 상태를 기록.
     *
     * <p>{@code onTransition}은 상태 전이가 성공한 경우에만, 대기 중인 스레드가 깨어나기 전에
     * 락 안에서 실행됩니다.</p>
     *
     * @param outcome Success 또는 Failure
     * @param onTransition 전이 직후 실행할 작업 (nullable)
     * @throws IllegalArgumentException outcome이 null인 경우
     * @throws IllegalStateException 이미 완료된 경우
     */
    protected final void completeWith(Completion<?> outcome, Runnable onTransition) {
        if (outcome == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }

        Consumer<? super Result> callback;
        synchronized (lock) {
            state = StateTransition.transition(state, outcome.state());
            completion = outcome;
            if (onTransition != null) {
                onTransition.run();
            }

            if (outcome instanceof Failure<?> failure) {
                guard = new UnobservedExceptionGuard(failure.exception(), sink);
                CLEANER.register(this, guard);
            }

            callback = onComplete;
            onComplete = null;
            lock.notifyAll();
        }

        if (callback != null) {
            invoke(callback);
        }
    }

    /**
     * 완료를 기다린 뒤 예외를 관찰된 것으로 표시하고 완료 값을 반환.
     *
     * @return 완료 값
     */
    protected final Completion<?> observe() {
        await();
        synchronized (lock) {
            if (guard != null) {
                guard.markObserved();
            }
            return completion;
        }
    }

    boolean isExceptionObserved() {
        synchronized (lock) {
            return guard == null || guard.isObserved();
        }
    }

    UnobservedExceptionGuard guard() {
        synchronized (lock) {
            return guard;
        }
    }

    private void invoke(Consumer<? super Result> callback) {
        try {
            callback.accept(this);
        } catch (Throwable e) {
            log.error("Completion callback failed for {}", this, e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{state=" + state + "}";
    }
}
