package com.ryuqq.offload.adapter.runner;

import com.ryuqq.offload.application.barrier.CompletionBarrier;
import com.ryuqq.offload.core.diagnostic.LoggingUnobservedExceptionSink;
import com.ryuqq.offload.core.exception.DisposedException;
import com.ryuqq.offload.core.result.Completion;
import com.ryuqq.offload.core.result.Failure;
import com.ryuqq.offload.core.result.Result;
import com.ryuqq.offload.core.result.ValueResult;
import com.ryuqq.offload.core.spi.Dispatcher;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;
import com.ryuqq.offload.core.task.Task;
import com.ryuqq.offload.core.task.Work;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 고정 크기 워커 스레드 풀 Dispatcher 구현체.
 *
 * <p>호스트 스레드에서 제출된 작업을 백그라운드 워커 스레드에서 실행하고,
 * 결과는 {@link Result}로 돌려줍니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>작업을 Task로 감싸 공유 FIFO 큐에 적재 (제출은 블로킹하지 않음)</li>
 *   <li>워커 스레드에서 작업 실행, 예외를 Result에 캡처</li>
 *   <li>대기 또는 실행 중인 작업 수(pending) 추적</li>
 *   <li>종료 시 워커 정지, join, 남은 작업 폐기</li>
 * </ul>
 *
 * <p><strong>워커 루프:</strong></p>
 * <pre>
 * while (true):
 *   take()  ← work available 또는 stop 신호까지 블로킹 (stop 우선)
 *     ↓
 *   stop이면 종료
 *     ↓
 *   task.execute()      → Completion (예외는 캡처, 워커는 죽지 않음)
 *   pending 감소
 *   task.finish()       → 대기 스레드 깨움, 완료 콜백 실행
 * </pre>
 *
 * <p>pending 카운트는 Result 완료 신호보다 먼저 감소합니다. 따라서 모든 Result가 완료된 것을 본
 * 호출자는 항상 pending 0을 관찰합니다.</p>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>큐와 신호 플래그: {@link SignalledQueue}의 락</li>
 *   <li>pending 카운트: 별도 모니터</li>
 *   <li>워커 간 완료 순서는 보장하지 않음 (큐 적재 순서만 FIFO)</li>
 * </ul>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class WorkerPool implements Dispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final UnobservedExceptionSink sink;
    private final SignalledQueue<Task<?>> queue = new SignalledQueue<>();
    private final Object pendingLock = new Object();
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final WorkerGroup workers;

    private long pending;

    /**
     * 생성자 (기본 설정 사용).
     */
    public WorkerPool() {
        this(new WorkerPoolConfig());
    }

    /**
     * 생성자 (기본 로깅 sink 사용).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public WorkerPool(WorkerPoolConfig config) {
        this(config, LoggingUnobservedExceptionSink.INSTANCE);
    }

    /**
     * 생성자 (커스텀 sink 주입).
     *
     * @param config 설정
     * @param sink 관찰되지 않은 예외를 보고할 sink
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerPool(WorkerPoolConfig config, UnobservedExceptionSink sink) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }

        this.sink = sink;
        this.workers = new WorkerGroup(config, index -> this::runWorker);
    }

    @Override
    public Result submit(Work work) {
        Task<Void> task = Task.of(work, sink);
        enqueue(task);
        return task.result();
    }

    @Override
    public <T> ValueResult<T> submitTyped(Callable<T> callback) {
        Task<T> task = Task.ofValue(callback, sink);
        enqueue(task);
        return task.result();
    }

    /**
     * 대기 또는 실행 중인 작업 수 조회.
     *
     * @return pending 카운트
     * @throws DisposedException 풀이 종료된 경우
     */
    @Override
    public long pendingCount() {
        checkNotDisposed();
        return currentPending();
    }

    /**
     * 모든 작업 완료를 기다리는 협조적 barrier 생성.
     *
     * <p>barrier는 lazy하며 반복할 때마다 그 시점의 pending 카운트를 다시 기다립니다.</p>
     *
     * @return CompletionBarrier
     */
    public CompletionBarrier completion() {
        return CompletionBarrier.of(this::currentPending);
    }

    /**
     * 워커 스레드 수 조회.
     *
     * @return 스레드 수
     */
    public int threadCount() {
        return workers.size();
    }

    /**
     * 종료 여부 확인.
     *
     * @return close()가 호출되었으면 true
     */
    public boolean isClosed() {
        return disposed.get();
    }

    /**
     * 풀 종료.
     *
     * <p>stop 신호 후 모든 워커를 join하고, 큐에 남아 있던 작업은 실행하지 않고 폐기합니다.
     * 폐기된 작업의 Result는 완료되지 않습니다. 멱등합니다.</p>
     *
     * @throws RuntimeException join 대기 중 인터럽트 발생 시
     */
    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }

        queue.stop();
        workers.join();

        List<Task<?>> discarded = queue.drain();
        if (!discarded.isEmpty()) {
            log.debug("Discarded {} queued tasks on close", discarded.size());
            addPending(-discarded.size());
        }

        log.debug("WorkerPool closed ({} workers)", workers.size());
    }

    private void enqueue(Task<?> task) {
        checkNotDisposed();

        addPending(1);
        if (!queue.offer(task)) {
            addPending(-1);
            throw disposedException();
        }
    }

    private void runWorker() {
        while (true) {
            Task<?> task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker {} interrupted, exiting", Thread.currentThread().getName());
                return;
            }

            if (task == null) {
                return;
            }

            execute(task);
        }
    }

    private <T> void execute(Task<T> task) {
        Completion<T> completion = task.execute();

        if (completion instanceof Failure<T> failure) {
            log.error("Task failed on {}", Thread.currentThread().getName(), failure.exception());
        }

        addPending(-1);
        try {
            task.finish(completion);
        } catch (RuntimeException e) {
            // result was completed outside the pool
            log.error("Failed to complete result on {}", Thread.currentThread().getName(), e);
        }
    }

    private long currentPending() {
        synchronized (pendingLock) {
            return pending;
        }
    }

    private void addPending(long delta) {
        synchronized (pendingLock) {
            pending += delta;
        }
    }

    private void checkNotDisposed() {
        if (disposed.get()) {
            throw disposedException();
        }
    }

    private DisposedException disposedException() {
        return new DisposedException("WorkerPool", "WorkerPool is closed and no longer accepts work");
    }
}
