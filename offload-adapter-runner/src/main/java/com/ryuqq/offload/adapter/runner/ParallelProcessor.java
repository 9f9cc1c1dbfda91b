package com.ryuqq.offload.adapter.runner;

import com.ryuqq.offload.application.barrier.CompletionBarrier;
import com.ryuqq.offload.core.exception.DisposedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 하나의 알고리즘을 여러 워커에서 데이터 항목에 병렬 적용하는 처리기.
 *
 * <p>각 워커는 자기 스레드에서 contextFactory로 만든 전용 컨텍스트(예: 인코더, 스크래치 버퍼)를
 * 소유하므로, 알고리즘은 컨텍스트에 대해 동기화할 필요가 없습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 워커 시작 → context = contextFactory.get()
 *   ↓
 * while (true):
 *   data = take()  ← stop이면 종료
 *   processor.process(context, data)  (실패는 로깅 후 카운트, 워커는 계속)
 *   pending 감소
 *   ↓
 * 워커 종료 → context가 AutoCloseable이면 close
 * </pre>
 *
 * <p>컨텍스트 생성에 실패한 워커는 가져간 항목을 모두 실패로 처리합니다.
 * 그래서 {@link #awaitCompletion()}은 항상 반환됩니다.</p>
 *
 * @param <T> 데이터 항목 타입
 * @param <C> 워커별 컨텍스트 타입
 * @author Offload Team
 * @since 1.0.0
 */
public final class ParallelProcessor<T, C> implements AutoCloseable {

    /**
     * 데이터 항목 하나를 처리하는 알고리즘.
     *
     * @param <C> 워커별 컨텍스트 타입
     * @param <T> 데이터 항목 타입
     */
    @FunctionalInterface
    public interface Processor<C, T> {

        /**
         * 항목 처리.
         *
         * @param context 현재 워커의 컨텍스트
         * @param data 처리할 항목
         * @throws Exception 처리 실패 시 (로깅 후 실패 카운트 증가)
         */
        void process(C context, T data) throws Exception;
    }

    private static final Logger log = LoggerFactory.getLogger(ParallelProcessor.class);

    private final Supplier<? extends C> contextFactory;
    private final Processor<? super C, ? super T> processor;
    private final SignalledQueue<T> queue = new SignalledQueue<>();
    private final Object pendingLock = new Object();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final WorkerGroup workers;

    private long pending;

    /**
     * 생성자. 워커 스레드를 즉시 시작합니다.
     *
     * @param config 워커 설정
     * @param contextFactory 워커별 컨텍스트 생성기 (각 워커 스레드에서 한 번 호출)
     * @param processor 항목 처리 알고리즘
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ParallelProcessor(WorkerPoolConfig config,
                             Supplier<? extends C> contextFactory,
                             Processor<? super C, ? super T> processor) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (contextFactory == null) {
            throw new IllegalArgumentException("contextFactory cannot be null");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor cannot be null");
        }

        this.contextFactory = contextFactory;
        this.processor = processor;
        this.workers = new WorkerGroup(config, index -> this::runWorker);
    }

    /**
     * 처리할 항목 추가 (블로킹하지 않음).
     *
     * @param data 처리할 항목
     * @throws IllegalArgumentException data가 null인 경우
     * @throws DisposedException 처리기가 종료된 경우
     */
    public void addData(T data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        checkNotDisposed();

        addPending(1);
        if (!queue.offer(data)) {
            addPending(-1);
            throw disposedException();
        }
    }

    /**
     * 대기 또는 처리 중인 항목 수 조회.
     *
     * @return pending 카운트
     */
    public long pendingCount() {
        synchronized (pendingLock) {
            return pending;
        }
    }

    /**
     * 처리에 실패한 항목 수 조회.
     *
     * @return 실패 카운트
     */
    public long failureCount() {
        return failures.get();
    }

    /**
     * 모든 항목 처리를 기다리는 협조적 barrier 생성.
     *
     * @return CompletionBarrier
     */
    public CompletionBarrier completion() {
        return CompletionBarrier.of(this::pendingCount);
    }

    /**
     * 지금까지 추가된 모든 항목이 처리될 때까지 블로킹 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void awaitCompletion() throws InterruptedException {
        synchronized (pendingLock) {
            while (pending > 0) {
                pendingLock.wait();
            }
        }
    }

    /**
     * 처리기 종료.
     *
     * <p>워커를 정지하고 join한 뒤, 처리되지 않은 항목은 폐기합니다. 멱등합니다.</p>
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

        List<T> discarded = queue.drain();
        if (!discarded.isEmpty()) {
            log.debug("Discarded {} unprocessed items on close", discarded.size());
            addPending(-discarded.size());
        }

        log.debug("ParallelProcessor closed ({} workers, {} failures)", workers.size(), failures.get());
    }

    private void runWorker() {
        C context = null;
        boolean contextReady = false;
        try {
            context = contextFactory.get();
            contextReady = true;
        } catch (Throwable e) {
            log.error("Failed to create processing context on {}, items taken by this worker will fail",
                Thread.currentThread().getName(), e);
        }

        try {
            while (true) {
                T data;
                try {
                    data = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Worker {} interrupted, exiting", Thread.currentThread().getName());
                    return;
                }

                if (data == null) {
                    return;
                }

                try {
                    if (contextReady) {
                        process(context, data);
                    } else {
                        failures.incrementAndGet();
                    }
                } finally {
                    addPending(-1);
                }
            }
        } finally {
            closeContext(context);
        }
    }

    private void process(C context, T data) {
        try {
            processor.process(context, data);
        } catch (Throwable e) {
            failures.incrementAndGet();
            log.error("Failed to process {} on {}", data, Thread.currentThread().getName(), e);
        }
    }

    private void closeContext(C context) {
        if (context instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close processing context {}", context, e);
            }
        }
    }

    private void addPending(long delta) {
        synchronized (pendingLock) {
            pending += delta;
            if (pending <= 0) {
                pendingLock.notifyAll();
            }
        }
    }

    private void checkNotDisposed() {
        if (disposed.get()) {
            throw disposedException();
        }
    }

    private DisposedException disposedException() {
        return new DisposedException("ParallelProcessor", "ParallelProcessor is closed and no longer accepts data");
    }
}
