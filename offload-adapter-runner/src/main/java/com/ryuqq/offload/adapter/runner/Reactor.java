package com.ryuqq.offload.adapter.runner;

import com.ryuqq.offload.application.runtime.Pumpable;
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 하나의 소유 스레드에서만 작업을 실행하는 Dispatcher 구현체.
 *
 * <p>어느 스레드에서든 제출할 수 있지만, 작업은 항상 소유 스레드가 {@link #pump()}를 호출할 때
 * 그 스레드에서 실행됩니다. 소유 스레드에서 제출한 작업은 큐를 거치지 않고 즉시 실행됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit() (다른 스레드)          pump() (소유 스레드)
 *   ↓                               ↓
 * pending 큐에 적재               pending → in-progress 이동 (락 안에서)
 *                                   ↓
 *                                 in-progress에서 하나씩 꺼내 FIFO 순서로 실행
 *                                   ↓
 *                                 실행 중 제출된 작업은 다음 pump()에서 실행
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>pending 큐는 락으로 보호, in-progress 큐는 소유 스레드만 접근</li>
 *   <li>작업은 꺼낸 뒤 실행하므로 작업 안에서 다시 pump()를 호출해도 각 작업은 한 번만 실행됨</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Reactor reactor = new Reactor(); // 생성한 스레드가 소유 스레드
 *
 * pool.submit(() -&gt; {
 *     Mesh mesh = buildMesh(data);
 *     reactor.submit(() -&gt; scene.attach(mesh)); // 소유 스레드에서 실행됨
 * });
 *
 * while (running) {
 *     reactor.pump();
 * }
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class Reactor implements Dispatcher, Pumpable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Reactor.class);

    private final Thread owner;
    private final UnobservedExceptionSink sink;
    private final Object queueLock = new Object();
    private final AtomicLong pending = new AtomicLong();

    private final List<Task<?>> pendingTasks = new ArrayList<>();
    private final Deque<Task<?>> inProgress = new ArrayDeque<>();
    private volatile boolean disposed;

    /**
     * 생성자 (현재 스레드를 소유 스레드로 사용).
     */
    public Reactor() {
        this(Thread.currentThread());
    }

    /**
     * 생성자 (소유 스레드 지정).
     *
     * @param owner 소유 스레드
     * @throws IllegalArgumentException owner가 null인 경우
     */
    public Reactor(Thread owner) {
        this(owner, LoggingUnobservedExceptionSink.INSTANCE);
    }

    /**
     * 생성자 (소유 스레드 지정, 커스텀 sink 주입).
     *
     * @param owner 소유 스레드
     * @param sink 관찰되지 않은 예외를 보고할 sink
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Reactor(Thread owner, UnobservedExceptionSink sink) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.owner = owner;
        this.sink = sink;
    }

    @Override
    public Result submit(Work work) {
        Task<Void> task = Task.of(work, sink);
        dispatch(task);
        return task.result();
    }

    @Override
    public <T> ValueResult<T> submitTyped(Callable<T> callback) {
        Task<T> task = Task.ofValue(callback, sink);
        dispatch(task);
        return task.result();
    }

    /**
     * 큐에 있고 아직 실행되지 않은 작업 수 조회.
     *
     * @return pending 카운트
     */
    @Override
    public long pendingCount() {
        return pending.get();
    }

    /**
     * 큐에 쌓인 작업을 소유 스레드에서 FIFO 순서로 실행.
     *
     * @throws IllegalStateException 소유 스레드가 아닌 스레드에서 호출한 경우
     */
    @Override
    public void pump() {
        if (!isOwnerThread()) {
            throw new IllegalStateException(
                "Reactor can only be pumped from its owner thread '" + owner.getName()
                    + "' (current: '" + Thread.currentThread().getName() + "')"
            );
        }

        synchronized (queueLock) {
            inProgress.addAll(pendingTasks);
            pendingTasks.clear();
        }

        // A task may pump again; the nested call drains the same deque
        Task<?> task;
        while (!disposed && (task = inProgress.poll()) != null) {
            execute(task, true);
        }

        if (disposed && !inProgress.isEmpty()) {
            log.warn("Reactor closed during pump, abandoned {} tasks", inProgress.size());
            inProgress.clear();
        }
    }

    /**
     * 소유 스레드 조회.
     *
     * @return 소유 스레드
     */
    public Thread owner() {
        return owner;
    }

    /**
     * 현재 스레드가 소유 스레드인지 확인.
     *
     * @return 소유 스레드면 true
     */
    public boolean isOwnerThread() {
        return Thread.currentThread() == owner;
    }

    /**
     * Reactor 종료.
     *
     * <p>실행되지 않은 작업을 모두 버리고 이후 제출을 거부합니다.
     * 버려진 작업의 Result는 완료되지 않습니다. 멱등합니다.</p>
     */
    @Override
    public void close() {
        int abandoned;
        synchronized (queueLock) {
            if (disposed) {
                return;
            }
            disposed = true;
            abandoned = pendingTasks.size();
            pendingTasks.clear();
            pending.set(0);
        }

        if (abandoned > 0) {
            log.warn("Reactor closed with {} queued tasks, their results will never complete", abandoned);
        }
        log.debug("Reactor closed (owner: {})", owner.getName());
    }

    private void dispatch(Task<?> task) {
        if (isOwnerThread()) {
            if (disposed) {
                throw disposedException();
            }
            execute(task, false);
            return;
        }

        synchronized (queueLock) {
            if (disposed) {
                throw disposedException();
            }
            pendingTasks.add(task);
            pending.incrementAndGet();
        }
    }

    private <T> void execute(Task<T> task, boolean queued) {
        Completion<T> completion = task.execute();

        if (completion instanceof Failure<T> failure) {
            log.error("Task failed on reactor thread {}", owner.getName(), failure.exception());
        }

        if (queued) {
            // close() may already have reset the counter
            pending.updateAndGet(current -> current > 0 ? current - 1 : 0);
        }
        try {
            task.finish(completion);
        } catch (RuntimeException e) {
            log.error("Failed to complete result on reactor thread {}", owner.getName(), e);
        }
    }

    private DisposedException disposedException() {
        return new DisposedException("Reactor", "Reactor is closed and no longer accepts work");
    }
}
