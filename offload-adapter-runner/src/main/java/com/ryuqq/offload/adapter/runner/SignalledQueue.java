package com.ryuqq.offload.adapter.runner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 워커 스레드가 공유하는 FIFO 큐와 두 개의 신호 플래그.
 *
 * <p><strong>신호:</strong></p>
 * <ul>
 *   <li>work available: {@link #offer(Object)} 시 설정, 큐가 비어 있는 것을 본 워커가 해제</li>
 *   <li>stop requested: {@link #stop()} 시 설정, 해제되지 않음</li>
 * </ul>
 *
 * <p>두 신호가 동시에 설정되어 있으면 stop이 우선합니다. 즉 stop 이후에는 큐에 작업이 남아 있어도
 * {@link #take()}가 null을 반환하며, 남은 작업은 {@link #drain()}으로 버립니다.</p>
 *
 * <p>큐, 플래그, 대기는 모두 하나의 {@link ReentrantLock}과 {@link Condition}으로 보호됩니다.</p>
 *
 * @param <E> 원소 타입
 * @author Offload Team
 * @since 1.0.0
 */
final class SignalledQueue<E> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signalled = lock.newCondition();
    private final Deque<E> items = new ArrayDeque<>();

    private boolean workAvailable;
    private boolean stopRequested;

    /**
     * 원소를 큐 끝에 추가하고 대기 중인 워커 하나를 깨움.
     *
     * @param item 추가할 원소
     * @return stop 이후라 추가하지 않은 경우 false
     */
    boolean offer(E item) {
        lock.lock();
        try {
            if (stopRequested) {
                return false;
            }
            items.addLast(item);
            workAvailable = true;
            signalled.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 원소 하나를 꺼냄. 작업이 없으면 work available 또는 stop 신호가 올 때까지 블로킹.
     *
     * @return 꺼낸 원소, stop이 요청된 경우 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    E take() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                while (!workAvailable && !stopRequested) {
                    signalled.await();
                }
                if (stopRequested) {
                    return null;
                }

                E item = items.pollFirst();
                if (item != null) {
                    // Pass the wake-up on if more work is waiting
                    if (!items.isEmpty()) {
                        signalled.signal();
                    }
                    return item;
                }
                workAvailable = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * stop 신호를 설정하고 대기 중인 모든 워커를 깨움.
     */
    void stop() {
        lock.lock();
        try {
            stopRequested = true;
            signalled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 큐에 남은 원소를 모두 꺼냄.
     *
     * @return 남아 있던 원소 (FIFO 순서)
     */
    List<E> drain() {
        lock.lock();
        try {
            List<E> remaining = new ArrayList<>(items);
            items.clear();
            workAvailable = false;
            return remaining;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 큐에 남은 원소 수 조회.
     *
     * @return 원소 수
     */
    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isStopRequested() {
        lock.lock();
        try {
            return stopRequested;
        } finally {
            lock.unlock();
        }
    }
}
