package com.ryuqq.offload.application.barrier;

import com.ryuqq.offload.core.spi.Dispatcher;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.LongSupplier;

/**
 * 협조적(cooperative) 전체 완료 대기.
 *
 * <p>pending 카운트가 0보다 큰 동안 라운드마다 한 번씩 현재 카운트를 내보내는 lazy {@link Iterable}입니다.
 * 블로킹하지 않으므로, 대기하는 동안 자기 루프를 계속 돌려야 하는 스레드(예: Reactor의 소유 스레드)에서
 * 사용할 수 있습니다.</p>
 *
 * <p><strong>특성:</strong></p>
 * <ul>
 *   <li>lazy: 반복을 시작하기 전에는 카운트를 읽지 않음</li>
 *   <li>재시작 가능: {@link #iterator()}마다 새로운 대기를 시작</li>
 *   <li>카운트가 0이 되는 즉시 반복 종료 (이미 0이면 한 번도 내보내지 않음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * for (long pending : pool.completion()) {
 *     reactor.pump(); // 대기 중에도 소유 스레드의 작업은 계속 처리
 * }
 *
 * // 또는
 * pool.completion().drive(Thread::yield);
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class CompletionBarrier implements Iterable<Long> {

    private final LongSupplier pendingCount;

    private CompletionBarrier(LongSupplier pendingCount) {
        this.pendingCount = pendingCount;
    }

    /**
     * pending 카운트 공급자로 barrier 생성.
     *
     * @param pendingCount pending 카운트 공급자
     * @return CompletionBarrier
     * @throws IllegalArgumentException pendingCount가 null인 경우
     */
    public static CompletionBarrier of(LongSupplier pendingCount) {
        if (pendingCount == null) {
            throw new IllegalArgumentException("pendingCount cannot be null");
        }
        return new CompletionBarrier(pendingCount);
    }

    /**
     * Dispatcher의 pending 카운트를 기다리는 barrier 생성.
     *
     * @param dispatcher 대상 Dispatcher
     * @return CompletionBarrier
     * @throws IllegalArgumentException dispatcher가 null인 경우
     */
    public static CompletionBarrier of(Dispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        return new CompletionBarrier(dispatcher::pendingCount);
    }

    /**
     * 모든 작업이 끝났는지 확인 (논블로킹).
     *
     * @return pending 카운트가 0이면 true
     */
    public boolean isSettled() {
        return pendingCount.getAsLong() <= 0;
    }

    /**
     * 모든 작업이 끝날 때까지 라운드마다 betweenRounds를 실행.
     *
     * @param betweenRounds 라운드 사이에 실행할 동작 (예: {@code Thread::yield}, {@code reactor::pump})
     * @return 실행한 라운드 수
     * @throws IllegalArgumentException betweenRounds가 null인 경우
     */
    public long drive(Runnable betweenRounds) {
        if (betweenRounds == null) {
            throw new IllegalArgumentException("betweenRounds cannot be null");
        }

        long rounds = 0;
        Iterator<Long> it = iterator();
        while (it.hasNext()) {
            it.next();
            betweenRounds.run();
            rounds++;
        }
        return rounds;
    }

    @Override
    public Iterator<Long> iterator() {
        return new Iterator<>() {
            private long last;

            @Override
            public boolean hasNext() {
                last = pendingCount.getAsLong();
                return last > 0;
            }

            @Override
            public Long next() {
                if (last <= 0 && !hasNext()) {
                    throw new NoSuchElementException("All work completed");
                }
                long current = last;
                last = 0;
                return current;
            }
        };
    }
}
