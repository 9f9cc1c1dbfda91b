package com.ryuqq.offload.adapter.runner;

import com.ryuqq.offload.core.exception.DisposedException;
import com.ryuqq.offload.core.result.Result;
import com.ryuqq.offload.core.result.ValueResult;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Reactor 유닛 테스트.
 *
 * <p>테스트 스레드가 Reactor를 생성하므로 소유 스레드는 테스트 스레드입니다.
 * 다른 스레드에서의 제출은 {@link #fromOtherThread(Runnable)}로 수행합니다.</p>
 *
 * @author Offload Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@Timeout(value = 5, unit = TimeUnit.SECONDS)
class ReactorTest {

    @Mock
    private UnobservedExceptionSink sink;

    private Reactor reactor;

    @BeforeEach
    void setUp() {
        reactor = new Reactor(Thread.currentThread(), sink);
    }

    // ============================================================
    // 1. 스레드 친화성
    // ============================================================

    @Test
    void 다른_스레드에서_제출하면_즉시_실행되지_않고_pump에서_한_번만_실행됨() throws InterruptedException {
        // given
        AtomicInteger executions = new AtomicInteger();
        AtomicReference<Thread> executedOn = new AtomicReference<>();
        AtomicReference<Result> result = new AtomicReference<>();

        // when
        fromOtherThread(() -> result.set(reactor.submit(() -> {
            executions.incrementAndGet();
            executedOn.set(Thread.currentThread());
        })));

        // then
        assertThat(executions.get()).isZero();
        assertThat(result.get().isDone()).isFalse();
        assertThat(reactor.pendingCount()).isEqualTo(1);

        reactor.pump();
        reactor.pump();

        assertThat(executions.get()).isEqualTo(1);
        assertThat(executedOn.get()).isSameAs(Thread.currentThread());
        assertThat(result.get().isSuccess()).isTrue();
        assertThat(reactor.pendingCount()).isZero();
    }

    @Test
    void 소유_스레드에서_제출하면_즉시_실행되고_완료된_Result를_반환함() {
        // when
        ValueResult<String> result = reactor.submitTyped(() -> "inline");

        // then
        assertThat(result.isDone()).isTrue();
        assertThat(result.getValue()).isEqualTo("inline");
        assertThat(reactor.pendingCount()).isZero();
    }

    @Test
    void pump는_제출된_순서대로_실행함() throws InterruptedException {
        // given
        List<Integer> order = new ArrayList<>();
        fromOtherThread(() -> {
            for (int i = 0; i < 10; i++) {
                int index = i;
                reactor.submit(() -> order.add(index));
            }
        });

        // when
        reactor.pump();

        // then
        assertThat(order).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    @Test
    void pump_중에_제출된_작업은_다음_pump에서_실행됨() throws InterruptedException {
        // given: the first task makes another thread submit a follow-up
        AtomicInteger followUps = new AtomicInteger();
        fromOtherThread(() -> reactor.submit(() ->
            fromOtherThread(() -> reactor.submit(followUps::incrementAndGet))
        ));

        // when
        reactor.pump();

        // then
        assertThat(followUps.get()).isZero();
        assertThat(reactor.pendingCount()).isEqualTo(1);

        reactor.pump();
        assertThat(followUps.get()).isEqualTo(1);
    }

    @Test
    void 작업_안에서_다시_pump해도_각_작업은_한_번씩_순서대로_실행됨() throws InterruptedException {
        // given
        List<String> order = new ArrayList<>();
        List<Result> results = new ArrayList<>();
        fromOtherThread(() -> {
            results.add(reactor.submit(() -> {
                order.add("outer");
                fromOtherThread(() -> results.add(reactor.submit(() -> order.add("x"))));
                reactor.pump();
                fromOtherThread(() -> results.add(reactor.submit(() -> order.add("y"))));
            }));
            results.add(reactor.submit(() -> order.add("queued")));
        });

        // when
        reactor.pump();

        // then
        assertThat(order).containsExactly("outer", "queued", "x");
        assertThat(reactor.pendingCount()).isEqualTo(1);

        reactor.pump();
        reactor.pump();
        assertThat(order).containsExactly("outer", "queued", "x", "y");
        assertThat(results).hasSize(4).allMatch(Result::isSuccess);
        assertThat(reactor.pendingCount()).isZero();
    }

    @Test
    void 소유_스레드가_아닌_곳에서_pump하면_IllegalStateException() throws InterruptedException {
        // given
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        // when
        fromOtherThread(() -> {
            try {
                reactor.pump();
            } catch (Throwable e) {
                thrown.set(e);
            }
        });

        // then
        assertThat(thrown.get())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("owner thread");
    }

    @Test
    void 지정한_소유_스레드가_아니면_isOwnerThread는_false() {
        // given
        Thread owner = new Thread(() -> { }, "render");
        Reactor bound = new Reactor(owner, sink);

        // when & then
        assertThat(bound.owner()).isSameAs(owner);
        assertThat(bound.isOwnerThread()).isFalse();
        assertThatThrownBy(bound::pump).isInstanceOf(IllegalStateException.class);
    }

    // ============================================================
    // 2. 예외 처리
    // ============================================================

    @Test
    void pump_중_예외를_던진_작업은_다음_작업을_막지_않음() throws InterruptedException {
        // given
        AtomicReference<Result> failed = new AtomicReference<>();
        AtomicReference<ValueResult<Integer>> next = new AtomicReference<>();
        fromOtherThread(() -> {
            failed.set(reactor.submit(() -> {
                throw new IllegalStateException("scene missing");
            }));
            next.set(reactor.submitTyped(() -> 7));
        });

        // when
        reactor.pump();

        // then
        assertThat(failed.get().getException()).hasMessage("scene missing");
        assertThat(next.get().getValue()).isEqualTo(7);
    }

    @Test
    void 외부에서_이미_완료된_Result가_있어도_pump는_계속_진행함() throws InterruptedException {
        // given
        AtomicReference<Result> hijacked = new AtomicReference<>();
        AtomicReference<ValueResult<Integer>> next = new AtomicReference<>();
        fromOtherThread(() -> {
            hijacked.set(reactor.submit(() -> { }));
            next.set(reactor.submitTyped(() -> 3));
        });
        hijacked.get().complete(null);

        // when
        reactor.pump();

        // then
        assertThat(next.get().getValue()).isEqualTo(3);
        assertThat(reactor.pendingCount()).isZero();
    }

    // ============================================================
    // 3. 종료
    // ============================================================

    @Test
    void close_는_대기_중인_작업을_버리고_이후_제출을_거부함() throws InterruptedException {
        // given
        AtomicInteger executions = new AtomicInteger();
        AtomicReference<Result> abandoned = new AtomicReference<>();
        fromOtherThread(() -> abandoned.set(reactor.submit(executions::incrementAndGet)));

        // when
        reactor.close();
        reactor.pump();

        // then
        assertThat(executions.get()).isZero();
        assertThat(abandoned.get().isDone()).isFalse();
        assertThat(reactor.pendingCount()).isZero();
        assertThatThrownBy(() -> reactor.submit(() -> { }))
            .isInstanceOf(DisposedException.class);

        AtomicReference<Throwable> fromOther = new AtomicReference<>();
        fromOtherThread(() -> {
            try {
                reactor.submit(() -> { });
            } catch (Throwable e) {
                fromOther.set(e);
            }
        });
        assertThat(fromOther.get()).isInstanceOf(DisposedException.class);
    }

    @Test
    void 생성자_owner가_null이면_예외() {
        assertThatThrownBy(() -> new Reactor(null, sink))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("owner cannot be null");
    }

    private static void fromOtherThread(Runnable action) {
        Thread thread = new Thread(action, "submitter");
        thread.start();
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for submitter", e);
        }
    }
}
