package com.ryuqq.offload.adapter.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerGroup 유닛 테스트.
 *
 * @author Offload Team
 * @since 1.0.0
 */
@Timeout(value = 5, unit = TimeUnit.SECONDS)
class WorkerGroupTest {

    @Test
    void 설정대로_스레드_이름과_데몬_여부를_지정함() {
        // given
        WorkerPoolConfig config = new WorkerPoolConfig(3, "group-test-", true);

        // when
        WorkerGroup group = new WorkerGroup(config, index -> () -> { });
        group.join();

        // then
        List<Thread> threads = group.threads();
        assertThat(group.size()).isEqualTo(3);
        assertThat(threads).extracting(Thread::getName)
            .containsExactly("group-test-0", "group-test-1", "group-test-2");
        assertThat(threads).allMatch(Thread::isDaemon);
    }

    @Test
    void 인덱스별_Runnable을_각_스레드에서_실행함() throws InterruptedException {
        // given
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch done = new CountDownLatch(4);

        // when
        WorkerGroup group = new WorkerGroup(new WorkerPoolConfig(4, "group-test-", true), index -> () -> {
            seen.add(index);
            done.countDown();
        });

        // then
        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        group.join();
        assertThat(seen).containsExactlyInAnyOrder(0, 1, 2, 3);
        assertThat(group.threads()).noneMatch(Thread::isAlive);
    }

    @Test
    void null_파라미터는_예외_발생() {
        WorkerPoolConfig config = new WorkerPoolConfig(1, "group-test-", true);

        assertThatThrownBy(() -> new WorkerGroup(null, index -> () -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> new WorkerGroup(config, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bodyFactory cannot be null");
    }
}
