package com.ryuqq.offload.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/**
 * 풀의 워커 스레드 묶음.
 *
 * <p>생성 시 {@link WorkerPoolConfig}에 따라 스레드를 만들어 즉시 시작하고,
 * {@link #join()}으로 모든 스레드의 종료를 기다립니다. 스레드가 무엇을 실행할지는 소유자가
 * 인덱스별 Runnable로 결정합니다.</p>
 *
 * @author Offload Team
 * @since 1.0.0
 */
final class WorkerGroup {

    private static final Logger log = LoggerFactory.getLogger(WorkerGroup.class);

    private final List<Thread> threads;

    /**
     * 생성자. 스레드를 만들고 시작합니다.
     *
     * @param config 스레드 수, 이름 접두어, 데몬 여부
     * @param bodyFactory 워커 인덱스 → 워커 루프
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    WorkerGroup(WorkerPoolConfig config, IntFunction<Runnable> bodyFactory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (bodyFactory == null) {
            throw new IllegalArgumentException("bodyFactory cannot be null");
        }

        List<Thread> created = new ArrayList<>(config.threadCount());
        for (int i = 0; i < config.threadCount(); i++) {
            Thread thread = new Thread(bodyFactory.apply(i), config.threadNamePrefix() + i);
            thread.setDaemon(config.daemon());
            created.add(thread);
        }
        this.threads = Collections.unmodifiableList(created);

        for (Thread thread : threads) {
            thread.start();
        }

        log.debug("Started {} worker threads with prefix '{}'", threads.size(), config.threadNamePrefix());
    }

    /**
     * 모든 워커 스레드가 종료될 때까지 대기.
     *
     * <p>워커 스레드 자신이 호출하면 자기 자신은 기다리지 않습니다.</p>
     *
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    void join() {
        Thread current = Thread.currentThread();
        for (Thread thread : threads) {
            if (thread == current) {
                continue;
            }
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Interrupted while joining worker " + thread.getName(), e);
            }
        }
    }

    /**
     * 워커 스레드 목록 조회.
     *
     * @return 불변 스레드 목록
     */
    List<Thread> threads() {
        return threads;
    }

    /**
     * 워커 스레드 수 조회.
     *
     * @return 스레드 수
     */
    int size() {
        return threads.size();
    }
}
