/**
 * Runner Adapter Layer - 스레드 기반 Dispatcher 구현체.
 *
 * <p>이 패키지는 core의 {@code Dispatcher} SPI와 application의 {@code Pumpable}에 대한
 * 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.offload.adapter.runner.WorkerPool} - 고정 크기 워커 스레드 풀</li>
 *   <li>{@link com.ryuqq.offload.adapter.runner.Reactor} - 소유 스레드 전용, pump() 구동</li>
 *   <li>{@link com.ryuqq.offload.adapter.runner.ParallelProcessor} - 워커별 컨텍스트를 가진 데이터 병렬 처리기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (WorkerPool, Reactor, ParallelProcessor)
 *   ↓ implements
 * application (Pumpable, CompletionBarrier)
 *   ↓ depends on
 * core (Result, Task, Dispatcher, BufferPool)
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
package com.ryuqq.offload.adapter.runner;
