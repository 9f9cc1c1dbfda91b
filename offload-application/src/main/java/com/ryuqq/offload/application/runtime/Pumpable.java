package com.ryuqq.offload.application.runtime;

/**
 * Component driven by explicit pump cycles on a designated thread.
 *
 * <p>Some hosts own a thread that must never block (a UI or game loop, an event loop) and
 * that is the only thread allowed to touch certain state. Work targeted at that thread is queued
 * from anywhere and executed when the owner calls {@link #pump()} once per iteration of its loop.</p>
 *
 * <p><strong>Pump Cycle:</strong></p>
 * <pre>
 * owner loop iteration
 *   ↓
 * pump()
 *   1. Move everything queued so far into the in-progress queue (under one lock)
 *   2. Run it in submission order
 *   3. Anything queued while running waits for the next pump()
 *   ↓
 * rest of the iteration
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() must be called from the owning thread only</li>
 *   <li>pump() never blocks waiting for new work; it returns once the in-progress queue is drained</li>
 *   <li>The caller is responsible for calling pump() repeatedly</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * while (running) {
 *     reactor.pump();
 *     renderFrame();
 * }
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public interface Pumpable {

    /**
     * Runs one pump cycle: takes the queued work and executes it in FIFO order.
     *
     * <p>Work submitted while the cycle runs is deferred to the next cycle, so a task that
     * re-submits itself cannot starve the owning thread.</p>
     *
     * @throws IllegalStateException if called from a thread other than the owner
     */
    void pump();
}
