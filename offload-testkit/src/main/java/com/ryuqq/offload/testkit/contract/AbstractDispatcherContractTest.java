package com.ryuqq.offload.testkit.contract;

import com.ryuqq.offload.core.exception.DisposedException;
import com.ryuqq.offload.core.exception.TaskFailedException;
import com.ryuqq.offload.core.result.Result;
import com.ryuqq.offload.core.result.ValueResult;
import com.ryuqq.offload.core.spi.Dispatcher;
import com.ryuqq.offload.core.spi.UnobservedExceptionSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for Dispatcher Contract Tests.
 *
 * <p>Every {@link Dispatcher} implementation must pass these scenarios. Subclasses only provide
 * the dispatcher under test and, where needed, how to shut it down.</p>
 *
 * <p><strong>Contract Scenarios:</strong></p>
 * <ul>
 *   <li>Value delivery: the returned value is readable from the result</li>
 *   <li>Exception capture: a throwing submission completes its result instead of propagating</li>
 *   <li>Containment: a failing submission never affects other submissions</li>
 *   <li>Exactly once: every submission runs exactly once</li>
 *   <li>Pending count: zero once every result was observed done</li>
 *   <li>Disposal: submitting to a closed dispatcher throws {@link DisposedException}</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyDispatcherContractTest extends AbstractDispatcherContractTest {
 *     {@literal @}Override
 *     protected Dispatcher createDispatcher(UnobservedExceptionSink sink) {
 *         return new MyDispatcher(sink);
 *     }
 * }
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
@Timeout(value = 10, unit = TimeUnit.SECONDS)
public abstract class AbstractDispatcherContractTest {

    protected RecordingUnobservedExceptionSink sink;
    protected Dispatcher dispatcher;

    /**
     * Creates the dispatcher under test.
     *
     * @param sink the sink the dispatcher must report unobserved failures to
     * @return a fresh dispatcher
     */
    protected abstract Dispatcher createDispatcher(UnobservedExceptionSink sink);

    /**
     * Shuts the dispatcher down. Called by the disposal scenario and after each test.
     *
     * <p>The default closes dispatchers that are {@link AutoCloseable}.</p>
     *
     * @param dispatcher the dispatcher to close
     * @throws Exception if closing fails
     */
    protected void closeDispatcher(Dispatcher dispatcher) throws Exception {
        if (dispatcher instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpDispatcher() {
        sink = new RecordingUnobservedExceptionSink();
        dispatcher = createDispatcher(sink);
    }

    /**
     * Closes the dispatcher after each test.
     *
     * @throws Exception if closing fails
     */
    @AfterEach
    void tearDownDispatcher() throws Exception {
        if (dispatcher != null) {
            closeDispatcher(dispatcher);
        }
    }

    @Test
    void testSubmitTyped_DeliversReturnedValue() {
        // Given
        ValueResult<String> result = dispatcher.submitTyped(() -> "encoded");

        // When
        String value = result.getValue();

        // Then
        assertThat(value).isEqualTo("encoded");
        assertThat(result.isDone()).isTrue();
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void testSubmit_WhenWorkThrows_CapturesExceptionInResult() {
        // Given
        IllegalStateException boom = new IllegalStateException("boom");

        // When
        Result result = dispatcher.submit(() -> {
            throw boom;
        });

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getException()).isSameAs(boom);
    }

    @Test
    void testSubmitTyped_WhenCheckedExceptionThrown_CapturesOriginal() {
        // Given
        IOException ioFailure = new IOException("disk full");

        // When
        ValueResult<Integer> result = dispatcher.submitTyped(() -> {
            throw ioFailure;
        });

        // Then
        assertThatThrownBy(result::getValue)
            .isInstanceOf(TaskFailedException.class)
            .hasCause(ioFailure);
    }

    @Test
    void testFailingSubmission_DoesNotAffectOthers() {
        // Given
        List<ValueResult<Integer>> results = new ArrayList<>();

        // When: every other submission fails
        for (int i = 0; i < 20; i++) {
            int index = i;
            results.add(dispatcher.submitTyped(() -> {
                if (index % 2 == 1) {
                    throw new IllegalArgumentException("odd " + index);
                }
                return index;
            }));
        }

        // Then
        for (int i = 0; i < results.size(); i++) {
            ValueResult<Integer> result = results.get(i);
            if (i % 2 == 1) {
                assertThat(result.getException()).hasMessage("odd " + i);
            } else {
                assertThat(result.getValue()).isEqualTo(i);
            }
        }
    }

    @Test
    void testEverySubmission_RunsExactlyOnce() {
        // Given
        AtomicInteger executions = new AtomicInteger();
        List<Result> results = new ArrayList<>();

        // When
        for (int i = 0; i < 100; i++) {
            results.add(dispatcher.submit(executions::incrementAndGet));
        }
        results.forEach(Result::await);

        // Then
        assertThat(executions.get()).isEqualTo(100);
    }

    @Test
    void testPendingCount_IsZeroOnceAllResultsDone() {
        // Given
        List<Result> results = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            results.add(dispatcher.submit(() -> Thread.sleep(1)));
        }

        // When
        results.forEach(Result::await);

        // Then
        assertThat(results).allMatch(Result::isDone);
        assertThat(dispatcher.pendingCount()).isZero();
    }

    @Test
    void testSubmitToSlot_WritesValueIntoSlot() {
        // Given
        String[] slots = new String[3];

        // When
        Result result = dispatcher.submitToSlot(slots, 1, () -> "middle");
        result.await();

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(slots).containsExactly(null, "middle", null);
    }

    @Test
    void testSubmitToSlot_WithInvalidIndex_ThrowsBeforeQueueing() {
        // Given
        String[] slots = new String[3];

        // When & Then
        assertThatThrownBy(() -> dispatcher.submitToSlot(slots, 3, () -> "out"))
            .isInstanceOf(IndexOutOfBoundsException.class)
            .hasMessageContaining("[0:2]");
        assertThat(dispatcher.pendingCount()).isZero();
    }

    @Test
    void testSubmit_WithNullWork_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> dispatcher.submit(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> dispatcher.submitTyped(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSubmit_AfterClose_ThrowsDisposedException() throws Exception {
        // Given
        closeDispatcher(dispatcher);

        // When & Then
        assertThatThrownBy(() -> dispatcher.submit(() -> { }))
            .isInstanceOf(DisposedException.class);
        assertThatThrownBy(() -> dispatcher.submitTyped(() -> 1))
            .isInstanceOf(DisposedException.class);
    }

    @Test
    void testObservedFailure_IsNotReportedToSink() {
        // Given
        Result result = dispatcher.submit(() -> {
            throw new IllegalStateException("seen");
        });

        // When
        assertThat(result.getException()).hasMessage("seen");

        // Then
        assertThat(sink.reported()).isEmpty();
    }
}
