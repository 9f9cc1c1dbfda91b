package com.ryuqq.offload.core.result;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Completion Sealed Interface 테스트.
 *
 * @author Offload Team
 * @since 1.0.0
 */
class CompletionTest {

    @Test
    void success_IsSuccess_ReturnsTrue() {
        // Given
        Completion<String> completion = Completion.success("payload");

        // When & Then
        assertTrue(completion.isSuccess());
        assertEquals(ResultState.SUCCEEDED, completion.state());
        assertEquals("payload", ((Success<String>) completion).value());
    }

    @Test
    void success_AllowsNullValue() {
        // Given
        Completion<Void> completion = Completion.success(null);

        // When & Then
        assertTrue(completion.isSuccess());
        assertNull(((Success<Void>) completion).value());
    }

    @Test
    void failure_IsSuccess_ReturnsFalse() {
        // Given
        RuntimeException boom = new RuntimeException("boom");
        Completion<String> completion = Completion.failure(boom);

        // When & Then
        assertFalse(completion.isSuccess());
        assertEquals(ResultState.FAILED, completion.state());
        assertSame(boom, ((Failure<String>) completion).exception());
    }

    @Test
    void failure_WithNullException_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Completion.failure(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void instanceofDispatch_HandlesBothCases() {
        // Given
        Completion<Integer> ok = Completion.success(7);
        Completion<Integer> failed = Completion.failure(new IllegalStateException("nope"));

        // When & Then
        assertEquals("value=7", describe(ok));
        assertEquals("error=nope", describe(failed));
    }

    private static String describe(Completion<Integer> completion) {
        if (completion instanceof Success<Integer> success) {
            return "value=" + success.value();
        }
        return "error=" + ((Failure<Integer>) completion).exception().getMessage();
    }
}
