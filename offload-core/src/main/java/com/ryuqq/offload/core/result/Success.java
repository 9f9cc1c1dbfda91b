package com.ryuqq.offload.core.result;

/**
 * 성공적으로 완료된 작업.
 *
 * @param value 작업 반환값 (값이 없는 작업은 null)
 * @param <T> 값 타입
 * @author Offload Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Completion<T> {
}
