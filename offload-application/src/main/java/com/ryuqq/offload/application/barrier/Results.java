package com.ryuqq.offload.application.barrier;

import com.ryuqq.offload.core.result.Result;

/**
 * 여러 Result에 대한 블로킹 유틸리티.
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class Results {

    private Results() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 모든 Result가 완료될 때까지 대기.
     *
     * <p>예외는 조회하지 않으므로 실패한 Result는 여전히 관찰되지 않은 상태로 남습니다.</p>
     *
     * @param results 대기할 Result 목록
     * @throws IllegalArgumentException results가 null이거나 null 원소를 포함하는 경우
     */
    public static void awaitAll(Iterable<? extends Result> results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        for (Result result : results) {
            if (result == null) {
                throw new IllegalArgumentException("results cannot contain null");
            }
            result.await();
        }
    }

    /**
     * 모든 Result가 완료될 때까지 대기한 뒤 전부 성공했는지 확인.
     *
     * <p>모든 Result의 예외를 관찰된 것으로 표시합니다 (첫 실패에서 멈추지 않음).</p>
     *
     * @param results 확인할 Result 목록
     * @return 모든 Result가 예외 없이 완료되었으면 true
     * @throws IllegalArgumentException results가 null이거나 null 원소를 포함하는 경우
     */
    public static boolean allSucceeded(Iterable<? extends Result> results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        boolean succeeded = true;
        for (Result result : results) {
            if (result == null) {
                throw new IllegalArgumentException("results cannot contain null");
            }
            succeeded &= result.isSuccess();
        }
        return succeeded;
    }
}
