package com.system.packsolver.schemas.algorithm.BranchAndBound;

/**
 * Cooperative stop condition, polled by the search before every branch attempt.
 */
@FunctionalInterface
public interface SearchBudget {

    boolean exhausted();

    static SearchBudget unlimited() {
        return () -> false;
    }

    /**
     * Budget that runs out {@code totalMs} after this call; {@code totalMs <= 0} means unlimited.
     * Any positive {@code totalMs} works, up to {@link Long#MAX_VALUE}.
     */
    static SearchBudget ofMillis(long totalMs) {
        if (totalMs <= 0) {
            return unlimited();
        }
        long start = System.currentTimeMillis();
        return () -> System.currentTimeMillis() - start >= totalMs;
    }
}
