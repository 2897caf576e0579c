package com.system.packsolver.schemas.algorithm.BranchAndBound;

/**
 * Best complete assignment seen during one solve call.
 */
final class BestState {

    private int[] assignment;
    private double totalValue;

    BestState(int[] assignment, double totalValue) {
        this.assignment = assignment.clone();
        this.totalValue = totalValue;
    }

    /**
     * Keep a copy of {@code candidate} if it is strictly better than the current best.
     */
    boolean offer(int[] candidate, double candidateValue) {
        if (candidateValue > totalValue) {
            assignment = candidate.clone();
            totalValue = candidateValue;
            return true;
        }
        return false;
    }

    int[] getAssignment() {
        return assignment.clone();
    }

    double getTotalValue() {
        return totalValue;
    }
}
