package com.system.packsolver.schemas.algorithm.BranchAndBound;

import com.system.packsolver.config.Constants;

/**
 * One internal node on the explicit work stack.
 *
 * Branches are tried in order: each container of {@code containerOrder}, then leaving the item out.
 * While a container branch is being explored the item's weight sits in {@code placedContainer};
 * the frame takes it back out before its next branch.
 */
final class SearchFrame {

    final int cursor;
    final double bound;
    final int[] containerOrder;

    int nextBranch;
    boolean exclusionTried;

    private int placedContainer = Constants.UNASSIGNED;
    private double weightBeforePlacement;
    private double baseValueBeforePlacement;

    SearchFrame(int cursor, double bound, int[] containerOrder) {
        this.cursor = cursor;
        this.bound = bound;
        this.containerOrder = containerOrder;
    }

    boolean hasPendingContainer() {
        return nextBranch < containerOrder.length;
    }

    void place(SearchState state, int container) {
        weightBeforePlacement = state.containerWeight(container);
        baseValueBeforePlacement = state.getBaseValue();
        placedContainer = container;
        state.place(cursor, container);
    }

    void undoPlacement(SearchState state) {
        if (placedContainer != Constants.UNASSIGNED) {
            state.restore(cursor, placedContainer, weightBeforePlacement, baseValueBeforePlacement);
            placedContainer = Constants.UNASSIGNED;
        }
    }
}
