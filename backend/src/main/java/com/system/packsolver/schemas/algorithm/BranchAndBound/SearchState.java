package com.system.packsolver.schemas.algorithm.BranchAndBound;

import com.system.packsolver.config.Constants;
import com.system.packsolver.schemas.algorithm.Input.PackingInstance;

import java.util.Arrays;

/**
 * Mutable state of the depth-first search: the assignment under construction (sorted order),
 * the weight currently held by each container and the base value packed so far.
 *
 * Every mutation is paired with an exact restore by its {@link SearchFrame}, so a branch never
 * sees what a sibling branch packed.
 */
final class SearchState {

    private final PackingInstance instance;
    private final int[] assignment;
    private final double[] containerWeights;
    private double baseValue;

    SearchState(PackingInstance instance) {
        this.instance = instance;
        this.assignment = new int[instance.itemCount()];
        this.containerWeights = new double[instance.containerCount()];
        Arrays.fill(assignment, Constants.UNASSIGNED);
    }

    void place(int cursor, int container) {
        assignment[cursor] = container;
        containerWeights[container] += instance.weight(cursor);
        baseValue += instance.value(cursor);
    }

    /**
     * Undo a {@link #place} by restoring the values saved before it.
     */
    void restore(int cursor, int container, double previousWeight, double previousBaseValue) {
        assignment[cursor] = Constants.UNASSIGNED;
        containerWeights[container] = previousWeight;
        baseValue = previousBaseValue;
    }

    void leaveOut(int cursor) {
        assignment[cursor] = Constants.UNASSIGNED;
    }

    /**
     * True when {@code weight} can be added to {@code container}. Compares the sum the container
     * would hold after {@link #place}, so the accumulated weight never passes the capacity.
     */
    boolean fits(int container, double weight) {
        return containerWeights[container] + weight <= instance.capacity(container);
    }

    double remainingCapacity(int container) {
        return instance.capacity(container) - containerWeights[container];
    }

    /**
     * Sum of every container's unused capacity.
     */
    double pooledRemainingCapacity() {
        double pooled = 0.0;
        for (int c = 0; c < containerWeights.length; c++) {
            pooled += Math.max(0.0, remainingCapacity(c));
        }
        return pooled;
    }

    double containerWeight(int container) {
        return containerWeights[container];
    }

    double getBaseValue() {
        return baseValue;
    }

    int[] assignment() {
        return assignment;
    }
}
