package com.system.packsolver.schemas.algorithm.Greedy;

import com.system.packsolver.config.Constants;
import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Output.AssignmentEvaluator;
import com.system.packsolver.schemas.algorithm.Output.AssignmentResult;

import java.util.Arrays;

/**
 * Single pass over the items in ratio order: each item goes to the container with the most room
 * left that still fits it (lowest index on ties), or is left out.
 *
 * Fast but not optimal; the branch-and-bound search uses it as its starting best solution.
 */
public class GreedyPacker {

    public int[] pack(PackingInstance instance) {
        int[] assignment = new int[instance.itemCount()];
        Arrays.fill(assignment, Constants.UNASSIGNED);
        double[] used = new double[instance.containerCount()];

        for (int i = 0; i < instance.itemCount(); i++) {
            double weight = instance.weight(i);
            int bestContainer = Constants.UNASSIGNED;
            double bestRemaining = -1.0;

            for (int c = 0; c < instance.containerCount(); c++) {
                double remaining = instance.capacity(c) - used[c];
                if (used[c] + weight <= instance.capacity(c) && remaining > bestRemaining) {
                    bestContainer = c;
                    bestRemaining = remaining;
                }
            }

            if (bestContainer != Constants.UNASSIGNED) {
                assignment[i] = bestContainer;
                used[bestContainer] += weight;
            }
        }
        return assignment;
    }

    public AssignmentResult solve(PackingInstance instance) {
        int[] assignment = pack(instance);
        return new AssignmentResult(assignment, AssignmentEvaluator.totalValue(instance, assignment),
            true, instance.itemCount());
    }
}
