package com.system.packsolver.schemas.algorithm.BranchAndBound;

import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Input.SynergyTable;

/**
 * Optimistic estimate of the value still reachable below a search node.
 *
 * The remaining capacity of every container is pooled into one number and the remaining items
 * are taken in ratio order, the first one that does not fit contributing a fractional share of its
 * value. This relaxes both container separation and integrality, so it never underestimates the
 * base value left. A fixed slack ({@code slackRatio} times the sum of every synergy bonus) is
 * added on top as an allowance for synergies; that part is a heuristic, not a proven bound.
 */
public class BoundEstimator {

    private final double synergySlack;

    public BoundEstimator(SynergyTable synergyTable, double slackRatio) {
        if (!Double.isFinite(slackRatio) || slackRatio < 0) {
            throw new IllegalArgumentException("Synergy slack ratio must be finite and >= 0, got " + slackRatio);
        }
        this.synergySlack = slackRatio * synergyTable.totalBonus();
    }

    /**
     * Fractional-relaxation value of the items from {@code cursor} to the end packed into
     * {@code pooledCapacity}.
     */
    public double fractionalBound(PackingInstance instance, int cursor, double pooledCapacity) {
        double bound = 0.0;
        double remaining = pooledCapacity;

        for (int i = cursor; i < instance.itemCount() && remaining > 0; i++) {
            double weight = instance.weight(i);
            if (weight <= remaining) {
                bound += instance.value(i);
                remaining -= weight;
            } else {
                bound += instance.value(i) * (remaining / weight);
                break;
            }
        }
        return bound;
    }

    /**
     * Upper estimate of the total reachable from a node that has already packed
     * {@code currentBaseValue}.
     */
    public double bound(PackingInstance instance, int cursor, double pooledCapacity, double currentBaseValue) {
        return currentBaseValue + fractionalBound(instance, cursor, pooledCapacity) + synergySlack;
    }

    public double getSynergySlack() {
        return synergySlack;
    }
}
