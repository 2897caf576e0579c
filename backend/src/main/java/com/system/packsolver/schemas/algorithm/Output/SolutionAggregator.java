package com.system.packsolver.schemas.algorithm.Output;

import com.system.packsolver.config.Constants;
import com.system.packsolver.schemas.ContainerResultSchema;
import com.system.packsolver.schemas.ItemSchema;
import com.system.packsolver.schemas.SolutionSchema;
import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Input.SynergyTable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a sorted-order assignment into per-container results and a verified total.
 *
 * Items are listed in each container in their original input order. Totals are recomputed
 * from the items themselves, never copied from the search.
 */
public class SolutionAggregator {

    public SolutionSchema aggregate(PackingInstance instance, AssignmentResult result) {
        int[] sortedAssignment = result.getSortedAssignment();
        if (sortedAssignment.length != instance.itemCount()) {
            throw new IllegalStateException("Assignment has " + sortedAssignment.length
                + " entries for " + instance.itemCount() + " items");
        }

        // Weights are summed in sorted order, the order the algorithms fill containers in
        int[] originalAssignment = new int[instance.itemCount()];
        Arrays.fill(originalAssignment, Constants.UNASSIGNED);
        double[] weights = new double[instance.containerCount()];
        for (int i = 0; i < sortedAssignment.length; i++) {
            int container = sortedAssignment[i];
            if (container == Constants.UNASSIGNED) {
                continue;
            }
            if (container < 0 || container >= instance.containerCount()) {
                throw new IllegalStateException("Item at sorted position " + i
                    + " assigned to unknown container " + container);
            }
            weights[container] += instance.weight(i);
            originalAssignment[instance.originalIndexOf(i)] = container;
        }

        List<List<ItemSchema>> containerItems = new ArrayList<>(instance.containerCount());
        for (int c = 0; c < instance.containerCount(); c++) {
            containerItems.add(new ArrayList<>());
        }
        List<ItemSchema> originalItems = instance.getOriginalItems();
        for (int i = 0; i < originalAssignment.length; i++) {
            if (originalAssignment[i] != Constants.UNASSIGNED) {
                containerItems.get(originalAssignment[i]).add(originalItems.get(i));
            }
        }

        SynergyTable synergyTable = instance.getSynergyTable();
        List<ContainerResultSchema> containers = new ArrayList<>(instance.containerCount());
        double totalValue = 0.0;

        for (int c = 0; c < instance.containerCount(); c++) {
            List<ItemSchema> items = containerItems.get(c);
            double weight = weights[c];
            double baseValue = 0.0;
            for (ItemSchema item : items) {
                baseValue += item.getValue();
            }

            double capacity = instance.capacity(c);
            if (weight > capacity) {
                throw new IllegalStateException("Container " + c + " holds " + weight
                    + " but its capacity is " + capacity);
            }

            double synergyBonus = synergyTable.synergyBonus(items);
            double containerValue = baseValue + synergyBonus;
            totalValue += containerValue;

            containers.add(ContainerResultSchema.builder()
                .index(c)
                .items(items)
                .totalWeight(weight)
                .capacity(capacity)
                .baseValue(baseValue)
                .synergyBonus(synergyBonus)
                .totalValue(containerValue)
                .build());
        }

        List<Integer> assignment = new ArrayList<>(originalAssignment.length);
        for (int container : originalAssignment) {
            assignment.add(container);
        }

        return SolutionSchema.builder()
            .containers(containers)
            .totalValue(totalValue)
            .universeCount(universeCount(instance.containerCount(), instance.itemCount()))
            .assignment(assignment)
            .complete(result.isComplete())
            .nodesExplored(result.getNodesExplored())
            .build();
    }

    /**
     * Number of raw assignments: every item goes to one of the containers or nowhere.
     */
    public static BigInteger universeCount(int containers, int items) {
        return BigInteger.valueOf(containers + 1L).pow(items);
    }
}
