package com.system.packsolver.schemas.algorithm.Output;

import com.system.packsolver.config.Constants;
import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Input.SynergyTable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class AssignmentEvaluator {

    private AssignmentEvaluator() {
    }

    /**
     * Sum over containers of (packed base value + synergy bonus of that container).
     *
     * @param sortedAssignment container index or {@link Constants#UNASSIGNED} per sorted item
     */
    public static double totalValue(PackingInstance instance, int[] sortedAssignment) {
        int containers = instance.containerCount();
        double[] baseValues = new double[containers];
        List<Set<String>> names = new ArrayList<>(containers);
        for (int c = 0; c < containers; c++) {
            names.add(new HashSet<>());
        }

        for (int i = 0; i < sortedAssignment.length; i++) {
            int container = sortedAssignment[i];
            if (container != Constants.UNASSIGNED) {
                baseValues[container] += instance.value(i);
                names.get(container).add(instance.sortedItem(i).getName());
            }
        }

        SynergyTable synergyTable = instance.getSynergyTable();
        double total = 0.0;
        for (int c = 0; c < containers; c++) {
            total += baseValues[c] + synergyTable.synergyBonusForNames(names.get(c));
        }
        return total;
    }
}
