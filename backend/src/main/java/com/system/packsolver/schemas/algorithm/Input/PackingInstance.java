package com.system.packsolver.schemas.algorithm.Input;

import com.system.packsolver.schemas.ItemSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Validated input of one solve call.
 *
 * Items are kept both in their original order and sorted by descending value/weight ratio.
 * The sort is stable, so items with equal ratio keep their input order and repeated solves
 * of the same input always walk the items in the same sequence.
 */
public class PackingInstance {

    private final List<ItemSchema> originalItems;
    private final List<ItemSchema> sortedItems;
    private final int[] originalIndex;       // sorted position -> original position
    private final double[] sortedWeights;
    private final double[] sortedValues;
    private final double[] capacities;
    private final SynergyTable synergyTable;

    private PackingInstance(List<ItemSchema> originalItems, int[] order, double[] capacities,
                            SynergyTable synergyTable) {
        this.originalItems = Collections.unmodifiableList(new ArrayList<>(originalItems));
        this.originalIndex = order;
        this.capacities = capacities;
        this.synergyTable = synergyTable;

        int n = order.length;
        List<ItemSchema> sorted = new ArrayList<>(n);
        this.sortedWeights = new double[n];
        this.sortedValues = new double[n];
        for (int i = 0; i < n; i++) {
            ItemSchema item = originalItems.get(order[i]);
            sorted.add(item);
            sortedWeights[i] = item.getWeight();
            sortedValues[i] = item.getValue();
        }
        this.sortedItems = Collections.unmodifiableList(sorted);
    }

    /**
     * Validates the input and builds the ratio-sorted view.
     *
     * @throws InvalidPackingConfigurationException if no container is supplied
     * @throws InvalidPackingInputException         if an item or capacity breaks the model constraints
     */
    public static PackingInstance of(List<ItemSchema> items, List<Double> capacities, SynergyTable synergyTable) {
        if (capacities == null || capacities.isEmpty()) {
            throw new InvalidPackingConfigurationException("At least one container is required");
        }

        double[] caps = new double[capacities.size()];
        for (int c = 0; c < caps.length; c++) {
            Double capacity = capacities.get(c);
            if (capacity == null || !Double.isFinite(capacity) || capacity <= 0) {
                throw new InvalidPackingInputException(
                    "Container " + c + " must have a finite capacity > 0, got " + capacity);
            }
            caps[c] = capacity;
        }

        List<ItemSchema> safeItems = items != null ? items : Collections.emptyList();
        validateItems(safeItems);

        double[] ratios = new double[safeItems.size()];
        for (int i = 0; i < ratios.length; i++) {
            ItemSchema item = safeItems.get(i);
            ratios[i] = item.getValue() / item.getWeight();
        }
        int[] order = IntStream.range(0, safeItems.size())
            .boxed()
            .sorted(Comparator.comparingDouble((Integer i) -> ratios[i]).reversed())
            .mapToInt(Integer::intValue)
            .toArray();

        return new PackingInstance(safeItems, order, caps,
            synergyTable != null ? synergyTable : SynergyTable.empty());
    }

    private static void validateItems(List<ItemSchema> items) {
        Set<Integer> ids = new HashSet<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < items.size(); i++) {
            ItemSchema item = items.get(i);
            if (item == null) {
                throw new InvalidPackingInputException("Item at position " + i + " is null");
            }
            if (item.getId() == null) {
                throw new InvalidPackingInputException("Item at position " + i + " has no id");
            }
            if (item.getName() == null || item.getName().isBlank()) {
                throw new InvalidPackingInputException("Item " + item.getId() + " has no name");
            }
            Double weight = item.getWeight();
            if (weight == null || !Double.isFinite(weight) || weight <= 0) {
                throw new InvalidPackingInputException(
                    "Item " + item.getName() + " must have a finite weight > 0, got " + weight);
            }
            Double value = item.getValue();
            if (value == null || !Double.isFinite(value) || value <= 0) {
                throw new InvalidPackingInputException(
                    "Item " + item.getName() + " must have a finite value > 0, got " + value);
            }
            if (!ids.add(item.getId())) {
                throw new InvalidPackingInputException("Duplicate item id: " + item.getId());
            }
            if (!names.add(item.getName())) {
                throw new InvalidPackingInputException("Duplicate item name: " + item.getName());
            }
        }
    }

    public int itemCount() {
        return sortedItems.size();
    }

    public int containerCount() {
        return capacities.length;
    }

    public List<ItemSchema> getOriginalItems() {
        return originalItems;
    }

    public ItemSchema sortedItem(int position) {
        return sortedItems.get(position);
    }

    public int originalIndexOf(int sortedPosition) {
        return originalIndex[sortedPosition];
    }

    public double weight(int sortedPosition) {
        return sortedWeights[sortedPosition];
    }

    public double value(int sortedPosition) {
        return sortedValues[sortedPosition];
    }

    public double capacity(int container) {
        return capacities[container];
    }

    public SynergyTable getSynergyTable() {
        return synergyTable;
    }

    public String describe() {
        return sortedItems.size() + " items, " + capacities.length + " containers "
            + Arrays.stream(capacities).mapToObj(c -> String.valueOf(c))
                .collect(Collectors.joining(", ", "[", "]"))
            + ", " + synergyTable.size() + " synergy rules";
    }
}
