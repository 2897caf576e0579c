package com.system.packsolver.schemas.algorithm;

import com.system.packsolver.schemas.ItemCategory;
import com.system.packsolver.schemas.ItemSchema;
import com.system.packsolver.schemas.SynergyRuleSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Small builders shared by the algorithm tests.
 */
public final class PackingFixtures {

    private PackingFixtures() {
    }

    public static ItemSchema item(int id, String name, double weight, double value) {
        return ItemSchema.builder()
            .id(id)
            .name(name)
            .weight(weight)
            .value(value)
            .category(ItemCategory.OTHER)
            .build();
    }

    public static SynergyRuleSchema rule(double bonus, String... names) {
        return SynergyRuleSchema.builder()
            .items(List.of(names))
            .bonus(bonus)
            .build();
    }

    public static List<Double> capacities(double... capacities) {
        List<Double> list = new ArrayList<>();
        for (double capacity : capacities) {
            list.add(capacity);
        }
        return list;
    }

    /**
     * Items with integer weights 1-5 and values 10-200 named "item-0", "item-1", ...
     */
    public static List<ItemSchema> randomItems(Random random, int count) {
        List<ItemSchema> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(item(i, "item-" + i, random.nextInt(5) + 1, random.nextInt(191) + 10));
        }
        return items;
    }

    /**
     * Items with weights in tenths (0.1-3.0) and integer values 10-200, named like {@link #randomItems}.
     */
    public static List<ItemSchema> randomDecimalItems(Random random, int count) {
        List<ItemSchema> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(item(i, "item-" + i, (random.nextInt(30) + 1) / 10.0, random.nextInt(191) + 10));
        }
        return items;
    }

    /**
     * Capacity in tenths between 1.0 and 4.9.
     */
    public static double randomCapacity(Random random) {
        return (random.nextInt(40) + 10) / 10.0;
    }
}
