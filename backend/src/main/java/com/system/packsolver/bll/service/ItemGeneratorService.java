package com.system.packsolver.bll.service;

import com.system.packsolver.config.Constants;
import com.system.packsolver.config.PackingProperties;
import com.system.packsolver.schemas.GeneratedInstanceRequest;
import com.system.packsolver.schemas.ItemCategory;
import com.system.packsolver.schemas.ItemSchema;
import com.system.packsolver.schemas.PackingRequest;
import com.system.packsolver.schemas.algorithm.Input.InvalidPackingConfigurationException;
import com.system.packsolver.schemas.algorithm.Input.InvalidPackingInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Builds reproducible demo instances from a fixed item catalogue.
 *
 * Item values fall in three bands (30% high, 40% medium, 30% low); earlier items draw slightly
 * better bands so that growing the item count tends to improve the best total.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemGeneratorService {

    private static final List<CatalogEntry> CATALOG = List.of(
        // Electronics
        new CatalogEntry("Laptop", ItemCategory.ELECTRONICS),
        new CatalogEntry("Camera", ItemCategory.ELECTRONICS),
        new CatalogEntry("Headphones", ItemCategory.ELECTRONICS),
        new CatalogEntry("Drone", ItemCategory.ELECTRONICS),
        new CatalogEntry("iPad", ItemCategory.ELECTRONICS),
        new CatalogEntry("Charger", ItemCategory.ELECTRONICS),
        new CatalogEntry("Power Bank", ItemCategory.ELECTRONICS),
        new CatalogEntry("Tablet", ItemCategory.ELECTRONICS),
        new CatalogEntry("Phone", ItemCategory.ELECTRONICS),
        new CatalogEntry("Speaker", ItemCategory.ELECTRONICS),
        new CatalogEntry("Watch", ItemCategory.ELECTRONICS),
        new CatalogEntry("GPS", ItemCategory.ELECTRONICS),
        new CatalogEntry("Calculator", ItemCategory.ELECTRONICS),
        new CatalogEntry("Keyboard", ItemCategory.ELECTRONICS),
        new CatalogEntry("Mouse", ItemCategory.ELECTRONICS),
        new CatalogEntry("Monitor", ItemCategory.ELECTRONICS),
        new CatalogEntry("Printer", ItemCategory.ELECTRONICS),
        new CatalogEntry("Scanner", ItemCategory.ELECTRONICS),
        new CatalogEntry("Projector", ItemCategory.ELECTRONICS),
        new CatalogEntry("Action Camera", ItemCategory.ELECTRONICS),
        new CatalogEntry("GoPro", ItemCategory.ELECTRONICS),
        new CatalogEntry("VR Headset", ItemCategory.ELECTRONICS),
        new CatalogEntry("Game Controller", ItemCategory.ELECTRONICS),
        new CatalogEntry("Joystick", ItemCategory.ELECTRONICS),
        new CatalogEntry("Steering Wheel", ItemCategory.ELECTRONICS),
        new CatalogEntry("Racing Seat", ItemCategory.ELECTRONICS),
        new CatalogEntry("Simulator", ItemCategory.ELECTRONICS),
        // Clothing
        new CatalogEntry("Jacket", ItemCategory.CLOTHING),
        new CatalogEntry("Shoes", ItemCategory.CLOTHING),
        new CatalogEntry("Backpack", ItemCategory.CLOTHING),
        // Food
        new CatalogEntry("Water Bottle", ItemCategory.FOOD),
        new CatalogEntry("Snacks", ItemCategory.FOOD),
        // Tools
        new CatalogEntry("Tent", ItemCategory.TOOLS),
        new CatalogEntry("Sleeping Bag", ItemCategory.TOOLS),
        new CatalogEntry("Stove", ItemCategory.TOOLS),
        new CatalogEntry("Lantern", ItemCategory.TOOLS),
        new CatalogEntry("Water Filter", ItemCategory.TOOLS),
        new CatalogEntry("Compass", ItemCategory.TOOLS),
        new CatalogEntry("Map", ItemCategory.TOOLS),
        new CatalogEntry("Flashlight", ItemCategory.TOOLS),
        new CatalogEntry("Rope", ItemCategory.TOOLS),
        new CatalogEntry("Tripod", ItemCategory.TOOLS),
        new CatalogEntry("Gimbal", ItemCategory.TOOLS),
        new CatalogEntry("Binoculars", ItemCategory.TOOLS),
        new CatalogEntry("Telescope", ItemCategory.TOOLS),
        new CatalogEntry("Microscope", ItemCategory.TOOLS),
        // Accessories
        new CatalogEntry("Book", ItemCategory.ACCESSORIES),
        new CatalogEntry("Notebook", ItemCategory.ACCESSORIES),
        new CatalogEntry("Sunglasses", ItemCategory.ACCESSORIES),
        new CatalogEntry("First Aid", ItemCategory.ACCESSORIES),
        new CatalogEntry("Batteries", ItemCategory.ACCESSORIES),
        new CatalogEntry("Memory Card", ItemCategory.ACCESSORIES)
    );

    private final PackingProperties packingProperties;

    /**
     * Generates {@code count} items with distinct names. The same seed always yields the same items.
     */
    public List<ItemSchema> generateItems(int count, long seed) {
        int maxItems = packingProperties.getGenerator().getMaxItemCount();
        if (count < 0 || count > maxItems) {
            throw new InvalidPackingInputException("Item count must be between 0 and " + maxItems + ", got " + count);
        }

        Random random = new Random(seed);
        List<ItemSchema> items = new ArrayList<>(count);
        Set<String> usedNames = new HashSet<>();

        for (int i = 0; i < count; i++) {
            CatalogEntry entry = null;
            String name = null;
            // Random catalogue picks first; once they keep colliding, fall back to a suffixed name
            for (int attempt = 0; attempt < CATALOG.size(); attempt++) {
                CatalogEntry candidate = CATALOG.get(random.nextInt(CATALOG.size()));
                if (!usedNames.contains(candidate.name)) {
                    entry = candidate;
                    name = candidate.name;
                    break;
                }
            }
            if (entry == null) {
                entry = CATALOG.get(random.nextInt(CATALOG.size()));
                name = entry.name + " #" + (i / CATALOG.size()) + "-" + (i % CATALOG.size());
            }
            usedNames.add(name);

            double positionFactor = (double) i / count;
            double band = random.nextDouble() * (1 - positionFactor * Constants.POSITION_SKEW);

            int weight;
            int value;
            if (band < Constants.HIGH_VALUE_BAND) {
                weight = random.nextInt(2) + 1;       // 1-2
                value = random.nextInt(1000) + 1500;  // 1500-2499
            } else if (band < Constants.MEDIUM_VALUE_BAND) {
                weight = random.nextInt(3) + 1;       // 1-3
                value = random.nextInt(1000) + 500;   // 500-1499
            } else {
                weight = random.nextInt(5) + 1;       // 1-5
                value = random.nextInt(450) + 50;     // 50-499
            }

            items.add(ItemSchema.builder()
                .id(i)
                .name(name)
                .category(entry.category)
                .weight((double) weight)
                .value((double) value)
                .build());
        }

        log.debug("Generated {} items with seed {}", count, seed);
        return items;
    }

    /**
     * Expands a demo request into a full packing request using the default synergy table.
     */
    public PackingRequest generateInstance(GeneratedInstanceRequest request) {
        PackingProperties.Generator defaults = packingProperties.getGenerator();

        int itemCount = request.getItemCount() != null ? request.getItemCount() : defaults.getDefaultItemCount();
        int containerCount = request.getContainerCount() != null ?
            request.getContainerCount() : defaults.getDefaultContainerCount();
        double capacity = request.getCapacity() != null ? request.getCapacity() : defaults.getDefaultCapacity();
        long seed = request.getSeed() != null ? request.getSeed() : System.currentTimeMillis();

        if (containerCount < 1) {
            throw new InvalidPackingConfigurationException("At least one container is required, got " + containerCount);
        }
        if (containerCount > defaults.getMaxContainerCount()) {
            throw new InvalidPackingInputException("Container count must be at most "
                + defaults.getMaxContainerCount() + ", got " + containerCount);
        }

        log.info("Generating demo instance: {} items, {} containers of capacity {}, seed {}",
            itemCount, containerCount, capacity, seed);

        return PackingRequest.builder()
            .items(generateItems(itemCount, seed))
            .capacities(new ArrayList<>(Collections.nCopies(containerCount, capacity)))
            .useDefaultSynergies(true)
            .algorithmType(request.getAlgorithmType())
            .timeBudgetMs(request.getTimeBudgetMs())
            .build();
    }

    private static final class CatalogEntry {
        private final String name;
        private final ItemCategory category;

        private CatalogEntry(String name, ItemCategory category) {
            this.name = name;
            this.category = category;
        }
    }
}
