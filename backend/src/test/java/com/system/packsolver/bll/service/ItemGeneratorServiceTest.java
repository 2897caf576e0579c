package com.system.packsolver.bll.service;

import com.system.packsolver.config.PackingProperties;
import com.system.packsolver.schemas.GeneratedInstanceRequest;
import com.system.packsolver.schemas.ItemSchema;
import com.system.packsolver.schemas.PackingRequest;
import com.system.packsolver.schemas.algorithm.Input.InvalidPackingConfigurationException;
import com.system.packsolver.schemas.algorithm.Input.InvalidPackingInputException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ItemGeneratorServiceTest {

    private final ItemGeneratorService generator = new ItemGeneratorService(new PackingProperties());

    @Test
    public void testSameSeedSameItems() {
        List<ItemSchema> first = generator.generateItems(20, 42L);
        List<ItemSchema> second = generator.generateItems(20, 42L);

        assertEquals(20, first.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getName(), second.get(i).getName());
            assertEquals(first.get(i).getWeight(), second.get(i).getWeight());
            assertEquals(first.get(i).getValue(), second.get(i).getValue());
            assertEquals(first.get(i).getCategory(), second.get(i).getCategory());
        }
    }

    @Test
    public void testNamesStayUniqueBeyondCatalogue() {
        List<ItemSchema> items = generator.generateItems(200, 7L);

        Set<String> names = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            ItemSchema item = items.get(i);
            assertTrue(names.add(item.getName()), "duplicate name " + item.getName());
            assertEquals(i, item.getId());
            assertTrue(item.getWeight() >= 1 && item.getWeight() <= 5);
            assertTrue(item.getValue() >= 50 && item.getValue() < 2500);
        }
    }

    @Test
    public void testItemCountOutOfRange() {
        assertThrows(InvalidPackingInputException.class, () -> generator.generateItems(-1, 1L));
        assertThrows(InvalidPackingInputException.class, () -> generator.generateItems(1001, 1L));
        assertTrue(generator.generateItems(0, 1L).isEmpty());
    }

    @Test
    public void testGeneratedInstanceUsesDefaultSynergies() {
        GeneratedInstanceRequest request = GeneratedInstanceRequest.builder()
            .itemCount(12)
            .containerCount(3)
            .capacity(8.0)
            .seed(5L)
            .build();

        PackingRequest packingRequest = generator.generateInstance(request);

        assertEquals(12, packingRequest.getItems().size());
        assertEquals(List.of(8.0, 8.0, 8.0), packingRequest.getCapacities());
        assertTrue(packingRequest.getUseDefaultSynergies());
    }

    @Test
    public void testGeneratedInstanceNeedsContainers() {
        GeneratedInstanceRequest request = GeneratedInstanceRequest.builder()
            .containerCount(0)
            .seed(5L)
            .build();

        assertThrows(InvalidPackingConfigurationException.class, () -> generator.generateInstance(request));
    }

    @Test
    public void testGeneratedInstanceContainerLimit() {
        GeneratedInstanceRequest request = GeneratedInstanceRequest.builder()
            .containerCount(2_000_000_000)
            .seed(5L)
            .build();

        assertThrows(InvalidPackingInputException.class, () -> generator.generateInstance(request));

        request.setContainerCount(50);
        assertEquals(50, generator.generateInstance(request).getCapacities().size());
    }
}
