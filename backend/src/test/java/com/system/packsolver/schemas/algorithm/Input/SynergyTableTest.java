package com.system.packsolver.schemas.algorithm.Input;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.system.packsolver.schemas.algorithm.PackingFixtures.item;
import static com.system.packsolver.schemas.algorithm.PackingFixtures.rule;
import static org.junit.jupiter.api.Assertions.*;

public class SynergyTableTest {

    private final SynergyTable table = SynergyTable.of(List.of(
        rule(200, "Laptop", "Charger"),
        rule(400, "Laptop", "Mouse", "Keyboard"),
        rule(250, "Phone", "Charger", "Power Bank")
    ));

    @Test
    public void testRuleFiresWhenAllNamesPresent() {
        double bonus = table.synergyBonus(List.of(
            item(0, "Laptop", 2, 2000),
            item(1, "Charger", 1, 50)));

        assertEquals(200.0, bonus);
    }

    @Test
    public void testIndependentRulesFireTogether() {
        double bonus = table.synergyBonus(List.of(
            item(0, "Laptop", 2, 2000),
            item(1, "Charger", 1, 50),
            item(2, "Mouse", 1, 30),
            item(3, "Keyboard", 1, 80)));

        assertEquals(600.0, bonus);
    }

    @Test
    public void testPartialMatchGivesNothing() {
        assertEquals(0.0, table.synergyBonus(List.of(item(0, "Laptop", 2, 2000))));
        assertEquals(0.0, table.synergyBonus(List.of(
            item(0, "Phone", 1, 500),
            item(1, "Charger", 1, 50))));
        assertEquals(0.0, table.synergyBonus(List.of()));
    }

    @Test
    public void testRepeatedNamesInRuleFireOnce() {
        SynergyTable repeated = SynergyTable.of(List.of(rule(200, "Laptop", "Laptop", "Charger")));

        double bonus = repeated.synergyBonus(List.of(
            item(0, "Laptop", 2, 2000),
            item(1, "Charger", 1, 50)));

        assertEquals(200.0, bonus);
        assertEquals(List.of("Laptop", "Charger"), repeated.toSchemas().get(0).getItems());
    }

    @Test
    public void testTotalBonusSumsEveryRule() {
        assertEquals(850.0, table.totalBonus());
        assertEquals(3, table.size());
        assertEquals(0.0, SynergyTable.of(null).totalBonus());
        assertTrue(SynergyTable.empty().isEmpty());
    }

    @Test
    public void testMalformedRulesAreRejected() {
        assertThrows(InvalidPackingInputException.class,
            () -> SynergyTable.of(List.of(rule(100))));
        assertThrows(InvalidPackingInputException.class,
            () -> SynergyTable.of(List.of(rule(100, "Laptop", " "))));
        assertThrows(InvalidPackingInputException.class,
            () -> SynergyTable.of(List.of(rule(-1, "Laptop", "Charger"))));
        assertThrows(InvalidPackingInputException.class,
            () -> SynergyTable.of(List.of(rule(Double.NaN, "Laptop", "Charger"))));
    }
}
