package com.system.packsolver.schemas.algorithm.BranchAndBound;

import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Input.SynergyTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.system.packsolver.schemas.algorithm.PackingFixtures.capacities;
import static com.system.packsolver.schemas.algorithm.PackingFixtures.item;
import static com.system.packsolver.schemas.algorithm.PackingFixtures.rule;
import static org.junit.jupiter.api.Assertions.*;

public class BoundEstimatorTest {

    // sorted order: (w3,v200) (w2,v100) (w1,v50)
    private final PackingInstance instance = PackingInstance.of(
        List.of(item(0, "a", 2, 100), item(1, "b", 3, 200), item(2, "c", 1, 50)),
        capacities(5),
        SynergyTable.empty());

    private final BoundEstimator estimator = new BoundEstimator(SynergyTable.empty(), 0.3);

    @Test
    public void testWholeItemsWhileTheyFit() {
        assertEquals(300.0, estimator.fractionalBound(instance, 0, 5), 1e-9);
        assertEquals(350.0, estimator.fractionalBound(instance, 0, 10), 1e-9);
    }

    @Test
    public void testFractionOfFirstItemThatDoesNotFit() {
        // 200 + half of (w2,v100)
        assertEquals(250.0, estimator.fractionalBound(instance, 0, 4), 1e-9);
        assertEquals(100.0 + 25.0, estimator.fractionalBound(instance, 1, 2.5), 1e-9);
    }

    @Test
    public void testNoCapacityOrNoItemsLeft() {
        assertEquals(0.0, estimator.fractionalBound(instance, 0, 0), 1e-9);
        assertEquals(0.0, estimator.fractionalBound(instance, 3, 5), 1e-9);
        assertEquals(50.0, estimator.fractionalBound(instance, 2, 5), 1e-9);
    }

    @Test
    public void testSynergySlackIsShareOfTotalBonus() {
        SynergyTable table = SynergyTable.of(List.of(
            rule(200, "Laptop", "Charger"),
            rule(400, "Laptop", "Mouse", "Keyboard"),
            rule(250, "Phone", "Charger", "Power Bank")));
        BoundEstimator withSynergy = new BoundEstimator(table, 0.3);

        assertEquals(255.0, withSynergy.getSynergySlack(), 1e-9);
        assertEquals(10.0 + 300.0 + 255.0, withSynergy.bound(instance, 0, 5, 10.0), 1e-9);
        assertEquals(0.0, new BoundEstimator(table, 0.0).getSynergySlack());
    }

    @Test
    public void testNegativeSlackRatioIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BoundEstimator(SynergyTable.empty(), -0.1));
    }
}
