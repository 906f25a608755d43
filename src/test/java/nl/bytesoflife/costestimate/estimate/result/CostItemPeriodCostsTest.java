package nl.bytesoflife.costestimate.estimate.result;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostItemPeriodCostsTest {

    private static final VariableOpexCostEstimate OPEX =
            new VariableOpexCostEstimate(1, 2, 3, 4, 5, 6, 7, 8, 9);

    @Test
    void addsPresentValues() {
        CostItemPeriodCosts sum = new CostItemPeriodCosts(10.0, 4.0, OPEX)
                .plus(new CostItemPeriodCosts(5.0, 1.0, OPEX));

        assertEquals(15.0, sum.directEquipmentCost());
        assertEquals(5.0, sum.totalInstalledCost());
        assertEquals(2.0, sum.variableOpexCost().electricalPower());
        assertEquals(18.0, sum.variableOpexCost().tariff());
    }

    @Test
    void keepsValuePresentOnOneSide() {
        CostItemPeriodCosts left = new CostItemPeriodCosts(10.0, null, null);
        CostItemPeriodCosts right = new CostItemPeriodCosts(null, null, null);

        assertEquals(10.0, left.plus(right).directEquipmentCost());
        assertEquals(10.0, right.plus(left).directEquipmentCost());
        assertNull(left.plus(right).totalInstalledCost());
    }

    @Test
    void emptyIsNeutral() {
        CostItemPeriodCosts costs = new CostItemPeriodCosts(3.0, null, OPEX);

        assertEquals(costs, CostItemPeriodCosts.EMPTY.plus(costs));
        assertEquals(CostItemPeriodCosts.EMPTY, CostItemPeriodCosts.EMPTY.plus(CostItemPeriodCosts.EMPTY));
    }

    @Test
    void dividesPresentValuesOnly() {
        CostItemPeriodCosts divided = new CostItemPeriodCosts(10.0, null, OPEX).dividedBy(2.0);

        assertEquals(5.0, divided.directEquipmentCost());
        assertNull(divided.totalInstalledCost());
        assertEquals(0.5, divided.variableOpexCost().electricalPower());
    }

    @Test
    void nullOpexBecomesZero() {
        assertEquals(VariableOpexCostEstimate.ZERO, new CostItemPeriodCosts(null, null, null).variableOpexCost());
    }
}
