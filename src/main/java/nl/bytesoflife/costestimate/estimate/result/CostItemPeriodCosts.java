package nl.bytesoflife.costestimate.estimate.result;

/**
 * A cost item's costs over some period (one year, or its whole lifetime).
 * A null capital cost means the item has no such cost, which is not the same as a cost of zero.
 */
public record CostItemPeriodCosts(
        Double directEquipmentCost,
        Double totalInstalledCost,
        VariableOpexCostEstimate variableOpexCost
) {

    public static final CostItemPeriodCosts EMPTY =
            new CostItemPeriodCosts(null, null, VariableOpexCostEstimate.ZERO);

    public CostItemPeriodCosts {
        if (variableOpexCost == null) {
            variableOpexCost = VariableOpexCostEstimate.ZERO;
        }
    }

    /**
     * Adds two periods. Capital costs present on one side only are carried over unchanged;
     * absent on both sides they stay absent.
     */
    public CostItemPeriodCosts plus(CostItemPeriodCosts other) {
        return new CostItemPeriodCosts(
                addOptional(directEquipmentCost, other.directEquipmentCost),
                addOptional(totalInstalledCost, other.totalInstalledCost),
                variableOpexCost.plus(other.variableOpexCost));
    }

    public CostItemPeriodCosts dividedBy(double divisor) {
        return new CostItemPeriodCosts(
                directEquipmentCost != null ? directEquipmentCost / divisor : null,
                totalInstalledCost != null ? totalInstalledCost / divisor : null,
                variableOpexCost.dividedBy(divisor));
    }

    static Double addOptional(Double a, Double b) {
        if (a != null && b != null) return a + b;
        return a != null ? a : b;
    }
}
