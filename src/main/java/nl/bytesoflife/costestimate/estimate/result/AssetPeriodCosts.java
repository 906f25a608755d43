package nl.bytesoflife.costestimate.estimate.result;

/**
 * An asset's costs over some period (one year, or its whole lifetime).
 */
public record AssetPeriodCosts(
        double directEquipmentCost,
        LangFactoredCostEstimate langFactoredCapitalCost,
        double totalInstalledCost,
        FixedOpexCostEstimate fixedOpexCost,
        VariableOpexCostEstimate variableOpexCost,
        double decommissioningCost
) {

    public static final AssetPeriodCosts ZERO = new AssetPeriodCosts(
            0, LangFactoredCostEstimate.ZERO, 0, FixedOpexCostEstimate.ZERO, VariableOpexCostEstimate.ZERO, 0);

    public AssetPeriodCosts plus(AssetPeriodCosts other) {
        return new AssetPeriodCosts(
                directEquipmentCost + other.directEquipmentCost,
                langFactoredCapitalCost.plus(other.langFactoredCapitalCost),
                totalInstalledCost + other.totalInstalledCost,
                fixedOpexCost.plus(other.fixedOpexCost),
                variableOpexCost.plus(other.variableOpexCost),
                decommissioningCost + other.decommissioningCost);
    }

    public AssetPeriodCosts dividedBy(double divisor) {
        return new AssetPeriodCosts(
                directEquipmentCost / divisor,
                langFactoredCapitalCost.dividedBy(divisor),
                totalInstalledCost / divisor,
                fixedOpexCost.dividedBy(divisor),
                variableOpexCost.dividedBy(divisor),
                decommissioningCost / divisor);
    }
}
