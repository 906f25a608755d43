package nl.bytesoflife.costestimate.estimate.result;

/**
 * As-incurred costs of an asset, before spreading over its timeline.
 */
public record AssetCosts(
        double directEquipmentCost,
        LangFactoredCostEstimate langFactoredCapitalCost,
        double totalInstalledCost,
        FixedOpexCostEstimate fixedOpexCostPerYear,
        VariableOpexCostEstimate variableOpexCostPerYear,
        double decommissioningCost
) {
}
