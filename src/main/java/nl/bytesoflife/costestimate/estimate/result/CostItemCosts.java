package nl.bytesoflife.costestimate.estimate.result;

import nl.bytesoflife.costestimate.request.Timeline;

/**
 * As-incurred costs of one cost item, already multiplied by its quantity.
 * At most one of the two capital costs is present, depending on the item's cost type.
 */
public record CostItemCosts(
        Double directEquipmentCost,
        Double totalInstalledCost,
        VariableOpexCostEstimate variableOpexCostPerYear
) {

    public CostItemCosts {
        if (variableOpexCostPerYear == null) {
            variableOpexCostPerYear = VariableOpexCostEstimate.ZERO;
        }
    }

    public CostItemCosts times(double quantity) {
        return new CostItemCosts(
                directEquipmentCost != null ? directEquipmentCost * quantity : null,
                totalInstalledCost != null ? totalInstalledCost * quantity : null,
                variableOpexCostPerYear.times(quantity));
    }

    /**
     * The share of these costs falling in the given year. Capital costs are spread evenly over the
     * construction years and absent outside them; variable opex is charged in full in every operation
     * year and is zero outside them.
     */
    public CostItemPeriodCosts inYear(int year, Timeline timeline) {
        boolean construction = timeline.isConstructionYear(year);
        int constructionYears = timeline.constructionYearCount();
        return new CostItemPeriodCosts(
                construction && directEquipmentCost != null ? directEquipmentCost / constructionYears : null,
                construction && totalInstalledCost != null ? totalInstalledCost / constructionYears : null,
                timeline.isOperationYear(year) ? variableOpexCostPerYear : VariableOpexCostEstimate.ZERO);
    }
}
