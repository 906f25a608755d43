package nl.bytesoflife.costestimate.estimate.result;

public record YearCostItemCosts(int year, CostItemPeriodCosts costsInYear, CostItemPeriodCosts dcfCostsInYear) {
}
