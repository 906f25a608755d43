package nl.bytesoflife.costestimate.estimate.result;

public record YearAssetCosts(int year, AssetPeriodCosts costsInYear, AssetPeriodCosts dcfCostsInYear) {
}
