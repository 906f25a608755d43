package nl.bytesoflife.costestimate.estimate.result;

import java.util.List;

/**
 * Estimate for one asset: aggregate costs, the per-year breakdown over its whole timeline,
 * lifetime totals, and the estimates of its cost items.
 */
public record AssetCostEstimate(
        String id,
        AssetCosts costs,
        List<YearAssetCosts> costsByYear,
        AssetPeriodCosts lifetimeCosts,
        AssetPeriodCosts lifetimeDcfCosts,
        List<CostItemCostEstimate> costItems
) {
    public AssetCostEstimate {
        costsByYear = List.copyOf(costsByYear);
        costItems = List.copyOf(costItems);
    }
}
