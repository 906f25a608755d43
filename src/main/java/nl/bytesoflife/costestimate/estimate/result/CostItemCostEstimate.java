package nl.bytesoflife.costestimate.estimate.result;

import java.util.List;

/**
 * Estimate for one requested cost item.
 *
 * @param lifetimeCosts    sum of {@code costsByYear}
 * @param lifetimeDcfCosts sum of the discounted {@code costsByYear}
 */
public record CostItemCostEstimate(
        String id,
        int quantity,
        CostItemCosts costs,
        List<YearCostItemCosts> costsByYear,
        CostItemPeriodCosts lifetimeCosts,
        CostItemPeriodCosts lifetimeDcfCosts
) {
    public CostItemCostEstimate {
        costsByYear = List.copyOf(costsByYear);
    }
}
