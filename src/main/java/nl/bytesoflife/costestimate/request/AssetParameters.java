package nl.bytesoflife.costestimate.request;

import java.util.List;

/**
 * An asset submitted for estimation.
 *
 * @param discountRate yearly discount rate as a fraction, e.g. 0.1 for 10%
 */
public record AssetParameters(
        String id,
        Timeline timeline,
        CapexLangFactors capexLangFactors,
        FixedOpexFactors opexFactors,
        List<CostItemParameters> costItems,
        double discountRate
) {
    public AssetParameters {
        if (id == null) {
            throw new IllegalArgumentException("Asset id must not be null");
        }
        if (timeline == null) {
            throw new IllegalArgumentException("Asset '" + id + "' has no timeline");
        }
        capexLangFactors = capexLangFactors != null ? capexLangFactors : CapexLangFactors.defaults();
        opexFactors = opexFactors != null ? opexFactors : FixedOpexFactors.defaults();
        costItems = costItems == null ? List.of() : List.copyOf(costItems);
    }
}
