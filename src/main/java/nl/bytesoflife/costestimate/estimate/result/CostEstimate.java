package nl.bytesoflife.costestimate.estimate.result;

import java.util.List;
import java.util.Locale;

/**
 * Result of a successful estimation: one estimate per requested asset, in request order.
 */
public record CostEstimate(List<AssetCostEstimate> assets) {

    public CostEstimate {
        assets = List.copyOf(assets);
    }

    public AssetCostEstimate findAsset(String assetId) {
        for (AssetCostEstimate asset : assets) {
            if (asset.id().equals(assetId)) {
                return asset;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Cost Estimate:\n");
        sb.append("  Assets: ").append(assets.size()).append("\n");
        for (AssetCostEstimate asset : assets) {
            AssetCosts costs = asset.costs();
            sb.append("  - ").append(asset.id())
              .append(" (").append(asset.costItems().size()).append(" cost items, ")
              .append(asset.costsByYear().size()).append(" years)\n");
            sb.append(String.format(Locale.US, "    Direct equipment cost: %.2f%n", costs.directEquipmentCost()));
            sb.append(String.format(Locale.US, "    Total installed cost: %.2f%n", costs.totalInstalledCost()));
            sb.append(String.format(Locale.US, "    Opex per year: %.2f fixed, %.2f variable%n",
                    costs.fixedOpexCostPerYear().total(), costs.variableOpexCostPerYear().total()));
            sb.append(String.format(Locale.US, "    Decommissioning cost: %.2f%n", costs.decommissioningCost()));
            sb.append(String.format(Locale.US, "    Lifetime total installed cost: %.2f (DCF %.2f)%n",
                    asset.lifetimeCosts().totalInstalledCost(), asset.lifetimeDcfCosts().totalInstalledCost()));
        }
        return sb.toString();
    }
}
