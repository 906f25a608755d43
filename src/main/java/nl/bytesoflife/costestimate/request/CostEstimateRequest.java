package nl.bytesoflife.costestimate.request;

import java.util.List;

public record CostEstimateRequest(List<AssetParameters> assets) {
    public CostEstimateRequest {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }
}
