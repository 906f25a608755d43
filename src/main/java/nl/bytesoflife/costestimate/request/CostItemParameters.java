package nl.bytesoflife.costestimate.request;

import java.util.Map;

/**
 * One requested line item of an asset.
 *
 * @param id         caller's id for the line item, echoed in results and errors
 * @param ref        id of the cost reference item in the library
 * @param quantity   multiplier applied to every cost of the item
 * @param parameters named values supplied for the item's scaling factors and opex contributions
 */
public record CostItemParameters(String id, String ref, int quantity, Map<String, Double> parameters) {
    public CostItemParameters {
        if (id == null) {
            throw new IllegalArgumentException("Cost item id must not be null");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Cost item '" + id + "' quantity must be >= 0");
        }
        if (parameters == null) {
            parameters = Map.of();
        }
        for (Map.Entry<String, Double> parameter : parameters.entrySet()) {
            if (parameter.getKey() == null || parameter.getValue() == null) {
                throw new IllegalArgumentException("Cost item '" + id + "' parameter '"
                        + parameter.getKey() + "' has no value");
            }
        }
        parameters = Map.copyOf(parameters);
    }
}
