package nl.bytesoflife.costestimate.request;

/**
 * Per-call estimation options.
 *
 * @param targetCurrency currency code results are expressed in, or null for the library's base currency
 */
public record CostEstimateOptions(String targetCurrency) {

    public static CostEstimateOptions defaults() {
        return new CostEstimateOptions(null);
    }

    public static CostEstimateOptions inCurrency(String targetCurrency) {
        return new CostEstimateOptions(targetCurrency);
    }
}
