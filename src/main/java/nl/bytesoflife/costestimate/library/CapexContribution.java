package nl.bytesoflife.costestimate.library;

/**
 * Capital cost contribution of a cost reference item.
 *
 * @param year     year the cost was quoted in, used to look up the inflation factor
 * @param currency currency the cost was quoted in
 * @param cost     the formula
 */
public record CapexContribution(int year, String currency, Cost cost) {
    public CapexContribution {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Capex contribution currency must not be blank");
        }
        if (cost == null) {
            throw new IllegalArgumentException("Capex contribution cost must not be null");
        }
    }
}
