package nl.bytesoflife.costestimate.request;

/**
 * Yearly fixed operating cost categories, each a portion of the asset's total installed cost.
 *
 * @param majorTurnarounds turnarounds happen on a 4 year interval; the cost is spread evenly
 */
public record FixedOpexFactors(
        double maintenance,
        double controlRoomFacilities,
        double insuranceLiability,
        double insuranceEquipmentLoss,
        double costOfCapital,
        double majorTurnarounds
) {

    public static FixedOpexFactors defaults() {
        return new FixedOpexFactors(0.08, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
