package nl.bytesoflife.costestimate.estimate.result;

import nl.bytesoflife.costestimate.request.FixedOpexFactors;

/**
 * Fixed operating cost categories, each a portion of total installed cost.
 */
public record FixedOpexCostEstimate(
        double maintenance,
        double controlRoomFacilities,
        double insuranceLiability,
        double insuranceEquipmentLoss,
        double costOfCapital,
        double majorTurnarounds
) {

    public static final FixedOpexCostEstimate ZERO = new FixedOpexCostEstimate(0, 0, 0, 0, 0, 0);

    public static FixedOpexCostEstimate of(double totalInstalledCost, FixedOpexFactors factors) {
        return new FixedOpexCostEstimate(
                totalInstalledCost * factors.maintenance(),
                totalInstalledCost * factors.controlRoomFacilities(),
                totalInstalledCost * factors.insuranceLiability(),
                totalInstalledCost * factors.insuranceEquipmentLoss(),
                totalInstalledCost * factors.costOfCapital(),
                totalInstalledCost * factors.majorTurnarounds());
    }

    public FixedOpexCostEstimate plus(FixedOpexCostEstimate other) {
        return new FixedOpexCostEstimate(
                maintenance + other.maintenance,
                controlRoomFacilities + other.controlRoomFacilities,
                insuranceLiability + other.insuranceLiability,
                insuranceEquipmentLoss + other.insuranceEquipmentLoss,
                costOfCapital + other.costOfCapital,
                majorTurnarounds + other.majorTurnarounds);
    }

    public FixedOpexCostEstimate dividedBy(double divisor) {
        return new FixedOpexCostEstimate(
                maintenance / divisor,
                controlRoomFacilities / divisor,
                insuranceLiability / divisor,
                insuranceEquipmentLoss / divisor,
                costOfCapital / divisor,
                majorTurnarounds / divisor);
    }

    public double total() {
        return maintenance + controlRoomFacilities + insuranceLiability + insuranceEquipmentLoss
                + costOfCapital + majorTurnarounds;
    }
}
