package nl.bytesoflife.costestimate.estimate.result;

/**
 * Variable operating cost per utility or consumable category.
 */
public record VariableOpexCostEstimate(
        double electricalPower,
        double coolingWater,
        double naturalGas,
        double steamHpSuperheated,
        double steamLpSaturated,
        double catalystsAndChemicals,
        double equipmentItemRental,
        double costPerTonneOfCo2,
        double tariff
) {

    public static final VariableOpexCostEstimate ZERO =
            new VariableOpexCostEstimate(0, 0, 0, 0, 0, 0, 0, 0, 0);

    public VariableOpexCostEstimate plus(VariableOpexCostEstimate other) {
        return new VariableOpexCostEstimate(
                electricalPower + other.electricalPower,
                coolingWater + other.coolingWater,
                naturalGas + other.naturalGas,
                steamHpSuperheated + other.steamHpSuperheated,
                steamLpSaturated + other.steamLpSaturated,
                catalystsAndChemicals + other.catalystsAndChemicals,
                equipmentItemRental + other.equipmentItemRental,
                costPerTonneOfCo2 + other.costPerTonneOfCo2,
                tariff + other.tariff);
    }

    public VariableOpexCostEstimate times(double factor) {
        return new VariableOpexCostEstimate(
                electricalPower * factor,
                coolingWater * factor,
                naturalGas * factor,
                steamHpSuperheated * factor,
                steamLpSaturated * factor,
                catalystsAndChemicals * factor,
                equipmentItemRental * factor,
                costPerTonneOfCo2 * factor,
                tariff * factor);
    }

    public VariableOpexCostEstimate dividedBy(double divisor) {
        return new VariableOpexCostEstimate(
                electricalPower / divisor,
                coolingWater / divisor,
                naturalGas / divisor,
                steamHpSuperheated / divisor,
                steamLpSaturated / divisor,
                catalystsAndChemicals / divisor,
                equipmentItemRental / divisor,
                costPerTonneOfCo2 / divisor,
                tariff / divisor);
    }

    public double total() {
        return electricalPower + coolingWater + naturalGas + steamHpSuperheated + steamLpSaturated
                + catalystsAndChemicals + equipmentItemRental + costPerTonneOfCo2 + tariff;
    }
}
