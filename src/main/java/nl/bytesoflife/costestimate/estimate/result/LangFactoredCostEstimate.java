package nl.bytesoflife.costestimate.estimate.result;

import nl.bytesoflife.costestimate.request.CapexLangFactors;

/**
 * Auxiliary capital cost categories derived from direct equipment cost by the Lang factors.
 */
public record LangFactoredCostEstimate(
        double equipmentErection,
        double piping,
        double instrumentation,
        double electrical,
        double buildingsAndProcess,
        double utilities,
        double storages,
        double siteDevelopment,
        double ancillaryBuildings,
        double designAndEngineering,
        double contractorsFee,
        double contingency
) {

    public static final LangFactoredCostEstimate ZERO =
            new LangFactoredCostEstimate(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public static LangFactoredCostEstimate of(double directEquipmentCost, CapexLangFactors factors) {
        return new LangFactoredCostEstimate(
                directEquipmentCost * factors.equipmentErection(),
                directEquipmentCost * factors.piping(),
                directEquipmentCost * factors.instrumentation(),
                directEquipmentCost * factors.electrical(),
                directEquipmentCost * factors.buildingsAndProcess(),
                directEquipmentCost * factors.utilities(),
                directEquipmentCost * factors.storages(),
                directEquipmentCost * factors.siteDevelopment(),
                directEquipmentCost * factors.ancillaryBuildings(),
                directEquipmentCost * factors.designAndEngineering(),
                directEquipmentCost * factors.contractorsFee(),
                directEquipmentCost * factors.contingency());
    }

    public LangFactoredCostEstimate plus(LangFactoredCostEstimate other) {
        return new LangFactoredCostEstimate(
                equipmentErection + other.equipmentErection,
                piping + other.piping,
                instrumentation + other.instrumentation,
                electrical + other.electrical,
                buildingsAndProcess + other.buildingsAndProcess,
                utilities + other.utilities,
                storages + other.storages,
                siteDevelopment + other.siteDevelopment,
                ancillaryBuildings + other.ancillaryBuildings,
                designAndEngineering + other.designAndEngineering,
                contractorsFee + other.contractorsFee,
                contingency + other.contingency);
    }

    public LangFactoredCostEstimate dividedBy(double divisor) {
        return new LangFactoredCostEstimate(
                equipmentErection / divisor,
                piping / divisor,
                instrumentation / divisor,
                electrical / divisor,
                buildingsAndProcess / divisor,
                utilities / divisor,
                storages / divisor,
                siteDevelopment / divisor,
                ancillaryBuildings / divisor,
                designAndEngineering / divisor,
                contractorsFee / divisor,
                contingency / divisor);
    }

    /**
     * Sum of all twelve categories, contingency included.
     */
    public double total() {
        return equipmentErection + piping + instrumentation + electrical + buildingsAndProcess
                + utilities + storages + siteDevelopment + ancillaryBuildings + designAndEngineering
                + contractorsFee + contingency;
    }
}
