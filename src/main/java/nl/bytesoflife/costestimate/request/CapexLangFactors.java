package nl.bytesoflife.costestimate.request;

/**
 * Lang factors: multipliers of an asset's direct equipment cost giving the auxiliary
 * capital cost categories. Each is a portion of direct equipment cost.
 */
public record CapexLangFactors(
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

    public static CapexLangFactors defaults() {
        return new CapexLangFactors(0.4, 0.7, 0.2, 0.1, 0.15, 0.5, 0.15, 0.05, 0.15, 0.3, 0.05, 1.0);
    }
}
