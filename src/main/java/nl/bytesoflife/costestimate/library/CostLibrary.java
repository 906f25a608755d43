package nl.bytesoflife.costestimate.library;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One version of the cost reference library. Immutable after construction and safe to share
 * between concurrent estimations.
 */
public class CostLibrary {

    private final List<CostModule> modules;
    private final CurrencyConversionRates currencyConversion;
    private final InflationFactors inflation;

    public CostLibrary(List<CostModule> modules,
                       CurrencyConversionRates currencyConversion,
                       InflationFactors inflation) {
        if (currencyConversion == null) {
            throw new IllegalArgumentException("Cost library needs a currency conversion table");
        }
        if (inflation == null) {
            throw new IllegalArgumentException("Cost library needs an inflation table");
        }
        this.modules = modules == null ? List.of() : List.copyOf(modules);
        this.currencyConversion = currencyConversion;
        this.inflation = inflation;
    }

    public List<CostModule> getModules() {
        return modules;
    }

    public CurrencyConversionRates getCurrencyConversion() {
        return currencyConversion;
    }

    public InflationFactors getInflation() {
        return inflation;
    }

    public CostModule findModule(String moduleId) {
        for (CostModule module : modules) {
            if (module.getId().equals(moduleId)) {
                return module;
            }
        }
        return null;
    }

    /**
     * Every cost reference item across all modules, keyed by id. If two modules declare the
     * same id, the one declared last wins.
     */
    public Map<String, CostReferenceItem> costReferenceItemsById() {
        Map<String, CostReferenceItem> items = new LinkedHashMap<>();
        for (CostModule module : modules) {
            for (CostReferenceItem item : module.getCostItems()) {
                items.put(item.getId(), item);
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "CostLibrary{modules=" + modules.size()
                + ", baseCurrency=" + currencyConversion.getBaseCurrency()
                + ", currencies=" + currencyConversion.getRates().size()
                + ", inflationYears=" + inflation.getFactors().size() + "}";
    }
}
