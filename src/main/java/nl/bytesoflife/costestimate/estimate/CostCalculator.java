package nl.bytesoflife.costestimate.estimate;

import nl.bytesoflife.costestimate.estimate.error.CostEstimateError;
import nl.bytesoflife.costestimate.estimate.error.CostEstimateException;
import nl.bytesoflife.costestimate.estimate.result.VariableOpexCostEstimate;
import nl.bytesoflife.costestimate.library.*;
import nl.bytesoflife.costestimate.request.CostEstimateOptions;

import java.util.Map;

/**
 * Evaluates the cost formulas of cost reference items against supplied parameters, converting to
 * the target currency and inflating to the library's current year.
 * Stateless apart from the library and the resolved target currency rate.
 */
public class CostCalculator {

    /** Years of operation variable opex contributions are amortised over. */
    static final double AMORTISATION_YEARS = 20.0;

    private final CostLibrary library;
    private final double targetCurrencyRate;

    /**
     * @param targetCurrencyRate factor converting from the library's base currency to the target currency
     */
    public CostCalculator(CostLibrary library, double targetCurrencyRate) {
        this.library = library;
        this.targetCurrencyRate = targetCurrencyRate;
    }

    /**
     * Creates a calculator for the options' target currency, defaulting to the library's base currency.
     *
     * @throws CostEstimateException with {@link CostEstimateError.UnknownCurrencyConversion}
     *                               if the library has no rate for the target currency
     */
    public static CostCalculator forOptions(CostLibrary library, CostEstimateOptions options)
            throws CostEstimateException {
        CurrencyConversionRates rates = library.getCurrencyConversion();
        String targetCurrency = options != null && options.targetCurrency() != null
                ? options.targetCurrency()
                : rates.getBaseCurrency();
        Double rate = rates.rateOf(targetCurrency);
        if (rate == null) {
            throw new CostEstimateException(new CostEstimateError.UnknownCurrencyConversion(targetCurrency));
        }
        return new CostCalculator(library, 1.0 / rate);
    }

    public CostLibrary getLibrary() {
        return library;
    }

    public double getTargetCurrencyRate() {
        return targetCurrencyRate;
    }

    /**
     * Capital cost if the item is classified as direct equipment cost, otherwise null.
     */
    public Double directEquipmentCost(CostReferenceItem item, Map<String, Double> parameters)
            throws CostEstimateException {
        if (item.getCostType() != CostType.DIRECT_EQUIPMENT_COST) {
            return null;
        }
        return capexCost(item, parameters);
    }

    /**
     * Capital cost if the item is classified as total installed cost, otherwise null.
     */
    public Double totalInstalledCost(CostReferenceItem item, Map<String, Double> parameters)
            throws CostEstimateException {
        if (item.getCostType() != CostType.TOTAL_INSTALLED_COST) {
            return null;
        }
        return capexCost(item, parameters);
    }

    /**
     * Evaluates the item's capital cost formula, then applies the currency and inflation factors.
     * Parameters must cover the formula; linking guarantees that for scaling factors.
     *
     * @throws IllegalStateException if a parameter the formula needs was not supplied
     */
    public double capexCost(CostReferenceItem item, Map<String, Double> parameters)
            throws CostEstimateException {
        double cost = evaluate(item, parameters);
        CapexContribution capex = item.getCapexContribution();
        return cost * currencyFactor(capex.currency()) * inflationFactor(String.valueOf(capex.year()));
    }

    private double evaluate(CostReferenceItem item, Map<String, Double> parameters) {
        Cost cost = item.getCapexContribution().cost();
        if (cost instanceof Cost.Linear linear) {
            double scale = 1.0;
            for (ScalingFactor factor : item.getScalingFactors()) {
                scale *= require(item, parameters, factor.name()) / factor.sourceValue();
            }
            return linear.baseCost() * scale;
        }
        if (cost instanceof Cost.Polynomial polynomial) {
            double sum = 0.0;
            for (PolynomialTerm term : polynomial.terms()) {
                if (term instanceof PolynomialTerm.Variable variable) {
                    sum += variable.coefficient()
                            * require(item, parameters, variable.dimensionName())
                            * variable.exponent();
                } else if (term instanceof PolynomialTerm.Constant constant) {
                    sum += constant.value();
                }
            }
            return sum;
        }
        throw new IllegalStateException("Unsupported cost formula: " + cost);
    }

    private static double require(CostReferenceItem item, Map<String, Double> parameters, String name) {
        Double value = parameters.get(name);
        if (value == null) {
            throw new IllegalStateException("Cost item " + item.getId()
                    + " cannot be calculated without parameter '" + name + "'");
        }
        return value;
    }

    /**
     * Variable operating cost per year across all categories. Categories the item does not declare,
     * or that the caller gave no value for, are zero.
     */
    public VariableOpexCostEstimate variableOpexCost(CostReferenceItem item, Map<String, Double> parameters)
            throws CostEstimateException {
        return new VariableOpexCostEstimate(
                variableOpexCost(item, parameters, VariableOpexCategory.ELECTRICAL_POWER),
                variableOpexCost(item, parameters, VariableOpexCategory.COOLING_WATER),
                variableOpexCost(item, parameters, VariableOpexCategory.NATURAL_GAS),
                variableOpexCost(item, parameters, VariableOpexCategory.STEAM_HP_SUPERHEATED),
                variableOpexCost(item, parameters, VariableOpexCategory.STEAM_LP_SATURATED),
                variableOpexCost(item, parameters, VariableOpexCategory.CATALYSTS_AND_CHEMICALS),
                variableOpexCost(item, parameters, VariableOpexCategory.EQUIPMENT_ITEM_RENTAL),
                variableOpexCost(item, parameters, VariableOpexCategory.COST_PER_TONNE_OF_CO2),
                variableOpexCost(item, parameters, VariableOpexCategory.TARIFF));
    }

    /**
     * Variable operating cost of one category:
     * {@code value * scaledBy * unitCost * currencyFactor * inflationFactor * 20}.
     */
    public double variableOpexCost(CostReferenceItem item, Map<String, Double> parameters,
                                   VariableOpexCategory category) throws CostEstimateException {
        VariableOpexContribution contribution = item.findVariableOpexContribution(category.getLibraryName());
        if (contribution == null) {
            return 0.0;
        }
        Double value = parameters.get(category.getLibraryName());
        if (value == null) {
            return 0.0;
        }
        // currency and year of the capex contribution apply to opex too
        CapexContribution capex = item.getCapexContribution();
        return value
                * contribution.scaledBy()
                * category.getUnitCost()
                * currencyFactor(capex.currency())
                * inflationFactor(String.valueOf(capex.year()))
                * AMORTISATION_YEARS;
    }

    /**
     * Factor converting an amount in the given currency to the target currency.
     */
    public double currencyFactor(String currency) throws CostEstimateException {
        Double rate = library.getCurrencyConversion().rateOf(currency);
        if (rate == null) {
            throw new CostEstimateException(new CostEstimateError.UnknownCurrencyConversion(currency));
        }
        return rate * targetCurrencyRate;
    }

    public double inflationFactor(String year) throws CostEstimateException {
        Double factor = library.getInflation().factorFor(year);
        if (factor == null) {
            throw new CostEstimateException(new CostEstimateError.UnknownInflationFactor(year));
        }
        return factor;
    }
}
