package nl.bytesoflife.costestimate.library;

import java.util.List;
import java.util.Map;

/**
 * Conversion rates of each known currency relative to the library's base currency.
 */
public class CurrencyConversionRates {

    private final String baseCurrency;
    private final Map<String, Double> rates;

    public CurrencyConversionRates(String baseCurrency, Map<String, Double> rates) {
        if (baseCurrency == null || baseCurrency.isBlank()) {
            throw new IllegalArgumentException("Base currency must not be blank");
        }
        this.baseCurrency = baseCurrency;
        this.rates = rates == null ? Map.of() : Map.copyOf(rates);
    }

    public String getBaseCurrency() {
        return baseCurrency;
    }

    public Map<String, Double> getRates() {
        return rates;
    }

    /**
     * Rate of the given currency, or null if the library has no rate for it.
     */
    public Double rateOf(String currencyCode) {
        return rates.get(currencyCode);
    }

    public List<String> getCurrencyCodes() {
        return rates.keySet().stream().sorted().toList();
    }
}
