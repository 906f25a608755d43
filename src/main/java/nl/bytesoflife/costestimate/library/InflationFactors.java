package nl.bytesoflife.costestimate.library;

import java.util.Map;

/**
 * Inflation factors keyed by year, bringing a cost quoted in that year to the library's current year.
 * Years are kept as strings, as they appear in library files.
 */
public class InflationFactors {

    private final String currentYear;
    private final Map<String, Double> factors;

    public InflationFactors(String currentYear, Map<String, Double> factors) {
        this.currentYear = currentYear;
        this.factors = factors == null ? Map.of() : Map.copyOf(factors);
    }

    public String getCurrentYear() {
        return currentYear;
    }

    public Map<String, Double> getFactors() {
        return factors;
    }

    /**
     * Factor for the given year, or null if the library has none.
     */
    public Double factorFor(String year) {
        return factors.get(year);
    }
}
