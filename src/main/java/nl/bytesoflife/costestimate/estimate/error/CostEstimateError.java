package nl.bytesoflife.costestimate.estimate.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Why an estimate could not be produced. One variant per kind; {@link #type()} is the
 * discriminator a transport layer serialises.
 *
 * <p>Errors from several cost items or assets are folded with {@link #combine(CostEstimateError)}.
 * Missing properties accumulate; any other kind replaces what it meets, in the order
 * {@link UnknownCostItem} over {@link UnknownCurrencyConversion} over {@link UnknownInflationFactor}
 * over {@link MissingProperties}. When both sides are of the winning kind the right-hand one is kept.
 */
public sealed interface CostEstimateError permits
        CostEstimateError.MissingProperties,
        CostEstimateError.UnknownCostItem,
        CostEstimateError.UnknownCurrencyConversion,
        CostEstimateError.UnknownInflationFactor {

    String type();

    String message();

    /**
     * Folds {@code other} into this error.
     */
    default CostEstimateError combine(CostEstimateError other) {
        if (this instanceof MissingProperties a && other instanceof MissingProperties b) {
            return a.combine(b);
        }
        if (other instanceof UnknownCostItem) return other;
        if (this instanceof UnknownCostItem) return this;
        if (other instanceof UnknownCurrencyConversion) return other;
        if (this instanceof UnknownCurrencyConversion) return this;
        if (other instanceof UnknownInflationFactor) return other;
        if (this instanceof UnknownInflationFactor) return this;
        throw new IllegalStateException("Unhandled error combination: " + this + " + " + other);
    }

    /**
     * Left fold of {@link #combine(CostEstimateError)} over the errors in order.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    static CostEstimateError combineAll(List<CostEstimateError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("No errors to combine");
        }
        CostEstimateError combined = errors.get(0);
        for (int i = 1; i < errors.size(); i++) {
            combined = combined.combine(errors.get(i));
        }
        return combined;
    }

    record MissingProperties(List<MissingProperty> properties) implements CostEstimateError {
        public MissingProperties {
            properties = properties == null ? List.of() : List.copyOf(properties);
        }

        MissingProperties combine(MissingProperties other) {
            List<MissingProperty> merged = new ArrayList<>(properties);
            merged.addAll(other.properties);
            return new MissingProperties(merged);
        }

        @Override
        public String type() {
            return "MissingProperties";
        }

        @Override
        public String message() {
            StringBuilder sb = new StringBuilder("Missing properties:");
            for (MissingProperty property : properties) {
                sb.append(' ').append(property.id()).append('.').append(property.property());
            }
            return sb.toString();
        }
    }

    /**
     * @param id the requesting cost item's id, not the unknown library reference
     */
    record UnknownCostItem(String id) implements CostEstimateError {
        @Override
        public String type() {
            return "UnknownCostItem";
        }

        @Override
        public String message() {
            return "Cost item '" + id + "' references an unknown cost library item";
        }
    }

    record UnknownCurrencyConversion(String currency) implements CostEstimateError {
        @Override
        public String type() {
            return "UnknownCurrencyConversion";
        }

        @Override
        public String message() {
            return "No conversion rate for currency '" + currency + "'";
        }
    }

    record UnknownInflationFactor(String year) implements CostEstimateError {
        @Override
        public String type() {
            return "UnknownInflationFactor";
        }

        @Override
        public String message() {
            return "No inflation factor for year " + year;
        }
    }
}
