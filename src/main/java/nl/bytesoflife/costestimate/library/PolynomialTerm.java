package nl.bytesoflife.costestimate.library;

/**
 * One term of a {@link Cost.Polynomial} formula.
 */
public sealed interface PolynomialTerm permits PolynomialTerm.Variable, PolynomialTerm.Constant {

    /**
     * Evaluates to {@code coefficient * value * exponent}, where value is the supplied parameter
     * named {@code dimensionName}. The exponent is a plain multiplier, it is not raised to.
     */
    record Variable(String dimensionName, double coefficient, double exponent) implements PolynomialTerm {
        public Variable {
            if (dimensionName == null || dimensionName.isBlank()) {
                throw new IllegalArgumentException("Polynomial dimension name must not be blank");
            }
        }
    }

    record Constant(double value) implements PolynomialTerm {
    }
}
