package nl.bytesoflife.costestimate.library;

import java.util.List;

/**
 * Capital cost formula of a cost reference item. Either a linear formula scaled by the item's
 * scaling factors, or a polynomial over named dimensions.
 */
public sealed interface Cost permits Cost.Linear, Cost.Polynomial {

    /**
     * {@code baseCost} multiplied by the ratio of every supplied scaling parameter to its source value.
     */
    record Linear(double baseCost) implements Cost {
    }

    /**
     * Sum of its terms.
     */
    record Polynomial(List<PolynomialTerm> terms) implements Cost {
        public Polynomial {
            terms = terms == null ? List.of() : List.copyOf(terms);
        }
    }
}
