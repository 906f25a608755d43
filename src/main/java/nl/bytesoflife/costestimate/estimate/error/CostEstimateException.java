package nl.bytesoflife.costestimate.estimate.error;

/**
 * Signals that an estimate could not be produced. Carries the structured error for the caller to render.
 */
public class CostEstimateException extends Exception {

    private final CostEstimateError error;

    public CostEstimateException(CostEstimateError error) {
        super(error.message());
        this.error = error;
    }

    public CostEstimateError getError() {
        return error;
    }
}
