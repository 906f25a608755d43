package nl.bytesoflife.costestimate.estimate;

import nl.bytesoflife.costestimate.estimate.error.CostEstimateError;
import nl.bytesoflife.costestimate.estimate.error.CostEstimateException;
import nl.bytesoflife.costestimate.estimate.result.AssetCostEstimate;
import nl.bytesoflife.costestimate.estimate.result.CostEstimate;
import nl.bytesoflife.costestimate.library.CostLibrary;
import nl.bytesoflife.costestimate.library.CostLibraryRegistry;
import nl.bytesoflife.costestimate.request.AssetParameters;
import nl.bytesoflife.costestimate.request.CostEstimateOptions;
import nl.bytesoflife.costestimate.request.CostEstimateRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for cost estimation. Estimates every asset of a request against a cost library
 * version; the request either succeeds as a whole or fails with one combined error.
 *
 * <pre>
 * CostEstimate estimate = new CostEstimator(registry)
 *     .withDefaultOptions(CostEstimateOptions.inCurrency("EUR"))
 *     .estimate("V2.0", request);
 * </pre>
 *
 * Configure before sharing; after that one instance can serve concurrent calls.
 */
public class CostEstimator {

    private static final Logger log = LoggerFactory.getLogger(CostEstimator.class);

    private final CostLibraryRegistry registry;
    private CostEstimateOptions defaultOptions = CostEstimateOptions.defaults();

    public CostEstimator(CostLibraryRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("CostLibraryRegistry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Options used by {@link #estimate(String, CostEstimateRequest)}.
     */
    public CostEstimator withDefaultOptions(CostEstimateOptions options) {
        this.defaultOptions = options != null ? options : CostEstimateOptions.defaults();
        return this;
    }

    public CostEstimate estimate(String libraryId, CostEstimateRequest request) throws CostEstimateException {
        return estimate(libraryId, request, defaultOptions);
    }

    /**
     * Estimates a request against the library registered under {@code libraryId}.
     *
     * @throws nl.bytesoflife.costestimate.library.CostLibraryNotFoundException if the library id is unknown
     * @throws CostEstimateException                                           if the request cannot be estimated
     */
    public CostEstimate estimate(String libraryId, CostEstimateRequest request, CostEstimateOptions options)
            throws CostEstimateException {
        CostLibrary library = registry.get(libraryId);
        log.debug("Estimating {} assets against cost library {}", request.assets().size(), libraryId);
        return estimate(library, request, options);
    }

    /**
     * Estimates a request against the given library.
     */
    public static CostEstimate estimate(CostLibrary library, CostEstimateRequest request, CostEstimateOptions options)
            throws CostEstimateException {
        AssetCostEstimator assetEstimator;
        try {
            assetEstimator = new AssetCostEstimator(CostCalculator.forOptions(library, options));
        } catch (CostEstimateException e) {
            log.warn("Cost estimate rejected: {}", e.getMessage());
            throw e;
        }

        List<AssetCostEstimate> assets = new ArrayList<>();
        List<CostEstimateError> errors = new ArrayList<>();
        for (AssetParameters asset : request.assets()) {
            try {
                assets.add(assetEstimator.estimate(asset));
            } catch (CostEstimateException e) {
                errors.add(e.getError());
            }
        }

        if (!errors.isEmpty()) {
            CostEstimateError combined = CostEstimateError.combineAll(errors);
            log.warn("Cost estimate failed for {} of {} assets: {}",
                    errors.size(), request.assets().size(), combined.message());
            throw new CostEstimateException(combined);
        }
        return new CostEstimate(assets);
    }
}
