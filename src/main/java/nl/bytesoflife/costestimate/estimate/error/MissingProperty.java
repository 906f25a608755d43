package nl.bytesoflife.costestimate.estimate.error;

/**
 * A parameter a cost item needs but the caller did not supply.
 *
 * @param id       the requesting cost item's id
 * @param property the missing parameter name
 */
public record MissingProperty(String id, String property) {
}
