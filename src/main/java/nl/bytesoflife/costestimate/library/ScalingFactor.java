package nl.bytesoflife.costestimate.library;

/**
 * A named dimension the linear capital cost formula scales by.
 *
 * @param name        parameter name the caller must supply
 * @param units       unit of the parameter, informational only
 * @param sourceValue value of the parameter the base cost was quoted at
 */
public record ScalingFactor(String name, String units, double sourceValue) {
    public ScalingFactor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scaling factor name must not be blank");
        }
        if (sourceValue == 0.0) {
            throw new IllegalArgumentException("Scaling factor '" + name + "' must have a non-zero source value");
        }
    }
}
