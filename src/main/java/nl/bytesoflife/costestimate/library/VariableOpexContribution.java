package nl.bytesoflife.costestimate.library;

/**
 * Declares that a cost item consumes a utility or consumable.
 * The name matches one of the variable operating cost categories and is also
 * the name of the parameter the caller supplies the consumption under.
 *
 * @param name     category name, e.g. "Electrical power"
 * @param units    unit of the supplied consumption, informational only
 * @param scaledBy multiplier applied to the supplied consumption
 */
public record VariableOpexContribution(String name, String units, double scaledBy) {
    public VariableOpexContribution {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable opex contribution name must not be blank");
        }
    }
}
