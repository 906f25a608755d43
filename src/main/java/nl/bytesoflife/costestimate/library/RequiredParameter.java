package nl.bytesoflife.costestimate.library;

/**
 * A parameter a caller must supply for a module.
 *
 * @param name       parameter name
 * @param units      parameter units as declared in the library
 * @param costItemId id of the cost reference item that needs it
 */
public record RequiredParameter(String name, String units, String costItemId) {
}
