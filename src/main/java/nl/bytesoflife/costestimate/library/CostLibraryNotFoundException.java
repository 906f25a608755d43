package nl.bytesoflife.costestimate.library;

/**
 * Thrown when a library id does not name a registered cost library version.
 */
public class CostLibraryNotFoundException extends RuntimeException {

    private final String libraryId;

    public CostLibraryNotFoundException(String libraryId) {
        super("Cost library not found: " + libraryId);
        this.libraryId = libraryId;
    }

    public String getLibraryId() {
        return libraryId;
    }
}
