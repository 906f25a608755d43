package nl.bytesoflife.costestimate.library;

import nl.bytesoflife.costestimate.library.parser.CostLibraryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The cost library versions available to the process, keyed by library id (e.g. "V1.3", "V2.0").
 * Populated once at startup, read-only afterwards.
 *
 * <pre>
 * CostLibraryRegistry registry = CostLibraryRegistry.fromClasspath("/cost-libraries", "V1.3", "V2.0");
 * CostLibrary library = registry.get("V2.0");
 * </pre>
 */
public class CostLibraryRegistry {

    private static final Logger log = LoggerFactory.getLogger(CostLibraryRegistry.class);

    public static final String LIBRARY_FILE_NAME = "cost-library.json";

    private final Map<String, CostLibrary> libraries = new ConcurrentHashMap<>();
    private final CostLibraryParser parser = new CostLibraryParser();

    /**
     * Loads {@code <basePath>/<id>/cost-library.json} from the classpath for each id.
     */
    public static CostLibraryRegistry fromClasspath(String basePath, String... libraryIds) throws IOException {
        CostLibraryRegistry registry = new CostLibraryRegistry();
        String base = basePath.endsWith("/") ? basePath : basePath + "/";
        for (String libraryId : libraryIds) {
            registry.loadResource(libraryId, base + libraryId + "/" + LIBRARY_FILE_NAME);
        }
        return registry;
    }

    public CostLibraryRegistry register(String libraryId, CostLibrary library) {
        if (libraryId == null || libraryId.isBlank()) {
            throw new IllegalArgumentException("Library id must not be blank");
        }
        if (library == null) {
            throw new IllegalArgumentException("Library must not be null");
        }
        if (libraries.putIfAbsent(libraryId, library) != null) {
            throw new IllegalStateException("Cost library already registered: " + libraryId);
        }
        log.info("Registered cost library {}: {}", libraryId, library);
        return this;
    }

    public CostLibraryRegistry loadResource(String libraryId, String resource) throws IOException {
        try (InputStream is = CostLibraryRegistry.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new FileNotFoundException("Cost library resource not found: " + resource);
            }
            log.debug("Loading cost library {} from classpath {}", libraryId, resource);
            return register(libraryId, parser.parse(is));
        }
    }

    public CostLibraryRegistry loadFile(String libraryId, Path file) throws IOException {
        log.debug("Loading cost library {} from {}", libraryId, file);
        return register(libraryId, parser.parse(Files.readString(file)));
    }

    public boolean contains(String libraryId) {
        return libraries.containsKey(libraryId);
    }

    /**
     * @throws CostLibraryNotFoundException if no library is registered under the id
     */
    public CostLibrary get(String libraryId) {
        CostLibrary library = libraryId != null ? libraries.get(libraryId) : null;
        if (library == null) {
            throw new CostLibraryNotFoundException(libraryId);
        }
        return library;
    }

    public List<String> listLibraryIds() {
        return libraries.keySet().stream().sorted().toList();
    }

    public List<CostModule> listModules(String libraryId) {
        return get(libraryId).getModules();
    }

    public List<String> listCurrencies(String libraryId) {
        return get(libraryId).getCurrencyConversion().getCurrencyCodes();
    }
}
