package nl.bytesoflife.costestimate.library;

import nl.bytesoflife.costestimate.CostLibraryFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CostLibraryRegistryTest {

    @Test
    void loadsLibrariesFromClasspath() throws IOException {
        CostLibraryRegistry registry = CostLibraryRegistry.fromClasspath("/cost-libraries", "test");

        assertTrue(registry.contains("test"));
        assertEquals(List.of("test"), registry.listLibraryIds());
        assertEquals(4, registry.listModules("test").size());
        assertEquals(List.of("EUR", "GBP", "USD"), registry.listCurrencies("test"));
    }

    @Test
    void missingResourceFails() {
        assertThrows(FileNotFoundException.class,
                () -> CostLibraryRegistry.fromClasspath("/cost-libraries/", "V0.0"));
    }

    @Test
    void loadsLibraryFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(CostLibraryRegistry.LIBRARY_FILE_NAME);
        try (InputStream is = getClass().getResourceAsStream("/cost-libraries/test/cost-library.json")) {
            Files.copy(is, file);
        }

        CostLibraryRegistry registry = new CostLibraryRegistry().loadFile("V2.0", file);

        assertNotNull(registry.get("V2.0").findModule("M0202"));
    }

    @Test
    void listsLibraryIdsSorted() {
        CostLibraryRegistry registry = new CostLibraryRegistry()
                .register("V2.0", CostLibraryFixtures.library())
                .register("V1.3", CostLibraryFixtures.library());

        assertEquals(List.of("V1.3", "V2.0"), registry.listLibraryIds());
    }

    @Test
    void rejectsDuplicateId() {
        CostLibraryRegistry registry = new CostLibraryRegistry().register("V1", CostLibraryFixtures.library());

        assertThrows(IllegalStateException.class, () -> registry.register("V1", CostLibraryFixtures.library()));
    }

    @Test
    void rejectsBlankId() {
        CostLibraryRegistry registry = new CostLibraryRegistry();

        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", CostLibraryFixtures.library()));
        assertThrows(IllegalArgumentException.class, () -> registry.register("V1", null));
    }

    @Test
    void unknownIdIsNotFound() {
        CostLibraryRegistry registry = new CostLibraryRegistry();

        CostLibraryNotFoundException e = assertThrows(CostLibraryNotFoundException.class, () -> registry.get("V9"));
        assertEquals("V9", e.getLibraryId());
        assertThrows(CostLibraryNotFoundException.class, () -> registry.listCurrencies("V9"));
        assertFalse(registry.contains("V9"));
    }
}
