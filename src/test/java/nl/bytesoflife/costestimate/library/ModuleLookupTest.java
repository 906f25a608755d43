package nl.bytesoflife.costestimate.library;

import nl.bytesoflife.costestimate.CostLibraryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModuleLookupTest {

    private ModuleLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new ModuleLookup(CostLibraryFixtures.library());
    }

    @ParameterizedTest
    @CsvSource({
            "Capture Unit, CaptureUnit",
            "capture unit, CaptureUnit",
            "CAPTURE_UNIT, CaptureUnit",
            "capture-unit, CaptureUnit",
            "CaptureUnit, CaptureUnit",
            "captureUnit, CaptureUnit",
            "Pipe, Pipe",
            "pipe, Pipe",
            "'  Pipe  ', Pipe"
    })
    void normalizesBlockTypes(String blockType, String expected) {
        assertEquals(expected, ModuleLookup.normalizeBlockType(blockType));
    }

    @Test
    void findsModuleByTypeAndSubtype() {
        assertEquals("M0201", lookup.lookup("Capture Unit", "Amine").getId());
        assertEquals("M0202", lookup.lookup("capture unit", "CRYOGENIC").getId());
        assertNull(lookup.lookup("Capture Unit", "Membrane"));
    }

    @Test
    void prefersModuleWithoutSubtype() {
        assertEquals("M0101", lookup.lookup("Dehydration", null).getId());
        assertEquals("M0102", lookup.lookup("Dehydration", "glycol").getId());
    }

    @Test
    void singleModuleOfTypeNeedsNoSubtype() {
        assertEquals("M0103", lookup.lookup("compressor", "").getId());
    }

    @Test
    void ambiguousLookupWithoutSubtypeFindsNothing() {
        assertNull(lookup.lookup("Capture Unit", null));
        assertNull(lookup.lookup("Heat Exchanger", null));
    }

    @Test
    void listsTypesAndSubtypes() {
        assertEquals(List.of("Dehydration", "Compressor", "CaptureUnit", "Pipe"), lookup.listTypes());
        assertEquals(List.of("Amine", "Cryogenic"), lookup.listSubtypes("Capture Unit"));
        assertEquals(List.of("Glycol"), lookup.listSubtypes("Dehydration"));
        assertTrue(lookup.listSubtypes("Unknown").isEmpty());
    }

    @Test
    void findsAllModulesOfType() {
        assertEquals(List.of("M0201", "M0202"),
                lookup.findByType("capture_unit").stream().map(CostModule::getId).toList());
        assertTrue(lookup.findByType("Unknown").isEmpty());
    }

    @Test
    void findsModulesAndCostItemsById() {
        assertEquals(6, lookup.listAll().size());
        assertEquals("Pipe", lookup.getById("M0301").getType());
        assertNull(lookup.getById("M9999"));
        assertEquals("Item 008", lookup.getCostItem("M0301", "Item 008").getId());
        assertNull(lookup.getCostItem("M0301", "Item 001"));
        assertNull(lookup.getCostItem("M9999", "Item 001"));
    }
}
