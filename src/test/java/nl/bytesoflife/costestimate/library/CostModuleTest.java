package nl.bytesoflife.costestimate.library;

import nl.bytesoflife.costestimate.CostLibraryFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CostModuleTest {

    private final CostLibrary library = CostLibraryFixtures.library();

    @Test
    void listsRequiredParametersPerCostItem() {
        assertEquals(List.of(
                new RequiredParameter("Captured CO2", "t/h", "Item 004"),
                new RequiredParameter("Electrical power", "kW", "Item 004"),
                new RequiredParameter("Tariff paid to storage reservoir owner", "t/h", "Item 004")),
                library.findModule("M0201").requiredParameters());
        assertTrue(library.findModule("M0202").requiredParameters().isEmpty());
    }

    @Test
    void indexesCostItemsAcrossModules() {
        Map<String, CostReferenceItem> items = library.costReferenceItemsById();

        assertEquals(8, items.size());
        assertEquals(List.of("Item 001", "Item 002", "Item 003", "Item 004",
                "Item 005", "Item 006", "Item 007", "Item 008"), List.copyOf(items.keySet()));
    }

    @Test
    void laterModuleWinsForDuplicateItemId() {
        CostReferenceItem first = new CostReferenceItem("Item 1", CostType.DIRECT_EQUIPMENT_COST, List.of(),
                new CapexContribution(2024, "GBP", new Cost.Linear(1.0)), List.of());
        CostReferenceItem second = new CostReferenceItem("Item 1", CostType.TOTAL_INSTALLED_COST, List.of(),
                new CapexContribution(2024, "GBP", new Cost.Linear(2.0)), List.of());
        CostLibrary duplicated = new CostLibrary(List.of(
                new CostModule("M1", "A", null, List.of(first)),
                new CostModule("M2", "B", null, List.of(second))),
                new CurrencyConversionRates("GBP", Map.of("GBP", 1.0)),
                new InflationFactors("2024", Map.of("2024", 1.0)));

        assertSame(second, duplicated.costReferenceItemsById().get("Item 1"));
    }

    @Test
    void rejectsZeroSourceValue() {
        assertThrows(IllegalArgumentException.class, () -> new ScalingFactor("length", "m", 0.0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"DirectEquipmentCost", "direct equipment cost", "DIRECT_EQUIPMENT_COST", "dec"})
    void resolvesDirectEquipmentCost(String name) {
        assertEquals(CostType.DIRECT_EQUIPMENT_COST, CostType.fromLibraryName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"TotalInstalledCost", "Total Installed Cost", "total-installed-cost", "TIC"})
    void resolvesTotalInstalledCost(String name) {
        assertEquals(CostType.TOTAL_INSTALLED_COST, CostType.fromLibraryName(name));
    }

    @Test
    void missingCostTypeMeansDirectEquipmentCost() {
        assertEquals(CostType.DIRECT_EQUIPMENT_COST, CostType.fromLibraryName(null));
        assertThrows(IllegalArgumentException.class, () -> CostType.fromLibraryName("Opex"));
    }
}
