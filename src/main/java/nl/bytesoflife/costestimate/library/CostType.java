package nl.bytesoflife.costestimate.library;

import java.util.Locale;
import java.util.Map;

/**
 * Classifies what a cost reference item's capital cost represents.
 * An item contributes either to the asset's direct equipment cost (which is then Lang-factored)
 * or directly to its total installed cost.
 */
public enum CostType {
    DIRECT_EQUIPMENT_COST,
    TOTAL_INSTALLED_COST;

    private static final Map<String, CostType> LIBRARY_NAMES = Map.ofEntries(
            Map.entry("directequipmentcost", DIRECT_EQUIPMENT_COST),
            Map.entry("dec", DIRECT_EQUIPMENT_COST),
            Map.entry("totalinstalledcost", TOTAL_INSTALLED_COST),
            Map.entry("tic", TOTAL_INSTALLED_COST)
    );

    /**
     * Resolves a cost type as written in a library file. Spaces, underscores and hyphens are ignored,
     * so "DirectEquipmentCost", "direct equipment cost" and "DIRECT_EQUIPMENT_COST" are the same.
     * A null name means direct equipment cost.
     */
    public static CostType fromLibraryName(String name) {
        if (name == null) {
            return DIRECT_EQUIPMENT_COST;
        }
        String key = name.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
        CostType type = LIBRARY_NAMES.get(key);
        if (type == null) {
            throw new IllegalArgumentException("Unknown cost type: " + name);
        }
        return type;
    }
}
