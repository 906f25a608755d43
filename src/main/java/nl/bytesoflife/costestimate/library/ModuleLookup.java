package nl.bytesoflife.costestimate.library;

import java.util.*;

/**
 * Finds the modules of a cost library by block type and subtype, as a network editor names them.
 * Block types are matched after normalising to PascalCase, subtypes case-insensitively.
 */
public class ModuleLookup {

    private static final String NO_SUBTYPE = "";

    private final Map<String, CostModule> byId = new LinkedHashMap<>();
    private final Map<String, Map<String, CostModule>> byTypeAndSubtype = new LinkedHashMap<>();

    public ModuleLookup(CostLibrary library) {
        for (CostModule module : library.getModules()) {
            byId.put(module.getId(), module);
            if (module.getType() == null) continue;
            String subtypeKey = module.getSubtype() != null
                    ? module.getSubtype().toLowerCase(Locale.ROOT) : NO_SUBTYPE;
            byTypeAndSubtype
                    .computeIfAbsent(normalizeBlockType(module.getType()), k -> new LinkedHashMap<>())
                    .put(subtypeKey, module);
        }
    }

    public CostModule getById(String moduleId) {
        return byId.get(moduleId);
    }

    public List<CostModule> listAll() {
        return List.copyOf(byId.values());
    }

    /**
     * Looks up a module by block type and optional subtype.
     * Without a subtype, the module of that type without a subtype is returned; failing that,
     * the only module of that type. Returns null when nothing matches or the choice is ambiguous.
     */
    public CostModule lookup(String blockType, String subtype) {
        Map<String, CostModule> subtypes = byTypeAndSubtype.get(normalizeBlockType(blockType));
        if (subtypes == null) {
            return null;
        }
        if (subtype != null && !subtype.isEmpty()) {
            return subtypes.get(subtype.toLowerCase(Locale.ROOT));
        }
        if (subtypes.containsKey(NO_SUBTYPE)) {
            return subtypes.get(NO_SUBTYPE);
        }
        if (subtypes.size() == 1) {
            return subtypes.values().iterator().next();
        }
        return null;
    }

    public List<CostModule> findByType(String blockType) {
        Map<String, CostModule> subtypes = byTypeAndSubtype.get(normalizeBlockType(blockType));
        return subtypes == null ? List.of() : List.copyOf(subtypes.values());
    }

    public List<String> listTypes() {
        return List.copyOf(byTypeAndSubtype.keySet());
    }

    public List<String> listSubtypes(String blockType) {
        return findByType(blockType).stream()
                .map(CostModule::getSubtype)
                .filter(Objects::nonNull)
                .toList();
    }

    public CostReferenceItem getCostItem(String moduleId, String costItemId) {
        CostModule module = byId.get(moduleId);
        return module != null ? module.findCostItem(costItemId) : null;
    }

    /**
     * Normalises a user-facing block type to the library's PascalCase form:
     * "Capture Unit", "capture unit" and "CAPTURE_UNIT" all become "CaptureUnit".
     * Names that are already mixed-case without separators are kept, with the first letter upper-cased.
     */
    static String normalizeBlockType(String blockType) {
        if (blockType == null) {
            return "";
        }
        String trimmed = blockType.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        boolean hasSeparator = trimmed.chars().anyMatch(c -> Character.isWhitespace(c) || c == '_' || c == '-');
        boolean hasLower = trimmed.chars().anyMatch(Character::isLowerCase);
        boolean hasUpper = trimmed.chars().anyMatch(Character::isUpperCase);
        if (!hasSeparator && hasLower && hasUpper) {
            return Character.toUpperCase(trimmed.charAt(0)) + trimmed.substring(1);
        }

        StringBuilder sb = new StringBuilder();
        for (String word : trimmed.split("[\\s_-]+")) {
            if (word.isEmpty()) continue;
            sb.append(Character.toUpperCase(word.charAt(0)));
            sb.append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
