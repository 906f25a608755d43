package nl.bytesoflife.costestimate.library;

import java.util.ArrayList;
import java.util.List;

/**
 * A group of cost reference items describing one kind of plant module, e.g. a compressor
 * or an amine capture unit.
 */
public class CostModule {

    private final String id;
    private final String type;
    private final String subtype;
    private final List<CostReferenceItem> costItems;

    public CostModule(String id, String type, String subtype, List<CostReferenceItem> costItems) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Module id must not be blank");
        }
        this.id = id;
        this.type = type;
        this.subtype = subtype;
        this.costItems = costItems == null ? List.of() : List.copyOf(costItems);
    }

    public String getId() {
        return id;
    }

    /**
     * Module type from the library's module definition (e.g. "CaptureUnit"), or null.
     */
    public String getType() {
        return type;
    }

    public String getSubtype() {
        return subtype;
    }

    public List<CostReferenceItem> getCostItems() {
        return costItems;
    }

    public List<String> getCostItemIds() {
        return costItems.stream().map(CostReferenceItem::getId).toList();
    }

    public CostReferenceItem findCostItem(String costItemId) {
        for (CostReferenceItem item : costItems) {
            if (item.getId().equals(costItemId)) {
                return item;
            }
        }
        return null;
    }

    /**
     * Every parameter the module's cost items need, scaling factors first, then variable opex
     * contributions, in declaration order.
     */
    public List<RequiredParameter> requiredParameters() {
        List<RequiredParameter> parameters = new ArrayList<>();
        for (CostReferenceItem item : costItems) {
            for (ScalingFactor factor : item.getScalingFactors()) {
                parameters.add(new RequiredParameter(factor.name(), factor.units(), item.getId()));
            }
            for (VariableOpexContribution contribution : item.getVariableOpexContributions()) {
                parameters.add(new RequiredParameter(contribution.name(), contribution.units(), item.getId()));
            }
        }
        return parameters;
    }

    @Override
    public String toString() {
        return "CostModule{id=" + id + ", type=" + type
                + (subtype != null ? ", subtype=" + subtype : "")
                + ", costItems=" + costItems.size() + "}";
    }
}
