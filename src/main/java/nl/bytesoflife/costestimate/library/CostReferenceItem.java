package nl.bytesoflife.costestimate.library;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One catalog entry of a cost library: a parametrised capital cost formula plus
 * the utilities and consumables the item draws on while operating.
 */
public class CostReferenceItem {

    private final String id;
    private final String shortName;
    private final String description;
    private final CostType costType;
    private final List<ScalingFactor> scalingFactors;
    private final CapexContribution capexContribution;
    private final List<VariableOpexContribution> variableOpexContributions;

    public CostReferenceItem(String id,
                             String shortName,
                             String description,
                             CostType costType,
                             List<ScalingFactor> scalingFactors,
                             CapexContribution capexContribution,
                             List<VariableOpexContribution> variableOpexContributions) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Cost reference item id must not be blank");
        }
        if (capexContribution == null) {
            throw new IllegalArgumentException("Cost reference item '" + id + "' has no capex contribution");
        }
        this.id = id;
        this.shortName = shortName;
        this.description = description;
        this.costType = costType != null ? costType : CostType.DIRECT_EQUIPMENT_COST;
        this.scalingFactors = scalingFactors == null ? List.of() : List.copyOf(scalingFactors);
        this.capexContribution = capexContribution;
        this.variableOpexContributions = variableOpexContributions == null
                ? List.of() : List.copyOf(variableOpexContributions);
    }

    public CostReferenceItem(String id,
                             CostType costType,
                             List<ScalingFactor> scalingFactors,
                             CapexContribution capexContribution,
                             List<VariableOpexContribution> variableOpexContributions) {
        this(id, null, null, costType, scalingFactors, capexContribution, variableOpexContributions);
    }

    public String getId() {
        return id;
    }

    public String getShortName() {
        return shortName;
    }

    public String getDescription() {
        return description;
    }

    public CostType getCostType() {
        return costType;
    }

    public List<ScalingFactor> getScalingFactors() {
        return scalingFactors;
    }

    public CapexContribution getCapexContribution() {
        return capexContribution;
    }

    public List<VariableOpexContribution> getVariableOpexContributions() {
        return variableOpexContributions;
    }

    /**
     * Returns the contribution declared under the given category name, or null.
     */
    public VariableOpexContribution findVariableOpexContribution(String name) {
        for (VariableOpexContribution contribution : variableOpexContributions) {
            if (contribution.name().equals(name)) {
                return contribution;
            }
        }
        return null;
    }

    /**
     * Names of every parameter a caller has to supply for this item:
     * all scaling factor names plus all variable opex contribution names.
     */
    public Set<String> getRequiredParameterNames() {
        Set<String> names = new LinkedHashSet<>();
        for (ScalingFactor factor : scalingFactors) {
            names.add(factor.name());
        }
        for (VariableOpexContribution contribution : variableOpexContributions) {
            names.add(contribution.name());
        }
        return names;
    }

    @Override
    public String toString() {
        return "CostReferenceItem{id=" + id + ", costType=" + costType
                + ", cost=" + capexContribution.cost() + "}";
    }
}
