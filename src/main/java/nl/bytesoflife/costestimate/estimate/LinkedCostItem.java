package nl.bytesoflife.costestimate.estimate;

import nl.bytesoflife.costestimate.estimate.error.CostEstimateError;
import nl.bytesoflife.costestimate.estimate.error.CostEstimateException;
import nl.bytesoflife.costestimate.estimate.error.MissingProperty;
import nl.bytesoflife.costestimate.estimate.result.CostItemCosts;
import nl.bytesoflife.costestimate.estimate.result.VariableOpexCostEstimate;
import nl.bytesoflife.costestimate.library.CostLibrary;
import nl.bytesoflife.costestimate.library.CostReferenceItem;
import nl.bytesoflife.costestimate.request.CostItemParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A requested cost item bound to the library entry it references. Only lives for one estimation call.
 */
public class LinkedCostItem {

    private final CostItemParameters costItem;
    private final CostReferenceItem costReferenceItem;
    private final CostLibrary costLibrary;

    private LinkedCostItem(CostItemParameters costItem, CostReferenceItem costReferenceItem, CostLibrary costLibrary) {
        this.costItem = costItem;
        this.costReferenceItem = costReferenceItem;
        this.costLibrary = costLibrary;
    }

    /**
     * Resolves the cost item's reference and checks that every parameter the library entry needs
     * was supplied.
     *
     * @throws CostEstimateException with {@link CostEstimateError.UnknownCostItem} if the reference is unknown,
     *                               or {@link CostEstimateError.MissingProperties} listing every missing parameter
     */
    public static LinkedCostItem findAndLink(CostItemParameters costItem,
                                             Map<String, CostReferenceItem> costReferenceItems,
                                             CostLibrary costLibrary) throws CostEstimateException {
        CostReferenceItem referenceItem = costReferenceItems.get(costItem.ref());
        if (referenceItem == null) {
            throw new CostEstimateException(new CostEstimateError.UnknownCostItem(costItem.id()));
        }

        Set<String> supplied = costItem.parameters().keySet();
        List<MissingProperty> missing = new ArrayList<>();
        for (String required : referenceItem.getRequiredParameterNames()) {
            if (!supplied.contains(required)) {
                missing.add(new MissingProperty(costItem.id(), required));
            }
        }
        if (!missing.isEmpty()) {
            throw new CostEstimateException(new CostEstimateError.MissingProperties(missing));
        }

        return new LinkedCostItem(costItem, referenceItem, costLibrary);
    }

    public String getId() {
        return costItem.id();
    }

    public int getQuantity() {
        return costItem.quantity();
    }

    public Map<String, Double> getParameters() {
        return costItem.parameters();
    }

    public CostReferenceItem getCostReferenceItem() {
        return costReferenceItem;
    }

    public CostLibrary getCostLibrary() {
        return costLibrary;
    }

    /**
     * Computes the item's costs, multiplied by its quantity.
     */
    public CostItemCosts getCosts(CostCalculator calculator) throws CostEstimateException {
        Double directEquipmentCost = calculator.directEquipmentCost(costReferenceItem, costItem.parameters());
        Double totalInstalledCost = calculator.totalInstalledCost(costReferenceItem, costItem.parameters());
        VariableOpexCostEstimate variableOpex = calculator.variableOpexCost(costReferenceItem, costItem.parameters());
        return new CostItemCosts(directEquipmentCost, totalInstalledCost, variableOpex)
                .times(costItem.quantity());
    }
}
