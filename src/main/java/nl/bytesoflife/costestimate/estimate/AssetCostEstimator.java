package nl.bytesoflife.costestimate.estimate;

import nl.bytesoflife.costestimate.estimate.error.CostEstimateError;
import nl.bytesoflife.costestimate.estimate.error.CostEstimateException;
import nl.bytesoflife.costestimate.estimate.result.*;
import nl.bytesoflife.costestimate.library.CostLibrary;
import nl.bytesoflife.costestimate.library.CostReferenceItem;
import nl.bytesoflife.costestimate.request.AssetParameters;
import nl.bytesoflife.costestimate.request.CostItemParameters;
import nl.bytesoflife.costestimate.request.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Estimates one asset: links and costs each of its cost items, derives the Lang-factored capital cost,
 * total installed cost, fixed and variable opex and decommissioning cost, and spreads them over the
 * asset's timeline with discounted cash flow weighting.
 */
public class AssetCostEstimator {

    private static final Logger log = LoggerFactory.getLogger(AssetCostEstimator.class);

    /** Decommissioning costs this share of the installed cost excluding contingency. */
    static final double DECOMMISSIONING_FACTOR = 0.1;

    private final CostCalculator calculator;

    public AssetCostEstimator(CostCalculator calculator) {
        this.calculator = calculator;
    }

    /**
     * @throws CostEstimateException if any cost item fails to link (all linking errors of the asset,
     *                               combined) or a currency or inflation factor is missing
     */
    public AssetCostEstimate estimate(AssetParameters asset) throws CostEstimateException {
        CostLibrary library = calculator.getLibrary();
        Map<String, CostReferenceItem> referenceItems = library.costReferenceItemsById();

        List<LinkedCostItem> linkedItems = new ArrayList<>();
        List<CostEstimateError> errors = new ArrayList<>();
        for (CostItemParameters costItem : asset.costItems()) {
            try {
                linkedItems.add(LinkedCostItem.findAndLink(costItem, referenceItems, library));
            } catch (CostEstimateException e) {
                errors.add(e.getError());
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Asset {}: {} of {} cost items failed to link",
                    asset.id(), errors.size(), asset.costItems().size());
            throw new CostEstimateException(CostEstimateError.combineAll(errors));
        }

        Timeline timeline = asset.timeline();
        double discountRate = asset.discountRate();

        List<CostItemCostEstimate> costItems = new ArrayList<>();
        for (LinkedCostItem item : linkedItems) {
            costItems.add(estimateCostItem(item, timeline, discountRate));
        }

        double directEquipmentCost = 0.0;
        double itemTotalInstalledCost = 0.0;
        VariableOpexCostEstimate variableOpexPerYear = VariableOpexCostEstimate.ZERO;
        for (CostItemCostEstimate item : costItems) {
            CostItemCosts costs = item.costs();
            if (costs.directEquipmentCost() != null) {
                directEquipmentCost += costs.directEquipmentCost();
            }
            if (costs.totalInstalledCost() != null) {
                itemTotalInstalledCost += costs.totalInstalledCost();
            }
            variableOpexPerYear = variableOpexPerYear.plus(costs.variableOpexCostPerYear());
        }

        LangFactoredCostEstimate langFactored = LangFactoredCostEstimate.of(directEquipmentCost, asset.capexLangFactors());
        double installedExcludingContingency = directEquipmentCost + langFactored.total() - langFactored.contingency();
        double totalInstalledCost = installedExcludingContingency + itemTotalInstalledCost;
        FixedOpexCostEstimate fixedOpexPerYear = FixedOpexCostEstimate.of(totalInstalledCost, asset.opexFactors());
        double decommissioningCost = installedExcludingContingency * DECOMMISSIONING_FACTOR;

        AssetCosts costs = new AssetCosts(
                directEquipmentCost,
                langFactored,
                totalInstalledCost,
                fixedOpexPerYear,
                variableOpexPerYear,
                decommissioningCost);

        List<YearAssetCosts> costsByYear = spread(costs, timeline, discountRate);

        AssetPeriodCosts lifetimeCosts = AssetPeriodCosts.ZERO;
        AssetPeriodCosts lifetimeDcfCosts = AssetPeriodCosts.ZERO;
        for (YearAssetCosts year : costsByYear) {
            lifetimeCosts = lifetimeCosts.plus(year.costsInYear());
            lifetimeDcfCosts = lifetimeDcfCosts.plus(year.dcfCostsInYear());
        }

        log.debug("Asset {}: {} cost items, direct equipment cost {}, total installed cost {}",
                asset.id(), costItems.size(), directEquipmentCost, totalInstalledCost);

        return new AssetCostEstimate(asset.id(), costs, costsByYear, lifetimeCosts, lifetimeDcfCosts, costItems);
    }

    private CostItemCostEstimate estimateCostItem(LinkedCostItem item, Timeline timeline, double discountRate)
            throws CostEstimateException {
        CostItemCosts costs = item.getCosts(calculator);

        List<YearCostItemCosts> costsByYear = new ArrayList<>();
        CostItemPeriodCosts lifetimeCosts = CostItemPeriodCosts.EMPTY;
        CostItemPeriodCosts lifetimeDcfCosts = CostItemPeriodCosts.EMPTY;
        for (int year = timeline.start(); year <= timeline.end(); year++) {
            CostItemPeriodCosts inYear = costs.inYear(year, timeline);
            CostItemPeriodCosts dcfInYear = inYear.dividedBy(discountDivisor(discountRate, year - timeline.start()));
            costsByYear.add(new YearCostItemCosts(year, inYear, dcfInYear));
            lifetimeCosts = lifetimeCosts.plus(inYear);
            lifetimeDcfCosts = lifetimeDcfCosts.plus(dcfInYear);
        }

        return new CostItemCostEstimate(item.getId(), item.getQuantity(), costs,
                costsByYear, lifetimeCosts, lifetimeDcfCosts);
    }

    /**
     * Spreads asset costs over every year of the timeline. Capital costs are divided evenly over the
     * construction years, opex is charged in full in each operation year, and decommissioning cost is
     * divided evenly over the decommissioning years. Each category is zero outside its own range.
     */
    static List<YearAssetCosts> spread(AssetCosts costs, Timeline timeline, double discountRate) {
        int constructionYears = timeline.constructionYearCount();
        int decommissioningYears = timeline.decommissioningYearCount();
        double directEquipmentPerYear = costs.directEquipmentCost() / constructionYears;
        double totalInstalledPerYear = costs.totalInstalledCost() / constructionYears;
        LangFactoredCostEstimate langFactoredPerYear = costs.langFactoredCapitalCost().dividedBy(constructionYears);
        double decommissioningPerYear = costs.decommissioningCost() / decommissioningYears;

        List<YearAssetCosts> years = new ArrayList<>();
        for (int year = timeline.start(); year <= timeline.end(); year++) {
            boolean construction = timeline.isConstructionYear(year);
            boolean operation = timeline.isOperationYear(year);
            AssetPeriodCosts inYear = new AssetPeriodCosts(
                    construction ? directEquipmentPerYear : 0.0,
                    construction ? langFactoredPerYear : LangFactoredCostEstimate.ZERO,
                    construction ? totalInstalledPerYear : 0.0,
                    operation ? costs.fixedOpexCostPerYear() : FixedOpexCostEstimate.ZERO,
                    operation ? costs.variableOpexCostPerYear() : VariableOpexCostEstimate.ZERO,
                    timeline.isDecommissioningYear(year) ? decommissioningPerYear : 0.0);
            AssetPeriodCosts dcfInYear = inYear.dividedBy(discountDivisor(discountRate, year - timeline.start()));
            years.add(new YearAssetCosts(year, inYear, dcfInYear));
        }
        return years;
    }

    /**
     * {@code (1 + discountRate)^yearOffset}; dividing a year's cost by it gives the discounted cost.
     */
    static double discountDivisor(double discountRate, int yearOffset) {
        return Math.pow(1.0 + discountRate, yearOffset);
    }

    /**
     * Discount factor applied to costs {@code yearOffset} years after construction start.
     */
    public static double discountFactor(double discountRate, int yearOffset) {
        return 1.0 / discountDivisor(discountRate, yearOffset);
    }
}
