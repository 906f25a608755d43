package nl.bytesoflife.costestimate.library.parser;

import nl.bytesoflife.costestimate.library.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON form of a cost library version ({@code cost-library.json}).
 *
 * <pre>
 * {
 *   "modules": [{ "id": "M0101", "definition": { "type": "Dehydration" }, "subtype": null,
 *                 "cost_items": [ ... ] }],
 *   "currency_conversion": { "base_currency": "GBP", "rates": { "GBP": 1.0, "EUR": 1.15 } },
 *   "inflation": { "current_year": "2024", "factors": { "2023": 1.04, "2024": 1.0 } }
 * }
 * </pre>
 *
 * Malformed content fails with {@link IllegalArgumentException} naming the offending path,
 * e.g. {@code $.modules[3].cost_items[0].capex_contribution: missing}.
 */
public class CostLibraryParser {

    public CostLibrary parse(String content) {
        return buildLibrary(JsonNode.parse(content));
    }

    public CostLibrary parse(InputStream is) throws IOException {
        String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        return parse(content);
    }

    private CostLibrary buildLibrary(JsonNode root) {
        List<CostModule> modules = new ArrayList<>();
        for (JsonNode module : root.objects("modules")) {
            modules.add(buildModule(module));
        }

        JsonNode currency = root.requireObject("currency_conversion");
        CurrencyConversionRates currencyConversion = new CurrencyConversionRates(
                currency.requireString("base_currency"),
                currency.requireObject("rates").asDoubleMap());

        JsonNode inflation = root.requireObject("inflation");
        InflationFactors inflationFactors = new InflationFactors(
                inflation.optionalString("current_year"),
                inflation.requireObject("factors").asDoubleMap());

        return new CostLibrary(modules, currencyConversion, inflationFactors);
    }

    private CostModule buildModule(JsonNode node) {
        JsonNode definition = node.optionalObject("definition");
        List<CostReferenceItem> items = new ArrayList<>();
        for (JsonNode item : node.objects("cost_items")) {
            items.add(buildCostItem(item));
        }
        return new CostModule(
                node.requireString("id"),
                definition != null ? definition.optionalString("type") : null,
                node.optionalString("subtype"),
                items);
    }

    private CostReferenceItem buildCostItem(JsonNode node) {
        String shortName = null;
        String description = null;
        CostType costType = CostType.DIRECT_EQUIPMENT_COST;
        JsonNode info = node.optionalObject("info");
        if (info != null) {
            shortName = info.optionalString("short_name");
            description = info.optionalString("description");
            try {
                costType = CostType.fromLibraryName(info.optionalString("cost_type"));
            } catch (IllegalArgumentException e) {
                throw info.get("cost_type").failure(e.getMessage());
            }
        }

        List<ScalingFactor> scalingFactors = new ArrayList<>();
        for (JsonNode factor : node.objects("scaling_factors")) {
            scalingFactors.add(new ScalingFactor(
                    factor.requireString("name"),
                    factor.optionalString("units"),
                    factor.requireDouble("source_value")));
        }

        JsonNode capex = node.requireObject("capex_contribution");
        CapexContribution capexContribution = new CapexContribution(
                (int) capex.requireDouble("year"),
                capex.requireString("currency"),
                buildCost(capex.requireObject("cost")));

        List<VariableOpexContribution> opexContributions = new ArrayList<>();
        for (JsonNode opex : node.objects("variable_opex_contributions")) {
            opexContributions.add(new VariableOpexContribution(
                    opex.requireString("name"),
                    opex.optionalString("units"),
                    opex.requireDouble("scaled_by")));
        }

        return new CostReferenceItem(node.requireString("id"), shortName, description, costType,
                scalingFactors, capexContribution, opexContributions);
    }

    private Cost buildCost(JsonNode node) {
        String type = node.requireString("type");
        return switch (type) {
            case "Linear" -> new Cost.Linear(node.requireDouble("base_cost"));
            case "Polynomial" -> {
                List<PolynomialTerm> terms = new ArrayList<>();
                for (JsonNode term : node.objects("parameters")) {
                    terms.add(buildTerm(term));
                }
                yield new Cost.Polynomial(terms);
            }
            default -> throw node.failure("unknown cost type '" + type + "'");
        };
    }

    private PolynomialTerm buildTerm(JsonNode node) {
        String type = node.requireString("type");
        return switch (type) {
            case "Variable" -> new PolynomialTerm.Variable(
                    node.requireString("dimension_name"),
                    node.requireDouble("coefficient"),
                    node.requireDouble("exponent"));
            case "Constant" -> new PolynomialTerm.Constant(node.requireDouble("value"));
            default -> throw node.failure("unknown polynomial term type '" + type + "'");
        };
    }
}
