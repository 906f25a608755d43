package nl.bytesoflife.costestimate.library.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonNodeTest {

    private static final String LIBRARY_SHAPED = """
            {
              "modules": [
                { "id": "M0101", "definition": { "type": "Dehydration" }, "subtype": null },
                { "id": "M0201", "definition": { "type": "CaptureUnit" }, "subtype": "Amine" }
              ],
              "inflation": { "current_year": 2024, "factors": { "2023": 1.04, "2024": 1 } },
              "rate": "1.15",
              "flags": [true, false, null],
              "name": "V2.0"
            }
            """;

    @Test
    void readsMembersByKey() {
        JsonNode root = JsonNode.parse(LIBRARY_SHAPED);

        List<JsonNode> modules = root.objects("modules");
        assertEquals(2, modules.size());
        assertEquals("M0201", modules.get(1).requireString("id"));
        assertEquals("CaptureUnit", modules.get(1).requireObject("definition").requireString("type"));
        assertNull(modules.get(0).optionalString("subtype"));
        assertEquals("V2.0", root.requireString("name"));
        assertEquals(1.15, root.requireDouble("rate"));
        assertEquals(Arrays.asList(true, false, null), root.get("flags").value());
    }

    @Test
    void tracksPathOfEveryNode() {
        JsonNode root = JsonNode.parse(LIBRARY_SHAPED);

        assertEquals("$", root.path());
        assertEquals("$.modules[1]", root.objects("modules").get(1).path());
        assertEquals("$.modules[1].definition", root.objects("modules").get(1).requireObject("definition").path());
        assertEquals("$.inflation.factors.2023", root.requireObject("inflation").requireObject("factors").get("2023").path());
    }

    @Test
    void readsIntegralYearsAsStrings() {
        JsonNode inflation = JsonNode.parse(LIBRARY_SHAPED).requireObject("inflation");

        assertEquals("2024", inflation.optionalString("current_year"));
    }

    @Test
    void readsNumberMapsInDocumentOrder() {
        Map<String, Double> factors = JsonNode.parse(LIBRARY_SHAPED)
                .requireObject("inflation").requireObject("factors").asDoubleMap();

        assertEquals(List.of("2023", "2024"), List.copyOf(factors.keySet()));
        assertEquals(1.0, factors.get("2024"));
    }

    @Test
    void keepsIntegersAndFractionsApart() {
        JsonNode root = JsonNode.parse("{\"count\": 3, \"negative\": -4, \"rate\": 0.5, \"big\": 1.2e7}");

        assertEquals(3L, root.get("count").value());
        assertEquals(-4L, root.get("negative").value());
        assertEquals(0.5, root.get("rate").value());
        assertEquals(1.2e7, root.get("big").value());
    }

    @Test
    void absentMembersAreNullOrEmpty() {
        JsonNode root = JsonNode.parse("{\"a\": {}}");

        assertTrue(root.get("missing").isNull());
        assertNull(root.optionalObject("missing"));
        assertNull(root.optionalString("missing"));
        assertTrue(root.objects("missing").isEmpty());
        assertTrue(root.requireObject("a").keys().isEmpty());
    }

    @Test
    void decodesEscapes() {
        JsonNode root = JsonNode.parse("{\"s\": \"a\\\"b\\\\c\\/d\\te\\u00e9\"}");

        assertEquals("a\"b\\c/d\teé", root.requireString("s"));
    }

    @Test
    void typeMismatchNamesPath() {
        JsonNode root = JsonNode.parse(LIBRARY_SHAPED);

        IllegalArgumentException notArray = assertThrows(IllegalArgumentException.class, () -> root.objects("name"));
        assertEquals("$.name: expected an array", notArray.getMessage());

        IllegalArgumentException notObject = assertThrows(IllegalArgumentException.class, () -> root.objects("flags"));
        assertEquals("$.flags[0]: expected an object", notObject.getMessage());

        IllegalArgumentException notNumber = assertThrows(IllegalArgumentException.class, () -> root.requireDouble("name"));
        assertEquals("$.name: not a number 'V2.0'", notNumber.getMessage());

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> root.objects("modules").get(0).requireString("subtype"));
        assertEquals("$.modules[0].subtype: missing", missing.getMessage());

        assertThrows(IllegalArgumentException.class, () -> root.optionalString("inflation"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "[1, 2]",
            "{\"a\": 1",
            "{\"a\": 1} trailing",
            "{\"a\": tru}",
            "{\"a\": @}",
            "{\"a\" 1}",
            "{\"a\": 1,}",
            "{\"a\": 1.2.3}",
            "{\"a\": 01}",
            "{\"a\": \"unterminated}",
            "{\"a\": \"bad \\x escape\"}",
            "{\"a\": \"\\u12\"}",
            "{\"a\": \"line\nbreak\"}"
    })
    void rejectsInvalidDocuments(String json) {
        assertThrows(IllegalArgumentException.class, () -> JsonNode.parse(json));
    }

    @Test
    void reportsLineAndColumn() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JsonNode.parse("{\n  \"a\": tru\n}"));

        assertEquals("Invalid JSON at line 2, column 8: unexpected 'tru'", e.getMessage());
    }

    @Test
    void reportsWhatWasExpected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JsonNode.parse("{\"a\": 1 \"b\": 2}"));

        assertEquals("Invalid JSON at line 1, column 9: expected ',' or '}' but found string \"b\"", e.getMessage());
    }

    @Test
    void rootMustBeObject() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JsonNode.parse("[1]"));

        assertEquals("$: expected an object", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> JsonNode.parse(null));
    }
}
