package nl.bytesoflife.costestimate.library.parser;

import nl.bytesoflife.costestimate.library.parser.JsonLexer.Token;
import nl.bytesoflife.costestimate.library.parser.JsonLexer.Type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A value in a parsed JSON document together with its path from the root ({@code $.modules[0].id}).
 * Typed accessors read members by key and fail with an {@link IllegalArgumentException} that names
 * the path of the offending member, so callers never deal with raw maps and casts.
 *
 * <pre>
 * JsonNode root = JsonNode.parse(content);
 * for (JsonNode module : root.objects("modules")) {
 *     String id = module.requireString("id");
 * }
 * </pre>
 */
public final class JsonNode {

    private final Object value;
    private final String path;

    private JsonNode(Object value, String path) {
        this.value = value;
        this.path = path;
    }

    /**
     * Parses a complete document whose root is an object. Object members keep their order;
     * integers become {@link Long}, other numbers {@link Double}.
     *
     * @throws IllegalArgumentException with line and column if the text is not valid JSON
     */
    public static JsonNode parse(String json) {
        if (json == null) {
            throw new IllegalArgumentException("JSON content must not be null");
        }
        JsonLexer lexer = new JsonLexer(json);
        Object root = readValue(lexer, lexer.next());
        Token trailing = lexer.next();
        if (trailing.type() != Type.END) {
            throw lexer.unexpected(trailing, "end of input");
        }
        JsonNode node = new JsonNode(root, "$");
        node.members();
        return node;
    }

    public String path() {
        return path;
    }

    public boolean isNull() {
        return value == null;
    }

    /**
     * The raw value: a {@code Map}, {@code List}, {@code String}, {@code Number}, {@code Boolean} or null.
     */
    public Object value() {
        return value;
    }

    public Set<String> keys() {
        return members().keySet();
    }

    /**
     * Member {@code key} of this object; a null node if it is absent.
     */
    public JsonNode get(String key) {
        return new JsonNode(members().get(key), path + "." + key);
    }

    public JsonNode optionalObject(String key) {
        JsonNode child = get(key);
        if (child.isNull()) {
            return null;
        }
        child.members();
        return child;
    }

    public JsonNode requireObject(String key) {
        JsonNode child = get(key);
        if (child.isNull()) {
            throw child.failure("missing");
        }
        child.members();
        return child;
    }

    /**
     * Elements of array member {@code key}, each of which must be an object. An absent member is an empty array.
     */
    public List<JsonNode> objects(String key) {
        JsonNode child = get(key);
        if (child.isNull()) {
            return List.of();
        }
        if (!(child.value instanceof List<?> elements)) {
            throw child.failure("expected an array");
        }
        List<JsonNode> nodes = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = new JsonNode(elements.get(i), child.path + "[" + i + "]");
            element.members();
            nodes.add(element);
        }
        return nodes;
    }

    /**
     * String member {@code key}, or null if absent. Integral numbers are accepted and
     * rendered without a fraction, since years appear both as {@code 2024} and {@code "2024"}.
     */
    public String optionalString(String key) {
        JsonNode child = get(key);
        if (child.value == null) return null;
        if (child.value instanceof String s) return s;
        if (child.value instanceof Long n) return String.valueOf(n);
        throw child.failure("expected a string");
    }

    public String requireString(String key) {
        String s = optionalString(key);
        if (s == null) {
            throw get(key).failure("missing");
        }
        return s;
    }

    public double requireDouble(String key) {
        return get(key).asDouble();
    }

    /**
     * This node as a number. Numeric strings are accepted.
     */
    public double asDouble() {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw failure("not a number '" + s + "'");
            }
        }
        throw failure(value == null ? "missing" : "expected a number");
    }

    /**
     * Every member of this object read as a number, in document order.
     */
    public Map<String, Double> asDoubleMap() {
        Map<String, Double> result = new LinkedHashMap<>();
        for (String key : keys()) {
            result.put(key, get(key).asDouble());
        }
        return result;
    }

    /**
     * An exception for a problem with this node's value, prefixed with its path.
     */
    public IllegalArgumentException failure(String message) {
        return new IllegalArgumentException(path + ": " + message);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> members() {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw failure("expected an object");
    }

    @Override
    public String toString() {
        return path + "=" + value;
    }

    // --- Document reading ---

    private static Object readValue(JsonLexer lexer, Token token) {
        return switch (token.type()) {
            case BEGIN_OBJECT -> readObject(lexer);
            case BEGIN_ARRAY -> readArray(lexer);
            case STRING -> token.text();
            case NUMBER -> toNumber(token.text());
            case LITERAL -> token.text().equals("null") ? null : Boolean.valueOf(token.text());
            default -> throw lexer.unexpected(token, "a value");
        };
    }

    private static Map<String, Object> readObject(JsonLexer lexer) {
        Map<String, Object> members = new LinkedHashMap<>();
        Token token = lexer.next();
        if (token.type() == Type.END_OBJECT) {
            return members;
        }
        while (true) {
            if (token.type() != Type.STRING) {
                throw lexer.unexpected(token, "a member name");
            }
            String key = token.text();
            Token colon = lexer.next();
            if (colon.type() != Type.COLON) {
                throw lexer.unexpected(colon, "':'");
            }
            members.put(key, readValue(lexer, lexer.next()));

            Token separator = lexer.next();
            if (separator.type() == Type.END_OBJECT) {
                return members;
            }
            if (separator.type() != Type.COMMA) {
                throw lexer.unexpected(separator, "',' or '}'");
            }
            token = lexer.next();
        }
    }

    private static List<Object> readArray(JsonLexer lexer) {
        List<Object> elements = new ArrayList<>();
        Token token = lexer.next();
        if (token.type() == Type.END_ARRAY) {
            return elements;
        }
        while (true) {
            elements.add(readValue(lexer, token));

            Token separator = lexer.next();
            if (separator.type() == Type.END_ARRAY) {
                return elements;
            }
            if (separator.type() != Type.COMMA) {
                throw lexer.unexpected(separator, "',' or ']'");
            }
            token = lexer.next();
        }
    }

    private static Number toNumber(String literal) {
        if (literal.indexOf('.') < 0 && literal.indexOf('e') < 0 && literal.indexOf('E') < 0) {
            try {
                return Long.valueOf(literal);
            } catch (NumberFormatException e) {
                // integer beyond long range
                return Double.valueOf(literal);
            }
        }
        return Double.valueOf(literal);
    }
}
