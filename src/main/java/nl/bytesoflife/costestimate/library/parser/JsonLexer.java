package nl.bytesoflife.costestimate.library.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits JSON text into tokens, tracking line and column for error messages.
 * String tokens carry their decoded text, number tokens their literal text.
 */
final class JsonLexer {

    enum Type {
        BEGIN_OBJECT, END_OBJECT, BEGIN_ARRAY, END_ARRAY, COLON, COMMA, STRING, NUMBER, LITERAL, END
    }

    record Token(Type type, String text, int line, int column) {
        String describe() {
            return switch (type) {
                case END -> "end of input";
                case STRING -> "string \"" + text + "\"";
                default -> "'" + text + "'";
            };
        }
    }

    private static final Pattern NUMBER = Pattern.compile("-?(?:0|[1-9]\\d*)(?:\\.\\d+)?(?:[eE][+-]?\\d+)?");

    private final String text;
    private int pos;
    private int line = 1;
    private int column = 1;

    JsonLexer(String text) {
        this.text = text;
    }

    Token next() {
        skipWhitespace();
        int startLine = line;
        int startColumn = column;
        if (pos >= text.length()) {
            return new Token(Type.END, "", startLine, startColumn);
        }

        char c = text.charAt(pos);
        Type punctuation = switch (c) {
            case '{' -> Type.BEGIN_OBJECT;
            case '}' -> Type.END_OBJECT;
            case '[' -> Type.BEGIN_ARRAY;
            case ']' -> Type.END_ARRAY;
            case ':' -> Type.COLON;
            case ',' -> Type.COMMA;
            default -> null;
        };
        if (punctuation != null) {
            consume(1);
            return new Token(punctuation, String.valueOf(c), startLine, startColumn);
        }
        if (c == '"') {
            return new Token(Type.STRING, readString(), startLine, startColumn);
        }
        if (c == '-' || (c >= '0' && c <= '9')) {
            return new Token(Type.NUMBER, readNumber(), startLine, startColumn);
        }
        if (Character.isLetter(c)) {
            String word = readWord();
            if (word.equals("true") || word.equals("false") || word.equals("null")) {
                return new Token(Type.LITERAL, word, startLine, startColumn);
            }
            throw error(startLine, startColumn, "unexpected '" + word + "'");
        }
        throw error(startLine, startColumn, "unexpected character '" + c + "'");
    }

    IllegalArgumentException unexpected(Token token, String expected) {
        return error(token.line(), token.column(), "expected " + expected + " but found " + token.describe());
    }

    private String readString() {
        int startLine = line;
        int startColumn = column;
        consume(1);
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw error(startLine, startColumn, "unterminated string");
            }
            char c = text.charAt(pos);
            if (c == '"') {
                consume(1);
                return sb.toString();
            }
            if (c < 0x20) {
                throw error(line, column, "control character in string");
            }
            if (c != '\\') {
                sb.append(c);
                consume(1);
                continue;
            }
            if (pos + 1 >= text.length()) {
                throw error(startLine, startColumn, "unterminated string");
            }
            char escaped = text.charAt(pos + 1);
            switch (escaped) {
                case '"', '\\', '/' -> sb.append(escaped);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> {
                    sb.append(readUnicodeEscape());
                    continue;
                }
                default -> throw error(line, column, "invalid escape '\\" + escaped + "'");
            }
            consume(2);
        }
    }

    private char readUnicodeEscape() {
        int end = pos + 6;
        String hex = text.substring(pos + 2, Math.min(end, text.length()));
        if (hex.length() != 4 || !hex.chars().allMatch(h -> Character.digit(h, 16) >= 0)) {
            throw error(line, column, "invalid unicode escape '\\u" + hex + "'");
        }
        consume(6);
        return (char) Integer.parseInt(hex, 16);
    }

    private String readNumber() {
        Matcher matcher = NUMBER.matcher(text).region(pos, text.length());
        if (!matcher.lookingAt()) {
            throw error(line, column, "malformed number");
        }
        String literal = matcher.group();
        consume(literal.length());
        return literal;
    }

    private String readWord() {
        int end = pos;
        while (end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
            end++;
        }
        String word = text.substring(pos, end);
        consume(word.length());
        return word;
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                column = 1;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                consume(1);
            } else {
                return;
            }
        }
    }

    private void consume(int count) {
        pos += count;
        column += count;
    }

    private static IllegalArgumentException error(int line, int column, String message) {
        return new IllegalArgumentException("Invalid JSON at line " + line + ", column " + column + ": " + message);
    }
}
