package com.tfmigrate.transform.tokens;

import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds token runs for values the engine writes itself.
 * <p>
 * Every method returns a new mutable list so callers may append to it.
 */
public final class TokenBuilder {

    private TokenBuilder() {
    }

    /**
     * A single identifier token. Dotted traversals such as {@code var.zone_id} are
     * kept as one token.
     */
    public static List<HclToken> identifier(String name) {
        return tokens(HclToken.of(TokenType.IDENTIFIER, name));
    }

    /**
     * The address of a resource, {@code type.name}, as used by moved and import blocks.
     */
    public static List<HclToken> resourceReference(String resourceType, String resourceName) {
        return tokens(
                HclToken.of(TokenType.IDENTIFIER, resourceType),
                HclToken.of(TokenType.DOT, "."),
                HclToken.of(TokenType.IDENTIFIER, resourceName));
    }

    /**
     * A quoted template that interpolates an expression and appends a literal
     * suffix: {@code "${<expression>}<suffix>"}.
     */
    public static List<HclToken> templateString(List<HclToken> expression, String suffix) {
        List<HclToken> result = tokens(
                HclToken.of(TokenType.OQUOTE, "\""),
                HclToken.of(TokenType.TEMPLATE_INTERP, "${"));
        result.addAll(expression);
        result.add(HclToken.of(TokenType.TEMPLATE_SEQ_END, "}"));
        if (suffix != null && !suffix.isEmpty()) {
            result.add(HclToken.of(TokenType.QUOTED_LIT, escape(suffix)));
        }
        result.add(HclToken.of(TokenType.CQUOTE, "\""));
        return result;
    }

    public static List<HclToken> stringLiteral(String value) {
        List<HclToken> result = tokens(HclToken.of(TokenType.OQUOTE, "\""));
        if (!value.isEmpty()) {
            result.add(HclToken.of(TokenType.QUOTED_LIT, escape(value)));
        }
        result.add(HclToken.of(TokenType.CQUOTE, "\""));
        return result;
    }

    /**
     * Tokens for a string, integer, floating point or boolean value.
     *
     * @return the tokens, or an empty list for any other type
     */
    public static List<HclToken> simpleValue(Object value) {
        if (value instanceof String text) {
            return stringLiteral(text);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return tokens(HclToken.of(TokenType.NUMBER_LIT, value.toString()));
        }
        if (value instanceof Double || value instanceof Float) {
            String number = new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
            return tokens(HclToken.of(TokenType.NUMBER_LIT, number));
        }
        if (value instanceof Boolean flag) {
            return identifier(flag.toString());
        }
        return new ArrayList<>();
    }

    public static List<HclToken> nullValue() {
        return identifier("null");
    }

    public static List<HclToken> emptyArray() {
        return tokens(HclToken.of(TokenType.OBRACK, "["), HclToken.of(TokenType.CBRACK, "]"));
    }

    /**
     * A single-line tuple: {@code [a, b]}.
     */
    public static List<HclToken> tuple(List<List<HclToken>> elements) {
        List<HclToken> result = tokens(HclToken.of(TokenType.OBRACK, "["));
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                result.add(HclToken.of(TokenType.COMMA, ","));
                result.add(HclToken.of(TokenType.WHITESPACE, " "));
            }
            result.addAll(elements.get(i));
        }
        result.add(HclToken.of(TokenType.CBRACK, "]"));
        return result;
    }

    /**
     * A tuple with one element per line, used for arrays of objects.
     */
    public static List<HclToken> multilineTuple(List<List<HclToken>> elements) {
        if (elements.isEmpty()) {
            return emptyArray();
        }
        List<HclToken> result = tokens(HclToken.of(TokenType.OBRACK, "["), newline());
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                result.add(HclToken.of(TokenType.COMMA, ","));
                result.add(newline());
            }
            result.addAll(elements.get(i));
        }
        result.add(newline());
        result.add(HclToken.of(TokenType.CBRACK, "]"));
        return result;
    }

    /**
     * An object literal with one field per line, in the map's iteration order.
     */
    public static List<HclToken> object(Map<String, List<HclToken>> fields) {
        if (fields.isEmpty()) {
            return tokens(HclToken.of(TokenType.OBRACE, "{"), HclToken.of(TokenType.CBRACE, "}"));
        }
        List<HclToken> result = tokens(HclToken.of(TokenType.OBRACE, "{"), newline());
        for (Map.Entry<String, List<HclToken>> field : fields.entrySet()) {
            result.addAll(objectKey(field.getKey()));
            result.addAll(assignment());
            result.addAll(field.getValue());
            result.add(newline());
        }
        result.add(HclToken.of(TokenType.CBRACE, "}"));
        return result;
    }

    /**
     * The {@code " = "} between a name and its value.
     */
    public static List<HclToken> assignment() {
        return tokens(
                HclToken.of(TokenType.WHITESPACE, " "),
                HclToken.of(TokenType.EQUAL, "="),
                HclToken.of(TokenType.WHITESPACE, " "));
    }

    public static HclToken newline() {
        return HclToken.of(TokenType.NEWLINE, "\n");
    }

    private static List<HclToken> objectKey(String key) {
        if (isIdentifier(key)) {
            return identifier(key);
        }
        return stringLiteral(key);
    }

    static boolean isIdentifier(String name) {
        if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '-')) {
                return false;
            }
        }
        return true;
    }

    private static String escape(String value) {
        StringBuilder escaped = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> escaped.append("\\\"");
                case '\\' -> escaped.append("\\\\");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                case '$', '%' -> {
                    escaped.append(c);
                    if (i + 1 < value.length() && value.charAt(i + 1) == '{') {
                        escaped.append(c);
                    }
                }
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static List<HclToken> tokens(HclToken... tokens) {
        return new ArrayList<>(List.of(tokens));
    }
}
