package com.tfmigrate.transform.scan;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.parser.HclWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers the shape of an attribute value from its flat token run.
 * <p>
 * A single left-to-right pass with a {@link DepthTracker} splits arrays on
 * top-level commas and objects on top-level commas or newlines, so separators
 * inside strings, interpolations, calls and nested containers are ignored.
 * A value whose nesting does not close is abandoned: the scan returns no
 * elements and logs a warning.
 */
public final class ExpressionScanner {
    private static final Logger log = LoggerFactory.getLogger(ExpressionScanner.class);

    private static final List<HclToken> NULL_VALUE = List.of(HclToken.of(TokenType.IDENTIFIER, "null"));

    private ExpressionScanner() {
    }

    public static List<ArrayElement> parseArray(Attribute attribute) {
        if (attribute == null) {
            return List.of();
        }
        return parseArray(attribute.getExpression(), List.of());
    }

    public static List<ArrayElement> parseArray(List<HclToken> tokens) {
        return parseArray(tokens, List.of());
    }

    /**
     * Splits an array literal into its elements.
     *
     * @param tokens         value tokens, starting with {@code [}
     * @param optionalFields fields every object element must expose; absent ones are bound to {@code null}
     * @return the elements in source order, or an empty list when the value is not a
     * well-formed array literal
     */
    public static List<ArrayElement> parseArray(List<HclToken> tokens, Collection<String> optionalFields) {
        List<HclToken> value = trim(tokens);
        if (value.isEmpty() || !value.get(0).is(TokenType.OBRACK)) {
            log.debug("Value is not an array literal: {}", HclWriter.toText(value));
            return List.of();
        }

        List<List<HclToken>> rawElements = new ArrayList<>();
        List<HclToken> current = new ArrayList<>();
        DepthTracker depth = new DepthTracker();
        int closeIndex = -1;

        for (int i = 1; i < value.size(); i++) {
            HclToken token = value.get(i);
            if (depth.isTopLevel() && token.is(TokenType.CBRACK)) {
                closeIndex = i;
                break;
            }
            if (depth.isTopLevel() && token.is(TokenType.COMMA)) {
                rawElements.add(current);
                current = new ArrayList<>();
                continue;
            }
            depth.track(token);
            current.add(token);
        }
        rawElements.add(current);

        if (closeIndex < 0 || !depth.isBalanced()) {
            log.warn("Abandoning scan of malformed array value: {}", HclWriter.toText(value));
            return List.of();
        }
        if (closeIndex != value.size() - 1) {
            log.debug("Array literal is followed by more tokens, not a plain array: {}", HclWriter.toText(value));
            return List.of();
        }

        List<ArrayElement> elements = new ArrayList<>();
        for (List<HclToken> raw : rawElements) {
            List<HclToken> elementTokens = trim(raw);
            if (elementTokens.isEmpty()) {
                continue;
            }
            elements.add(toElement(elementTokens, optionalFields));
        }
        return elements;
    }

    /**
     * Reads the top-level entries of an object or map literal.
     *
     * @return the entries in source order, or an empty list when the value is not a
     * well-formed object literal
     */
    public static List<MapEntry> parseMap(List<HclToken> tokens) {
        List<HclToken> value = trim(tokens);
        if (!isWrappedObject(value)) {
            log.debug("Value is not an object literal: {}", HclWriter.toText(value));
            return List.of();
        }
        DepthTracker depth = new DepthTracker();
        for (HclToken token : value) {
            depth.track(token);
        }
        if (!depth.isBalanced()) {
            log.warn("Abandoning scan of malformed object value: {}", HclWriter.toText(value));
            return List.of();
        }
        return splitEntries(value.subList(1, value.size() - 1));
    }

    public static List<MapEntry> parseMap(Attribute attribute) {
        if (attribute == null) {
            return List.of();
        }
        return parseMap(attribute.getExpression());
    }

    /**
     * Classifies a value by the first token that decides it.
     * <p>
     * A brace makes an object and a number literal a number. A bare identifier
     * is a bool when it reads true or false, and a reference otherwise. A quoted
     * string is a template when it interpolates and a plain string when it does not.
     */
    public static ElementType classify(List<HclToken> tokens) {
        boolean quoted = false;
        boolean interpolated = false;

        for (HclToken token : tokens) {
            switch (token.getType()) {
                case OBRACE:
                    return ElementType.OBJECT;
                case OQUOTE:
                case CQUOTE:
                    quoted = true;
                    break;
                case TEMPLATE_INTERP:
                case TEMPLATE_SEQ_END:
                    interpolated = true;
                    break;
                case NUMBER_LIT:
                    return ElementType.NUMBER;
                case IDENTIFIER:
                    if (!quoted) {
                        return token.getText().equals("true") || token.getText().equals("false")
                                ? ElementType.BOOL
                                : ElementType.REFERENCE;
                    }
                    break;
                default:
                    break;
            }
        }

        if (interpolated) {
            return ElementType.TEMPLATE;
        }
        if (quoted) {
            return ElementType.STRING;
        }
        return ElementType.UNKNOWN;
    }

    /**
     * True for {@code []}, possibly with whitespace or comments inside.
     */
    public static boolean isEmptyArray(List<HclToken> tokens) {
        List<HclToken> value = trim(tokens);
        return value.size() >= 2 && value.get(0).is(TokenType.OBRACK)
                && value.get(value.size() - 1).is(TokenType.CBRACK)
                && value.subList(1, value.size() - 1).stream().allMatch(HclToken::isTrivia);
    }

    /**
     * Drops whitespace, newlines and comments from both ends of a token run.
     */
    public static List<HclToken> trim(List<HclToken> tokens) {
        int start = 0;
        int end = tokens.size();
        while (start < end && tokens.get(start).isTrivia()) {
            start++;
        }
        while (end > start && tokens.get(end - 1).isTrivia()) {
            end--;
        }
        return new ArrayList<>(tokens.subList(start, end));
    }

    private static ArrayElement toElement(List<HclToken> tokens, Collection<String> optionalFields) {
        ElementType type = classify(tokens);
        ArrayElement.ArrayElementBuilder element = ArrayElement.builder()
                .type(type)
                .tokens(List.copyOf(tokens));

        if (type == ElementType.OBJECT && isWrappedObject(tokens)) {
            Map<String, List<HclToken>> fields = new LinkedHashMap<>();
            for (MapEntry entry : splitEntries(tokens.subList(1, tokens.size() - 1))) {
                fields.put(entry.getKey(), entry.getValueTokens());
            }
            for (String optional : optionalFields) {
                fields.putIfAbsent(optional, NULL_VALUE);
            }
            element.fields(fields);
        }
        return element.build();
    }

    private static boolean isWrappedObject(List<HclToken> tokens) {
        if (tokens.size() < 2 || !tokens.get(0).is(TokenType.OBRACE)
                || !tokens.get(tokens.size() - 1).is(TokenType.CBRACE)) {
            return false;
        }
        // the closing brace must match the opening one, as in {a = 1}, not {a = 1} + {b = 2}
        DepthTracker depth = new DepthTracker();
        for (int i = 0; i < tokens.size() - 1; i++) {
            depth.track(tokens.get(i));
            if (depth.isTopLevel()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits the inside of an object literal into entries. Entries end at a
     * top-level comma or newline; a key is separated from its value by = or :.
     */
    private static List<MapEntry> splitEntries(List<HclToken> inner) {
        List<MapEntry> entries = new ArrayList<>();
        List<HclToken> current = new ArrayList<>();
        DepthTracker depth = new DepthTracker();

        for (HclToken token : inner) {
            if (depth.isTopLevel() && (token.is(TokenType.COMMA) || token.is(TokenType.NEWLINE))) {
                addEntry(entries, current);
                current = new ArrayList<>();
                continue;
            }
            depth.track(token);
            current.add(token);
        }
        addEntry(entries, current);
        return entries;
    }

    private static void addEntry(List<MapEntry> entries, List<HclToken> raw) {
        List<HclToken> entry = trim(raw);
        if (entry.isEmpty()) {
            return;
        }
        DepthTracker depth = new DepthTracker();
        for (int i = 0; i < entry.size(); i++) {
            HclToken token = entry.get(i);
            if (depth.isTopLevel() && (token.is(TokenType.EQUAL) || token.is(TokenType.COLON))) {
                List<HclToken> key = trim(entry.subList(0, i));
                List<HclToken> value = trim(entry.subList(i + 1, entry.size()));
                if (!key.isEmpty() && !value.isEmpty()) {
                    entries.add(new MapEntry(List.copyOf(key), List.copyOf(value)));
                }
                return;
            }
            depth.track(token);
        }
        log.debug("Skipping object entry without a key: {}", HclWriter.toText(entry));
    }
}
