package com.tfmigrate.transform.attr;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclNode;
import com.tfmigrate.parser.HclParser;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.transform.derive.DerivedBlockBuilder;
import com.tfmigrate.transform.derive.IdentifierListRewriter;
import com.tfmigrate.transform.scan.ArrayElement;
import com.tfmigrate.transform.scan.DepthTracker;
import com.tfmigrate.transform.scan.ElementType;
import com.tfmigrate.transform.scan.ExpressionScanner;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Attribute-level edits used by resource migrations: renames, copies, value
 * extraction and flat-to-nested restructuring.
 * <p>
 * Missing attributes are never an error. Operations report whether they did
 * anything through their return value.
 */
public final class AttributeOperations {
    private static final Logger log = LoggerFactory.getLogger(AttributeOperations.class);

    private static final String LIFECYCLE = "lifecycle";

    /**
     * Root identifiers that mark a value as computed rather than literal.
     */
    private static final Set<String> EXPRESSION_ROOTS = Set.of("each", "var", "local", "count", "data", "module");

    private AttributeOperations() {
    }

    /**
     * Sets an attribute to a default value unless it is already present.
     */
    public static void ensureAttribute(Body body, String name, Object defaultValue) {
        if (!body.hasAttribute(name)) {
            setAttribute(body, name, defaultValue);
        }
    }

    /**
     * Sets an attribute, overwriting any existing value. Accepts strings,
     * numbers, booleans, lists of strings and string-valued maps; any other
     * value leaves the body unchanged.
     */
    public static void setAttribute(Body body, String name, Object value) {
        List<HclToken> tokens = valueTokens(value);
        if (tokens.isEmpty()) {
            log.warn("Cannot set {} from a value of type {}", name,
                    value == null ? "null" : value.getClass().getSimpleName());
            return;
        }
        body.setAttributeRaw(name, tokens);
    }

    /**
     * Renames an attribute in place and follows the rename inside the
     * {@code ignore_changes} and {@code replace_triggered_by} lists of any
     * lifecycle block in the same body.
     *
     * @return true when the attribute itself was found
     */
    public static boolean renameAttribute(Body body, String oldName, String newName) {
        boolean renamed = body.renameAttribute(oldName, newName);

        Map<String, String> rename = Map.of(oldName, newName);
        for (Block lifecycle : body.findBlocks(LIFECYCLE)) {
            Body lifecycleBody = lifecycle.getBody();
            for (String listName : List.of(DerivedBlockBuilder.IGNORE_CHANGES, DerivedBlockBuilder.REPLACE_TRIGGERED_BY)) {
                lifecycleBody.findAttribute(listName)
                        .filter(list -> list.getExpression().stream().anyMatch(token -> token.isIdentifier(oldName)))
                        .ifPresent(list -> list.setExpression(
                                IdentifierListRewriter.rewrite(list.getExpression(), rename, null)));
            }
        }
        if (renamed) {
            log.debug("Renamed attribute {} to {}", oldName, newName);
        }
        return renamed;
    }

    /**
     * Renames a scalar attribute and wraps its value in a one-element list.
     */
    public static boolean renameAndWrapInArray(Body body, String oldName, String newName) {
        Optional<Attribute> attribute = body.findAttribute(oldName);
        if (attribute.isEmpty()) {
            return false;
        }
        List<HclToken> wrapped = TokenBuilder.tuple(List.of(ExpressionScanner.trim(attribute.get().getExpression())));
        int index = body.indexOf(attribute.get());
        body.removeAttribute(oldName);
        body.insertAttribute(index, newName, wrapped);
        return true;
    }

    /**
     * @return the number of attributes actually removed
     */
    public static int removeAttributes(Body body, String... names) {
        int removed = 0;
        for (String name : names) {
            if (body.removeAttribute(name)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Reads the first string literal or identifier of a value: {@code "A"} gives
     * {@code A} and {@code var.record_type} gives {@code var}.
     *
     * @return the text, or an empty string when the attribute is absent or has neither
     */
    public static String extractString(Attribute attribute) {
        if (attribute == null) {
            return "";
        }
        for (HclToken token : attribute.getExpression()) {
            if (token.is(TokenType.QUOTED_LIT) || token.is(TokenType.IDENTIFIER)) {
                return token.getText();
            }
        }
        return "";
    }

    public static Optional<Boolean> extractBool(Attribute attribute) {
        if (attribute == null) {
            return Optional.empty();
        }
        for (HclToken token : attribute.getExpression()) {
            if (token.isIdentifier("true")) {
                return Optional.of(Boolean.TRUE);
            }
            if (token.isIdentifier("false")) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    public static boolean hasAttribute(Body body, String name) {
        return body.hasAttribute(name);
    }

    public static void copyAttribute(Body from, Body to, String name) {
        copyAndRenameAttribute(from, to, name, name);
    }

    public static boolean copyAndRenameAttribute(Body from, Body to, String oldName, String newName) {
        Optional<Attribute> attribute = from.findAttribute(oldName);
        attribute.ifPresent(source -> to.setAttributeRaw(newName, source.getExpression()));
        return attribute.isPresent();
    }

    /**
     * Applies {@link #renameAttribute} for every entry of the map.
     *
     * @return the number of attributes renamed
     */
    public static int applyRenames(Body body, Map<String, String> renames) {
        int renamed = 0;
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            if (renameAttribute(body, rename.getKey(), rename.getValue())) {
                renamed++;
            }
        }
        return renamed;
    }

    public static boolean conditionalRename(Body body, String oldName, String newName, Predicate<Attribute> condition) {
        Optional<Attribute> attribute = body.findAttribute(oldName);
        if (attribute.isEmpty() || !condition.test(attribute.get())) {
            return false;
        }
        return body.renameAttribute(oldName, newName);
    }

    /**
     * True when the attribute holds an object literal with a top-level key of
     * the given name. Keys of nested objects and values do not count.
     */
    public static boolean attributeValueContainsKey(Attribute attribute, String key) {
        return ExpressionScanner.parseMap(attribute).stream()
                .anyMatch(entry -> entry.getKey().equals(key));
    }

    /**
     * Sets an object attribute built from the given fields, in key order.
     * Nothing is written when there are no fields.
     */
    public static void createNestedAttributeFromFields(Body body, String name, Map<String, List<HclToken>> fields) {
        if (fields.isEmpty()) {
            return;
        }
        body.setAttributeRaw(name, TokenBuilder.object(new TreeMap<>(fields)));
    }

    /**
     * Moves the named attributes into a new object attribute and removes them
     * from the body.
     *
     * @return the number of attributes moved
     */
    public static int moveAttributesToNestedObject(Body body, String nestedName, Collection<String> names) {
        Map<String, List<HclToken>> fields = new LinkedHashMap<>();
        for (String name : names) {
            body.findAttribute(name).ifPresent(attribute -> fields.put(name, attribute.getExpression()));
        }
        if (fields.isEmpty()) {
            return 0;
        }
        createNestedAttributeFromFields(body, nestedName, fields);
        fields.keySet().forEach(body::removeAttribute);
        log.debug("Moved {} into {}", fields.keySet(), nestedName);
        return fields.size();
    }

    /**
     * True when the value references a variable, local, iterator, data source
     * or module, or interpolates anything.
     */
    public static boolean isExpressionAttribute(Attribute attribute) {
        if (attribute == null) {
            return false;
        }
        for (HclToken token : attribute.getExpression()) {
            if (token.is(TokenType.IDENTIFIER) && EXPRESSION_ROOTS.contains(token.getText())) {
                return true;
            }
            if (token.is(TokenType.TEMPLATE_INTERP) || token.is(TokenType.TEMPLATE_SEQ_END)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces {@code <iterator>.value} with {@code <iterator>} in expression text.
     */
    public static String stripIteratorValueSuffix(String expression, String iterator) {
        if (iterator == null || iterator.isEmpty()) {
            return expression;
        }
        return expression.replace(iterator + ".value", iterator);
    }

    /**
     * Parses expression text and sets it as the attribute's value.
     *
     * @throws com.tfmigrate.parser.exception.ParseException when the text is not a valid expression
     */
    public static Attribute setAttributeFromExpression(Body body, String name, String expression) {
        return body.setAttributeRaw(name, HclParser.parseExpression(expression));
    }

    /**
     * Unwraps a single-argument call, turning {@code fn(x)} into {@code x}.
     *
     * @return false when the value is not exactly one call to {@code function}
     */
    public static boolean removeFunctionWrapper(Body body, String name, String function) {
        Optional<Attribute> attribute = body.findAttribute(name);
        if (attribute.isEmpty()) {
            return false;
        }
        List<HclToken> value = ExpressionScanner.trim(attribute.get().getExpression());
        if (value.size() < 3 || !value.get(0).isIdentifier(function) || !value.get(1).is(TokenType.OPAREN)
                || !value.get(value.size() - 1).is(TokenType.CPAREN)) {
            return false;
        }

        // a single argument spans the parens; a comma or an early close means it does not
        DepthTracker inner = new DepthTracker();
        for (int i = 2; i < value.size() - 1; i++) {
            HclToken token = value.get(i);
            if (inner.isTopLevel() && token.is(TokenType.COMMA)) {
                return false;
            }
            inner.track(token);
        }
        if (!inner.isBalanced()) {
            return false;
        }

        List<HclToken> argument = ExpressionScanner.trim(value.subList(2, value.size() - 1));
        if (argument.isEmpty()) {
            return false;
        }
        attribute.get().setExpression(argument);
        log.debug("Removed {}() around {}", function, name);
        return true;
    }

    /**
     * Sorts a list of plain strings alphabetically. Lists holding anything but
     * plain strings are left alone.
     *
     * @return true when the order changed
     */
    public static boolean sortStringArrayAttribute(Body body, String name) {
        Optional<Attribute> attribute = body.findAttribute(name);
        if (attribute.isEmpty()) {
            return false;
        }
        List<ArrayElement> elements = ExpressionScanner.parseArray(attribute.get());
        if (elements.isEmpty() || elements.stream().anyMatch(element -> element.getType() != ElementType.STRING)) {
            return false;
        }
        List<ArrayElement> sorted = new ArrayList<>(elements);
        sorted.sort(Comparator.comparing(element -> element.stringValue().orElse("")));
        if (sorted.equals(elements)) {
            return false;
        }
        attribute.get().setExpression(TokenBuilder.tuple(sorted.stream().map(ArrayElement::getTokens).toList()));
        return true;
    }

    /**
     * Points every reference to a resource of {@code oldType} at {@code newType},
     * in all attributes of the body and its nested blocks, interpolations included.
     * Use together with {@link BlockOperations#renameResourceType} so references
     * from other resources follow the rename.
     * <pre>
     * content = "${cloudflare_record.a.name}.${var.domain}"
     * </pre>
     * becomes
     * <pre>
     * content = "${cloudflare_dns_record.a.name}.${var.domain}"
     * </pre>
     *
     * @return the number of references rewritten
     */
    public static int updateResourceReferences(Body body, String oldType, String newType) {
        int updated = 0;
        for (HclNode item : body.getItems()) {
            if (item instanceof Attribute attribute) {
                List<HclToken> tokens = attribute.getExpression();
                int count = countResourceReferences(tokens, oldType);
                if (count > 0) {
                    attribute.setExpression(updateResourceReferences(tokens, oldType, newType));
                    updated += count;
                }
            } else if (item instanceof Block block) {
                updated += updateResourceReferences(block.getBody(), oldType, newType);
            }
        }
        if (updated > 0) {
            log.debug("Updated {} reference(s) from {} to {}", updated, oldType, newType);
        }
        return updated;
    }

    /**
     * Rewrites {@code oldType.} traversal roots to {@code newType.}. Attribute
     * accesses such as {@code data.oldType.x} are not roots and stay as they are.
     */
    public static List<HclToken> updateResourceReferences(List<HclToken> tokens, String oldType, String newType) {
        List<HclToken> result = new ArrayList<>(tokens);
        for (int i = 0; i < result.size(); i++) {
            if (isResourceReference(result, i, oldType)) {
                result.set(i, HclToken.of(TokenType.IDENTIFIER, newType));
            }
        }
        return result;
    }

    /**
     * Replaces the string literals {@code "enabled"} and {@code "disabled"} with
     * {@code true} and {@code false}. Templates that only contain those words,
     * such as {@code "${x}enabled"}, are not literals and stay as they are.
     */
    public static List<HclToken> convertEnabledDisabled(List<HclToken> tokens) {
        List<HclToken> result = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Optional<Boolean> flag = enabledDisabledLiteral(tokens, i);
            if (flag.isPresent()) {
                result.add(HclToken.of(TokenType.IDENTIFIER, flag.get().toString()));
                i += 2;
                continue;
            }
            result.add(tokens.get(i));
        }
        return result;
    }

    /**
     * Applies {@link #convertEnabledDisabled(List)} to one attribute.
     *
     * @return true when the value changed
     */
    public static boolean convertEnabledDisabled(Body body, String name) {
        Optional<Attribute> attribute = body.findAttribute(name);
        if (attribute.isEmpty()) {
            return false;
        }
        List<HclToken> tokens = attribute.get().getExpression();
        List<HclToken> converted = convertEnabledDisabled(tokens);
        if (converted.size() == tokens.size()) {
            return false;
        }
        attribute.get().setExpression(converted);
        return true;
    }

    private static int countResourceReferences(List<HclToken> tokens, String type) {
        int count = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (isResourceReference(tokens, i, type)) {
                count++;
            }
        }
        return count;
    }

    private static boolean isResourceReference(List<HclToken> tokens, int index, String type) {
        if (index + 1 >= tokens.size() || (index > 0 && tokens.get(index - 1).is(TokenType.DOT))) {
            return false;
        }
        return tokens.get(index).isIdentifier(type) && tokens.get(index + 1).is(TokenType.DOT);
    }

    private static Optional<Boolean> enabledDisabledLiteral(List<HclToken> tokens, int index) {
        if (index + 2 >= tokens.size() || !tokens.get(index).is(TokenType.OQUOTE)
                || !tokens.get(index + 1).is(TokenType.QUOTED_LIT) || !tokens.get(index + 2).is(TokenType.CQUOTE)) {
            return Optional.empty();
        }
        return switch (tokens.get(index + 1).getText()) {
            case "enabled" -> Optional.of(Boolean.TRUE);
            case "disabled" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }

    private static List<HclToken> valueTokens(Object value) {
        if (value instanceof List<?> list) {
            List<List<HclToken>> elements = new ArrayList<>();
            for (Object element : list) {
                if (!(element instanceof String text)) {
                    return List.of();
                }
                elements.add(TokenBuilder.stringLiteral(text));
            }
            return TokenBuilder.tuple(elements);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, List<HclToken>> fields = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key) || !(entry.getValue() instanceof String text)) {
                    return List.of();
                }
                fields.put(key, TokenBuilder.stringLiteral(text));
            }
            return TokenBuilder.object(fields);
        }
        return TokenBuilder.simpleValue(value);
    }
}
