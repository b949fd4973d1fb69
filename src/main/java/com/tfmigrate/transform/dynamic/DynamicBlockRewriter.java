package com.tfmigrate.transform.dynamic;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclNode;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.parser.HclWriter;
import com.tfmigrate.transform.convert.BlockConverter;
import com.tfmigrate.transform.scan.ExpressionScanner;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Replaces {@code dynamic} blocks with a for expression.
 * <pre>
 * dynamic "origins" {
 *   for_each = var.origins
 *   iterator = origin
 *   content {
 *     address = origin.value.address
 *   }
 * }
 * </pre>
 * becomes
 * <pre>
 * origins = [for value in var.origins : {
 *   address = value.address
 * }]
 * </pre>
 * The loop variable is always {@code value}. Static blocks of the same type
 * and further dynamic blocks are joined with {@code concat(...)}, statics first.
 */
public final class DynamicBlockRewriter {
    private static final Logger log = LoggerFactory.getLogger(DynamicBlockRewriter.class);

    static final String DYNAMIC = "dynamic";
    static final String FOR_EACH = "for_each";
    static final String ITERATOR = "iterator";
    static final String CONTENT = "content";
    static final String LOOP_VALUE = "value";
    static final String LOOP_KEY = "key";

    private DynamicBlockRewriter() {
    }

    public static boolean rewrite(Body body, String label) {
        return rewrite(body, label, label);
    }

    /**
     * Rewrites every {@code dynamic "<label>"} block of the body, together with
     * any static {@code <label>} blocks, into one attribute.
     *
     * @return true if the body was modified; false when there is no dynamic block,
     * one of them (or a dynamic block nested in its content) lacks for_each or
     * content, or a nested template reads this block's iterator
     */
    public static boolean rewrite(Body body, String label, String attributeName) {
        List<Block> dynamics = findDynamicBlocks(body, label);
        if (dynamics.isEmpty()) {
            return false;
        }
        List<Block> statics = body.findBlocks(label);

        List<List<HclToken>> parts = new ArrayList<>();
        if (!statics.isEmpty()) {
            List<List<HclToken>> objects = new ArrayList<>();
            for (Block block : statics) {
                objects.add(BlockConverter.buildObjectFromBlock(block));
            }
            parts.add(TokenBuilder.multilineTuple(objects));
        }
        for (Block dynamic : dynamics) {
            Optional<List<HclToken>> forExpression = buildForExpression(dynamic, label);
            if (forExpression.isEmpty()) {
                return false;
            }
            parts.add(forExpression.get());
        }

        List<HclToken> value = parts.size() == 1 ? parts.get(0) : concat(parts);

        List<HclNode> removed = new ArrayList<>(statics);
        removed.addAll(dynamics);
        removed.sort(Comparator.comparingInt(body::indexOf));
        int position = body.indexOf(removed.get(0));
        for (HclNode node : removed) {
            body.removeBlock((Block) node);
        }
        body.insertAttribute(position, attributeName, value);

        log.debug("Rewrote {} dynamic and {} static {} block(s) as {}",
                dynamics.size(), statics.size(), label, attributeName);
        return true;
    }

    /**
     * All {@code dynamic} blocks of the body whose label is {@code label}.
     */
    public static List<Block> findDynamicBlocks(Body body, String label) {
        List<Block> result = new ArrayList<>();
        for (Block block : body.findBlocks(DYNAMIC)) {
            if (label.equals(block.getLabel(0))) {
                result.add(block);
            }
        }
        return result;
    }

    private static Optional<List<HclToken>> buildForExpression(Block dynamic, String label) {
        Body dynamicBody = dynamic.getBody();
        Optional<Attribute> forEach = dynamicBody.findAttribute(FOR_EACH);
        Optional<Block> content = dynamicBody.findBlock(CONTENT);
        if (forEach.isEmpty() || content.isEmpty()) {
            log.warn("dynamic \"{}\" block without for_each or content left unchanged", label);
            return Optional.empty();
        }

        String iterator = iteratorName(dynamic, label);

        // the template is flattened on a copy so a failed rewrite leaves the source intact
        Block template = content.get().copy();
        if (!flattenNestedBlocks(template.getBody(), iterator)) {
            return Optional.empty();
        }

        Map<String, List<HclToken>> fields = new LinkedHashMap<>();
        boolean usesKey = false;
        for (Attribute attribute : template.getBody().getAttributes()) {
            List<HclToken> expression = replaceIteratorReferences(attribute.getExpression(), iterator);
            usesKey |= referencesKey(attribute.getExpression(), iterator);
            fields.put(attribute.getName(), expression);
        }

        List<HclToken> tokens = new ArrayList<>();
        tokens.add(HclToken.of(TokenType.OBRACK, "["));
        tokens.add(HclToken.of(TokenType.IDENTIFIER, "for"));
        tokens.add(space());
        if (usesKey) {
            tokens.add(HclToken.of(TokenType.IDENTIFIER, LOOP_KEY));
            tokens.add(HclToken.of(TokenType.COMMA, ","));
            tokens.add(space());
        }
        tokens.add(HclToken.of(TokenType.IDENTIFIER, LOOP_VALUE));
        tokens.add(space());
        tokens.add(HclToken.of(TokenType.IDENTIFIER, "in"));
        tokens.add(space());
        tokens.addAll(ExpressionScanner.trim(forEach.get().getExpression()));
        tokens.add(space());
        tokens.add(HclToken.of(TokenType.COLON, ":"));
        tokens.add(space());
        tokens.addAll(TokenBuilder.object(fields));
        tokens.add(HclToken.of(TokenType.CBRACK, "]"));
        return Optional.of(tokens);
    }

    private static String iteratorName(Block dynamic, String label) {
        return dynamic.getBody().findAttribute(ITERATOR)
                .map(attribute -> HclWriter.toText(ExpressionScanner.trim(attribute.getExpression())))
                .orElse(label);
    }

    /**
     * Rewrites nested dynamic blocks first, then collapses the remaining nested
     * blocks into object attributes, so the template holds attributes only.
     * <p>
     * Every nested loop binds {@code value} too, so a nested template that reads
     * the enclosing iterator cannot be expressed and the flattening fails.
     *
     * @return false when a nested dynamic block cannot be rewritten
     */
    private static boolean flattenNestedBlocks(Body body, String outerIterator) {
        Set<String> dynamicLabels = new LinkedHashSet<>();
        for (Block block : body.findBlocks(DYNAMIC)) {
            if (block.getLabel(0) == null) {
                log.warn("dynamic block without a label left unchanged");
                return false;
            }
            dynamicLabels.add(block.getLabel(0));
        }
        for (String nested : dynamicLabels) {
            for (Block block : findDynamicBlocks(body, nested)) {
                if (readsOuterIterator(block, nested, outerIterator)) {
                    log.warn("dynamic \"{}\" reads enclosing iterator {}, left unchanged", nested, outerIterator);
                    return false;
                }
            }
            if (!rewrite(body, nested)) {
                return false;
            }
        }

        Set<String> types = new TreeSet<>();
        for (Block block : body.getBlocks()) {
            types.add(block.getType());
        }
        for (String type : types) {
            BlockConverter.collapseBlocks(body, type, false);
        }
        return true;
    }

    /**
     * True when the content of a nested dynamic block refers to the enclosing
     * iterator. A nested block reusing the same iterator name shadows it.
     */
    private static boolean readsOuterIterator(Block nested, String label, String outerIterator) {
        if (iteratorName(nested, label).equals(outerIterator)) {
            return false;
        }
        Optional<Block> content = nested.getBody().findBlock(CONTENT);
        return content.isPresent() && referencesIterator(content.get().getBody(), outerIterator);
    }

    private static boolean referencesIterator(Body body, String iterator) {
        for (HclNode item : body.getItems()) {
            if (item instanceof Attribute attribute) {
                List<HclToken> tokens = attribute.getExpression();
                for (int i = 0; i < tokens.size(); i++) {
                    if (isIteratorAccess(tokens, i, iterator, LOOP_VALUE) || isIteratorAccess(tokens, i, iterator, LOOP_KEY)) {
                        return true;
                    }
                }
            } else if (item instanceof Block block && referencesIterator(block.getBody(), iterator)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces {@code <iterator>.value} with {@code value} and
     * {@code <iterator>.key} with {@code key}.
     */
    static List<HclToken> replaceIteratorReferences(List<HclToken> tokens, String iterator) {
        List<HclToken> result = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            if (isIteratorAccess(tokens, i, iterator, LOOP_VALUE) || isIteratorAccess(tokens, i, iterator, LOOP_KEY)) {
                result.add(HclToken.of(TokenType.IDENTIFIER, tokens.get(i + 2).getText()));
                i += 2;
                continue;
            }
            result.add(tokens.get(i));
        }
        return result;
    }

    private static boolean referencesKey(List<HclToken> tokens, String iterator) {
        for (int i = 0; i < tokens.size(); i++) {
            if (isIteratorAccess(tokens, i, iterator, LOOP_KEY)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIteratorAccess(List<HclToken> tokens, int index, String iterator, String member) {
        if (index + 2 >= tokens.size()) {
            return false;
        }
        if (index > 0 && tokens.get(index - 1).is(TokenType.DOT)) {
            return false;
        }
        return tokens.get(index).isIdentifier(iterator)
                && tokens.get(index + 1).is(TokenType.DOT)
                && tokens.get(index + 2).isIdentifier(member);
    }

    private static List<HclToken> concat(List<List<HclToken>> parts) {
        List<HclToken> tokens = new ArrayList<>();
        tokens.add(HclToken.of(TokenType.IDENTIFIER, "concat"));
        tokens.add(HclToken.of(TokenType.OPAREN, "("));
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                tokens.add(HclToken.of(TokenType.COMMA, ","));
                tokens.add(space());
            }
            tokens.addAll(parts.get(i));
        }
        tokens.add(HclToken.of(TokenType.CPAREN, ")"));
        return tokens;
    }

    private static HclToken space() {
        return HclToken.of(TokenType.WHITESPACE, " ");
    }
}
