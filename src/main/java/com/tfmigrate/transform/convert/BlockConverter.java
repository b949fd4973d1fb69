package com.tfmigrate.transform.convert;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Rewrites nested blocks as attributes.
 * <p>
 * A type that occurs once becomes an object attribute (the singular pattern);
 * a type that occurs more than once, or is forced to, becomes an array of
 * objects (the repeated pattern). Matching blocks are collected before any is
 * removed, and the replacement attribute takes the place of the first one.
 * Bodies without a matching block are left untouched, so running a conversion
 * again on converted text changes nothing.
 */
public final class BlockConverter {
    private static final Logger log = LoggerFactory.getLogger(BlockConverter.class);

    private BlockConverter() {
    }

    /**
     * Collapses every {@code blockType} block of the body into one attribute of
     * the same name. Nested blocks inside them become nested objects.
     *
     * @param forceArray emit an array even for a single block
     * @return true if any block was converted
     */
    public static boolean collapseBlocks(Body body, String blockType, boolean forceArray) {
        return collapse(body, blockType, blockType, forceArray, Set.of(), null);
    }

    /**
     * Like {@link #collapseBlocks}, with nested block types listed in
     * {@code alwaysArrayTypes} (and the top-level type itself, if listed)
     * emitted as arrays whatever their count.
     */
    public static boolean collapseBlocksRecursive(Body body, String blockType, Set<String> alwaysArrayTypes) {
        return collapse(body, blockType, blockType, alwaysArrayTypes.contains(blockType), alwaysArrayTypes, null);
    }

    /**
     * Turns every {@code blockType} block into one element of an array attribute,
     * keeping sibling order.
     *
     * @return true if the body was modified
     */
    public static boolean convertBlocksToAttributeList(Body body, String blockType, ConversionOptions options) {
        ConversionOptions effective = options != null ? options : ConversionOptions.DEFAULTS;
        String attributeName = effective.attributeNameFor(blockType);

        if (body.findBlocks(blockType).isEmpty()) {
            if (effective.isEmptyIfNone() && !body.hasAttribute(attributeName)) {
                body.setAttributeRaw(attributeName, TokenBuilder.emptyArray());
                return true;
            }
            return false;
        }
        return collapse(body, blockType, attributeName, true, effective.getAlwaysArrayTypes(), effective.getPreProcess());
    }

    /**
     * Converts the first {@code blockType} block to an object attribute and
     * leaves any further blocks of the type in place.
     */
    public static boolean convertSingleBlockToAttribute(Body body, String blockType, String attributeName) {
        return body.findBlock(blockType)
                .map(block -> {
                    List<HclToken> value = buildObjectFromBlock(block);
                    replaceBlocks(body, List.of(block), attributeName, value);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Converts each {@code blockType} block to an object attribute named
     * {@code attributeName}. When several blocks exist the last one wins.
     *
     * @param preProcess called on each block before conversion; may be null
     */
    public static boolean convertBlocksToAttribute(Body body, String blockType, String attributeName,
                                                   Consumer<Block> preProcess) {
        List<Block> blocks = body.findBlocks(blockType);
        if (blocks.isEmpty()) {
            return false;
        }
        List<HclToken> value = null;
        for (Block block : blocks) {
            if (preProcess != null) {
                preProcess.accept(block);
            }
            value = buildObjectFromBlock(block);
        }
        if (blocks.size() > 1) {
            log.debug("{} {} blocks found, keeping the last one as {}", blocks.size(), blockType, attributeName);
        }
        replaceBlocks(body, blocks, attributeName, value);
        return true;
    }

    /**
     * Object literal holding a block's attributes in body order, followed by its
     * nested blocks grouped by type in sorted order.
     */
    public static List<HclToken> buildObjectFromBlock(Block block) {
        return buildObject(block, Set.of());
    }

    private static boolean collapse(Body body, String blockType, String attributeName, boolean asArray,
                                    Set<String> alwaysArrayTypes, Consumer<Block> preProcess) {
        List<Block> blocks = body.findBlocks(blockType);
        if (blocks.isEmpty()) {
            return false;
        }

        List<List<HclToken>> objects = new ArrayList<>();
        for (Block block : blocks) {
            if (preProcess != null) {
                preProcess.accept(block);
            }
            objects.add(buildObject(block, alwaysArrayTypes));
        }

        List<HclToken> value = asArray || objects.size() > 1
                ? TokenBuilder.multilineTuple(objects)
                : objects.get(0);
        replaceBlocks(body, blocks, attributeName, value);
        log.debug("Converted {} {} block(s) to attribute {}", blocks.size(), blockType, attributeName);
        return true;
    }

    private static List<HclToken> buildObject(Block block, Set<String> alwaysArrayTypes) {
        Map<String, List<HclToken>> fields = new LinkedHashMap<>();
        for (Attribute attribute : block.getBody().getAttributes()) {
            fields.put(attribute.getName(), attribute.getExpression());
        }

        Map<String, List<Block>> nestedByType = new TreeMap<>();
        for (Block nested : block.getBody().getBlocks()) {
            nestedByType.computeIfAbsent(nested.getType(), type -> new ArrayList<>()).add(nested);
        }
        for (Map.Entry<String, List<Block>> group : nestedByType.entrySet()) {
            List<List<HclToken>> objects = new ArrayList<>();
            for (Block nested : group.getValue()) {
                objects.add(buildObject(nested, alwaysArrayTypes));
            }
            boolean asArray = objects.size() > 1 || alwaysArrayTypes.contains(group.getKey());
            fields.put(group.getKey(), asArray ? TokenBuilder.multilineTuple(objects) : objects.get(0));
        }
        return TokenBuilder.object(fields);
    }

    private static void replaceBlocks(Body body, List<Block> blocks, String attributeName, List<HclToken> value) {
        int position = body.indexOf(blocks.get(0));
        for (Block block : blocks) {
            body.removeBlock(block);
        }
        body.insertAttribute(position, attributeName, value);
    }
}
