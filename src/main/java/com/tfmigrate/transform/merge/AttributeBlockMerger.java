package com.tfmigrate.transform.merge;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclNode;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.transform.scan.ArrayElement;
import com.tfmigrate.transform.scan.ExpressionScanner;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Merges the two legacy spellings of one ordered collection into a single
 * array of objects.
 * <pre>
 * items = ["192.168.1.1"]
 * items_with_description {
 *   value       = "172.16.0.0/12"
 *   description = "Private network"
 * }
 * </pre>
 * becomes, with blocks first,
 * <pre>
 * items = [
 *   {
 *     description = "Private network"
 *     value = "172.16.0.0/12"
 *   },
 *   {
 *     description = null
 *     value = "192.168.1.1"
 *   }
 * ]
 * </pre>
 * Every object carries the primary field and all optional fields, in sorted
 * key order. Expressions are carried over as written.
 */
public final class AttributeBlockMerger {
    private static final Logger log = LoggerFactory.getLogger(AttributeBlockMerger.class);

    private AttributeBlockMerger() {
    }

    /**
     * @return true if the body was modified; false when there was nothing to merge
     */
    public static boolean merge(Body body, MergeSpec spec) {
        List<Block> blocks = body.findBlocks(spec.getBlockType());
        Optional<Attribute> array = body.findAttribute(spec.getArrayAttribute());
        if (blocks.isEmpty() && array.isEmpty()) {
            return false;
        }

        List<ArrayElement> elements = List.of();
        if (array.isPresent()) {
            List<HclToken> value = array.get().getExpression();
            elements = ExpressionScanner.parseArray(value, spec.getOptionalFields());
            if (elements.isEmpty() && !ExpressionScanner.isEmptyArray(value)) {
                log.warn("Cannot merge {}: value is not an array literal", spec.getArrayAttribute());
                return false;
            }
            if (blocks.isEmpty() && elements.stream().allMatch(ArrayElement::isObject)) {
                log.debug("{} is already an array of objects", spec.getArrayAttribute());
                return false;
            }
        }

        List<List<HclToken>> blockItems = new ArrayList<>();
        for (Block block : blocks) {
            Map<String, List<HclToken>> fields = new TreeMap<>();
            fields.put(spec.getPrimaryField(), blockField(block, spec.getPrimaryField()));
            for (String optional : spec.getOptionalFields()) {
                fields.put(optional, blockField(block, optional));
            }
            blockItems.add(TokenBuilder.object(fields));
        }

        List<List<HclToken>> arrayItems = new ArrayList<>();
        for (ArrayElement element : elements) {
            arrayItems.add(TokenBuilder.object(arrayFields(element, spec)));
        }

        List<List<HclToken>> items = new ArrayList<>();
        if (spec.isBlocksFirst()) {
            items.addAll(blockItems);
            items.addAll(arrayItems);
        } else {
            items.addAll(arrayItems);
            items.addAll(blockItems);
        }

        List<HclNode> removed = new ArrayList<>(blocks);
        array.ifPresent(removed::add);
        HclNode anchor = array.isPresent() ? array.get() : blocks.get(0);
        int position = body.indexOf(anchor);
        for (HclNode node : removed) {
            if (body.indexOf(node) < body.indexOf(anchor)) {
                position--;
            }
        }
        for (Block block : blocks) {
            body.removeBlock(block);
        }
        array.ifPresent(attribute -> body.removeAttribute(attribute.getName()));

        body.insertAttribute(position, spec.getOutputAttribute(), TokenBuilder.multilineTuple(items));
        log.debug("Merged {} block(s) and {} array element(s) into {}",
                blockItems.size(), arrayItems.size(), spec.getOutputAttribute());
        return true;
    }

    private static Map<String, List<HclToken>> arrayFields(ArrayElement element, MergeSpec spec) {
        Map<String, List<HclToken>> fields = new TreeMap<>();
        if (element.isObject()) {
            fields.put(spec.getPrimaryField(),
                    element.getField(spec.getPrimaryField()).orElseGet(TokenBuilder::nullValue));
            for (String optional : spec.getOptionalFields()) {
                fields.put(optional, element.getField(optional).orElseGet(TokenBuilder::nullValue));
            }
            return fields;
        }
        fields.put(spec.getPrimaryField(), element.getTokens());
        for (String optional : spec.getOptionalFields()) {
            fields.put(optional, TokenBuilder.nullValue());
        }
        return fields;
    }

    private static List<HclToken> blockField(Block block, String name) {
        return block.getBody().findAttribute(name)
                .map(Attribute::getExpression)
                .orElseGet(TokenBuilder::nullValue);
    }
}
