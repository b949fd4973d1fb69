package com.tfmigrate.transform.derive;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclWriter;
import com.tfmigrate.transform.meta.MetaArgumentCarrier;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a new sibling block from an existing one, as when one legacy
 * resource is split into several resources of new types.
 *
 * Example: deriving {@code cloudflare_argo_smart_routing.main} from
 * {@code cloudflare_argo.main} with {@code zone_id} copied and
 * {@code smart_routing} renamed to {@code value}:
 * <pre>
 * resource "cloudflare_argo_smart_routing" "main" {
 *   zone_id = "abc123"
 *   value = "on"
 *   lifecycle {
 *     ignore_changes = [value]
 *   }
 * }
 * </pre>
 */
public final class DerivedBlockBuilder {
    private static final Logger log = LoggerFactory.getLogger(DerivedBlockBuilder.class);

    public static final String IGNORE_CHANGES = "ignore_changes";
    public static final String REPLACE_TRIGGERED_BY = "replace_triggered_by";

    private DerivedBlockBuilder() {
    }

    /**
     * Creates a block of the original's kind labeled {@code newType newName}.
     * The original is not modified.
     */
    public static Block create(Block original, String newType, String newName, AttributeTransform transform) {
        Block derived = new Block(original.getType(), List.of(newType, newName));
        Body source = original.getBody();
        Body target = derived.getBody();

        for (String name : transform.getCopyAttributes()) {
            source.findAttribute(name).ifPresent(attribute -> target.setAttributeRaw(name, attribute.getExpression()));
        }
        for (Map.Entry<String, String> rename : transform.getRenames().entrySet()) {
            source.findAttribute(rename.getKey())
                    .ifPresent(attribute -> target.setAttributeRaw(rename.getValue(), attribute.getExpression()));
        }
        for (Map.Entry<String, Object> set : transform.getSetValues().entrySet()) {
            List<HclToken> value = TokenBuilder.simpleValue(set.getValue());
            if (value.isEmpty()) {
                log.warn("Cannot set {} from value of type {}", set.getKey(), set.getValue().getClass().getSimpleName());
                continue;
            }
            target.setAttributeRaw(set.getKey(), value);
        }

        if (transform.isCopyMetaArguments()) {
            copyMetaArguments(original, derived, transform.getRenames(), transform.validAttributeNames());
        }

        log.debug("Derived {} {}.{} from {}", original.getType(), newType, newName, original.getLabels());
        return derived;
    }

    /**
     * Copies meta-arguments and rewrites the lifecycle attribute lists: renamed
     * attributes follow their new name in ignore_changes and replace_triggered_by,
     * and ignore_changes entries outside {@code validNames} are dropped.
     *
     * @param validNames names the destination supports; null disables filtering
     */
    public static void copyMetaArguments(Block original, Block destination, Map<String, String> renames,
                                         Set<String> validNames) {
        MetaArgumentCarrier.copyToBlock(destination, MetaArgumentCarrier.extract(original));

        Optional<Block> lifecycle = destination.getBody().findBlock(MetaArgumentCarrier.LIFECYCLE);
        if (lifecycle.isEmpty()) {
            return;
        }
        Body body = lifecycle.get().getBody();
        rewriteList(body, IGNORE_CHANGES, renames, validNames);
        rewriteList(body, REPLACE_TRIGGERED_BY, renames, null);
    }

    private static void rewriteList(Body body, String name, Map<String, String> renames, Set<String> validNames) {
        Optional<Attribute> attribute = body.findAttribute(name);
        if (attribute.isEmpty()) {
            return;
        }
        List<HclToken> original = attribute.get().getExpression();
        List<HclToken> rewritten = IdentifierListRewriter.rewrite(original, renames, validNames);
        if (!HclWriter.toText(rewritten).equals(HclWriter.toText(original))) {
            attribute.get().setExpression(rewritten);
        }
    }
}
