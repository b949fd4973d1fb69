package com.tfmigrate.transform.meta;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Moves meta-arguments (count, for_each, lifecycle, depends_on, provider and
 * timeouts) from one block to another.
 * <p>
 * Resource blocks accept all six. Import blocks accept only for_each and
 * provider; the others are dropped.
 */
public final class MetaArgumentCarrier {
    private static final Logger log = LoggerFactory.getLogger(MetaArgumentCarrier.class);

    public static final String COUNT = "count";
    public static final String FOR_EACH = "for_each";
    public static final String LIFECYCLE = "lifecycle";
    public static final String DEPENDS_ON = "depends_on";
    public static final String PROVIDER = "provider";
    public static final String TIMEOUTS = "timeouts";

    private MetaArgumentCarrier() {
    }

    public static MetaArguments extract(Block block) {
        Body body = block.getBody();
        return MetaArguments.builder()
                .count(body.findAttribute(COUNT).orElse(null))
                .forEach(body.findAttribute(FOR_EACH).orElse(null))
                .lifecycle(body.findBlock(LIFECYCLE).orElse(null))
                .dependsOn(body.findAttribute(DEPENDS_ON).orElse(null))
                .provider(body.findAttribute(PROVIDER).orElse(null))
                .timeouts(body.findBlock(TIMEOUTS).orElse(null))
                .build();
    }

    /**
     * Copies every present meta-argument onto a resource block. Lifecycle and
     * timeouts blocks are copied item by item, replacing any the destination
     * already has.
     */
    public static void copyToBlock(Block destination, MetaArguments meta) {
        if (meta == null) {
            return;
        }
        Body body = destination.getBody();
        copyAttribute(body, COUNT, meta.getCount());
        copyAttribute(body, FOR_EACH, meta.getForEach());
        copyAttribute(body, DEPENDS_ON, meta.getDependsOn());
        copyAttribute(body, PROVIDER, meta.getProvider());
        copyBlock(body, meta.getLifecycle());
        copyBlock(body, meta.getTimeouts());
        log.debug("Copied meta-arguments to {} {}", destination.getType(), destination.getLabels());
    }

    /**
     * Copies the meta-arguments an import block supports: for_each and provider.
     */
    public static void copyToImportDirective(Block importBlock, MetaArguments meta) {
        if (meta == null) {
            return;
        }
        Body body = importBlock.getBody();
        copyAttribute(body, FOR_EACH, meta.getForEach());
        copyAttribute(body, PROVIDER, meta.getProvider());
    }

    private static void copyAttribute(Body body, String name, Optional<Attribute> source) {
        source.ifPresent(attribute -> body.setAttributeRaw(name, attribute.getExpression()));
    }

    private static void copyBlock(Body body, Optional<Block> source) {
        if (source.isEmpty()) {
            return;
        }
        Block original = source.get();
        for (Block existing : body.findBlocks(original.getType())) {
            body.removeBlock(existing);
        }
        body.appendBlock(original.copy());
    }
}
