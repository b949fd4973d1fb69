package com.tfmigrate.transform.attr;

import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Block lookups and edits: resource addressing, bulk removal and hoisting
 * attributes out of nested blocks.
 */
public final class BlockOperations {
    private static final Logger log = LoggerFactory.getLogger(BlockOperations.class);

    private static final String RESOURCE = "resource";

    private BlockOperations() {
    }

    /**
     * Work applied to each block of a type. May fail with a checked exception.
     */
    @FunctionalInterface
    public interface BlockProcessor<E extends Exception> {
        void process(Block block) throws E;
    }

    /**
     * Changes the first label of a block addressed as {@code <type> <name>}.
     * References held by other blocks are updated separately with
     * {@link AttributeOperations#updateResourceReferences(Body, String, String)}.
     *
     * @return false when the block is not of {@code oldType} or has fewer than two labels
     */
    public static boolean renameResourceType(Block block, String oldType, String newType) {
        List<String> labels = block.getLabels();
        if (labels.size() < 2 || !labels.get(0).equals(oldType)) {
            return false;
        }
        List<String> renamed = new ArrayList<>(labels);
        renamed.set(0, newType);
        block.setLabels(renamed);
        log.debug("Renamed resource type {} to {} for {}", oldType, newType, labels.get(1));
        return true;
    }

    /**
     * @return the resource type of a {@code resource} block, or an empty string for any other block
     */
    public static String getResourceType(Block block) {
        if (!RESOURCE.equals(block.getType()) || block.getLabels().isEmpty()) {
            return "";
        }
        return block.getLabels().get(0);
    }

    public static String getResourceName(Block block) {
        if (!RESOURCE.equals(block.getType()) || block.getLabels().size() < 2) {
            return "";
        }
        return block.getLabels().get(1);
    }

    public static Optional<Block> findBlockByType(Body body, String type) {
        return body.findBlock(type);
    }

    public static List<Block> findBlocksByType(Body body, String type) {
        return body.findBlocks(type);
    }

    /**
     * @return the number of blocks removed
     */
    public static int removeBlocksByType(Body body, String type) {
        List<Block> blocks = body.findBlocks(type);
        blocks.forEach(body::removeBlock);
        return blocks.size();
    }

    /**
     * Runs the processor on every block of the type in order, stopping at the
     * first failure.
     */
    public static <E extends Exception> void processBlocksOfType(Body body, String type,
                                                                 BlockProcessor<E> processor) throws E {
        for (Block block : body.findBlocks(type)) {
            processor.process(block);
        }
    }

    /**
     * Copies an attribute from the first block of the type that has it into
     * the enclosing body. The block keeps its copy. Nothing happens when the
     * enclosing body already has the attribute.
     */
    public static boolean hoistAttributeFromBlock(Body parent, String blockType, String name) {
        if (parent.hasAttribute(name)) {
            return false;
        }
        for (Block block : parent.findBlocks(blockType)) {
            if (block.getBody().hasAttribute(name)) {
                AttributeOperations.copyAttribute(block.getBody(), parent, name);
                log.debug("Hoisted {} out of {}", name, blockType);
                return true;
            }
        }
        return false;
    }

    /**
     * @return the number of attributes hoisted
     */
    public static int hoistAttributesFromBlock(Body parent, String blockType, String... names) {
        int hoisted = 0;
        for (String name : names) {
            if (hoistAttributeFromBlock(parent, blockType, name)) {
                hoisted++;
            }
        }
        return hoisted;
    }

    /**
     * Removes blocks of the type whose body holds nothing.
     *
     * @return the number of blocks removed
     */
    public static int removeEmptyBlocks(Body body, String type) {
        int removed = 0;
        for (Block block : body.findBlocks(type)) {
            if (block.getBody().isEmpty()) {
                body.removeBlock(block);
                removed++;
            }
        }
        return removed;
    }
}
