package com.tfmigrate.transform.convert;

import com.tfmigrate.model.Block;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Options for turning sibling blocks into an array attribute.
 */
@Value
@Builder
public class ConversionOptions {

    public static final ConversionOptions DEFAULTS = ConversionOptions.builder().build();

    /**
     * Name of the attribute to write. Defaults to the block type.
     */
    String attributeName;

    /**
     * Write {@code []} when no block of the type exists, instead of leaving the body alone.
     */
    @Builder.Default
    boolean emptyIfNone = false;

    /**
     * Nested block types that become arrays even when they occur once.
     */
    @Singular
    Set<String> alwaysArrayTypes;

    /**
     * Called on each block before it is converted; may rename or drop its attributes.
     */
    Consumer<Block> preProcess;

    String attributeNameFor(String blockType) {
        return attributeName != null ? attributeName : blockType;
    }
}
