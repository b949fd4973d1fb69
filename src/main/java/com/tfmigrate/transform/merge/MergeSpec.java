package com.tfmigrate.transform.merge;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Describes one merge of a scalar array attribute and repeated blocks into an
 * array of objects.
 *
 * For the legacy list resource:
 * <pre>
 * MergeSpec.builder()
 *         .arrayAttribute("items")
 *         .blockType("items_with_description")
 *         .primaryField("value")
 *         .optionalField("description")
 *         .blocksFirst(true)
 *         .build();
 * </pre>
 */
@Value
@Builder
public class MergeSpec {

    /**
     * Attribute holding the flat array, e.g. {@code items = ["a", "b"]}.
     */
    @NonNull
    String arrayAttribute;

    /**
     * Type of the blocks carrying the primary field plus optional fields.
     */
    @NonNull
    String blockType;

    /**
     * Attribute to write; defaults to {@link #arrayAttribute}.
     */
    String outputAttribute;

    /**
     * Field that receives each flat array element.
     */
    @NonNull
    String primaryField;

    /**
     * Fields written as null when a source lacks them.
     */
    @Singular
    List<String> optionalFields;

    /**
     * Place block-sourced objects ahead of array-sourced ones.
     */
    boolean blocksFirst;

    public String getOutputAttribute() {
        return outputAttribute != null ? outputAttribute : arrayAttribute;
    }
}
