package com.tfmigrate.transform.derive;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes how a derived block is populated from its original.
 */
@Value
@Builder(toBuilder = true)
public class AttributeTransform {

    /**
     * Attributes copied under their own name.
     */
    @Singular
    List<String> copyAttributes;

    /**
     * Attributes copied under a new name, old name to new name.
     */
    @Singular
    Map<String, String> renames;

    /**
     * Attributes set to a literal, whatever the original holds.
     * Values are strings, numbers or booleans.
     */
    @Singular("set")
    Map<String, Object> setValues;

    /**
     * Whether count, for_each, lifecycle, depends_on, provider and timeouts are carried over.
     */
    boolean copyMetaArguments;

    /**
     * Names the derived block ends up with: copied, renamed-to and set attributes.
     */
    public Set<String> validAttributeNames() {
        Set<String> names = new LinkedHashSet<>(copyAttributes);
        names.addAll(renames.values());
        names.addAll(setValues.keySet());
        return names;
    }
}
