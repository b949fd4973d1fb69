package com.tfmigrate.transform.meta;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import lombok.Builder;
import lombok.ToString;

import java.util.Optional;

/**
 * References to the meta-arguments found on one resource block.
 * <p>
 * The references point into the source block's body and are only valid while
 * that block is unchanged.
 */
@Builder
@ToString
public class MetaArguments {
    private final Attribute count;
    private final Attribute forEach;
    private final Block lifecycle;
    private final Attribute dependsOn;
    private final Attribute provider;
    private final Block timeouts;

    public Optional<Attribute> getCount() {
        return Optional.ofNullable(count);
    }

    public Optional<Attribute> getForEach() {
        return Optional.ofNullable(forEach);
    }

    public Optional<Block> getLifecycle() {
        return Optional.ofNullable(lifecycle);
    }

    public Optional<Attribute> getDependsOn() {
        return Optional.ofNullable(dependsOn);
    }

    public Optional<Attribute> getProvider() {
        return Optional.ofNullable(provider);
    }

    public Optional<Block> getTimeouts() {
        return Optional.ofNullable(timeouts);
    }

    public boolean isEmpty() {
        return count == null && forEach == null && lifecycle == null
                && dependsOn == null && provider == null && timeouts == null;
    }
}
