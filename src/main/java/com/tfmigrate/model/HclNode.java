package com.tfmigrate.model;

import com.tfmigrate.parser.HclToken;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Base class for the items of a {@link Body}.
 * <p>
 * Parsed nodes keep the trivia that surrounded them in the source (leading
 * indentation, comments and blank lines, trailing end-of-line comment and
 * newline) so that they print back unchanged. Nodes created by the engine have
 * no trivia and are laid out by the writer.
 */
@Getter
@Setter
@NoArgsConstructor
public abstract class HclNode {
    @ToString.Exclude
    protected List<HclToken> leading;
    @ToString.Exclude
    protected List<HclToken> trailing;

    protected HclNode(List<HclToken> leading, List<HclToken> trailing) {
        this.leading = leading != null ? List.copyOf(leading) : null;
        this.trailing = trailing != null ? List.copyOf(trailing) : null;
    }

    public abstract void accept(HclNodeVisitor visitor);

    /**
     * True when the node was built by a transformation rather than read from source.
     */
    public boolean isSynthetic() {
        return leading == null;
    }
}
