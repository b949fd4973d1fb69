package com.tfmigrate.model;

import com.tfmigrate.parser.HclToken;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.List;

/**
 * A typed, labeled construct owning a nested {@link Body}.
 */
@Getter
@ToString(callSuper = false)
public class Block extends HclNode {
    private String type;
    private List<String> labels;
    @ToString.Exclude
    private List<HclToken> headerTokens;
    @ToString.Exclude
    private final List<HclToken> openTokens;
    @ToString.Exclude
    private final List<HclToken> closeTokens;
    @ToString.Exclude
    private final Body body;

    /**
     * Creates an empty block that is not backed by source text.
     */
    public Block(@NonNull String type, List<String> labels) {
        this.type = type;
        this.labels = labels != null ? List.copyOf(labels) : List.of();
        this.headerTokens = null;
        this.openTokens = null;
        this.closeTokens = null;
        this.body = new Body();
    }

    /**
     * Creates a block read from source.
     *
     * @param headerTokens tokens between the type keyword and the opening brace (labels and spacing)
     * @param openTokens   the opening brace plus any same-line trivia
     * @param closeTokens  the closing brace
     */
    public Block(String type, List<String> labels, List<HclToken> leading, List<HclToken> headerTokens,
                 List<HclToken> openTokens, Body body, List<HclToken> closeTokens, List<HclToken> trailing) {
        super(leading, trailing);
        this.type = type;
        this.labels = List.copyOf(labels);
        this.headerTokens = List.copyOf(headerTokens);
        this.openTokens = List.copyOf(openTokens);
        this.body = body;
        this.closeTokens = List.copyOf(closeTokens);
    }

    @Override
    public void accept(HclNodeVisitor visitor) {
        visitor.visit(this);
    }

    /**
     * Replaces the labels. The header is regenerated on output.
     */
    public void setLabels(@NonNull List<String> newLabels) {
        this.labels = List.copyOf(newLabels);
        this.headerTokens = null;
    }

    public void setType(@NonNull String newType) {
        this.type = newType;
    }

    /**
     * Returns the label at the given position, or null when absent.
     */
    public String getLabel(int index) {
        return index < labels.size() ? labels.get(index) : null;
    }

    /**
     * Deep copy detached from any body; every attribute and nested block is
     * copied rather than shared.
     */
    public Block copy() {
        Block copy = new Block(type, labels);
        for (HclNode item : body.getItems()) {
            if (item instanceof Attribute attribute) {
                copy.getBody().appendAttribute(attribute.copy());
            } else if (item instanceof Block nested) {
                copy.getBody().appendBlock(nested.copy());
            }
        }
        return copy;
    }
}
