package com.tfmigrate.model;

import com.tfmigrate.parser.HclToken;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A name bound to the token sequence of its value expression.
 */
@Getter
@ToString(callSuper = false)
public class Attribute extends HclNode {
    private String name;
    @ToString.Exclude
    private final List<HclToken> assignTokens;
    @ToString.Exclude
    private List<HclToken> expression;
    private boolean rewritten;

    /**
     * Creates an attribute that is not backed by source text.
     */
    public Attribute(@NonNull String name, @NonNull List<HclToken> expression) {
        this.name = name;
        this.assignTokens = null;
        this.expression = List.copyOf(expression);
        this.rewritten = true;
    }

    /**
     * Creates an attribute read from source, keeping the exact tokens around the name.
     */
    public Attribute(String name, List<HclToken> leading, List<HclToken> assignTokens,
                     List<HclToken> expression, List<HclToken> trailing) {
        super(leading, trailing);
        this.name = name;
        this.assignTokens = List.copyOf(assignTokens);
        this.expression = List.copyOf(expression);
        this.rewritten = false;
    }

    @Override
    public void accept(HclNodeVisitor visitor) {
        visitor.visit(this);
    }

    /**
     * Replaces the value expression. The new value is laid out by the writer.
     */
    public void setExpression(@NonNull List<HclToken> tokens) {
        this.expression = List.copyOf(tokens);
        this.rewritten = true;
    }

    void rename(String newName) {
        this.name = newName;
    }

    /**
     * Returns the source text of the value expression.
     */
    public String getExpressionText() {
        return expression.stream().map(HclToken::getText).collect(Collectors.joining());
    }

    /**
     * Deep copy detached from any body.
     */
    public Attribute copy() {
        return new Attribute(name, expression);
    }
}
