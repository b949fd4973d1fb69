package com.tfmigrate.model;

/**
 * Visitor pattern interface for traversing a parsed configuration.
 */
public interface HclNodeVisitor {
    void visit(Attribute attribute);
    void visit(Block block);
}
