package com.tfmigrate.model;

import com.tfmigrate.parser.HclToken;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered sequence of attributes and nested blocks.
 * <p>
 * Order is significant and kept on output. Lookups that return several nodes
 * return a snapshot, so callers may remove nodes while walking the result.
 */
public class Body {
    private final List<HclNode> items = new ArrayList<>();

    /**
     * Trivia between the last item and the closing brace (or end of file).
     * Null for bodies created by the engine.
     */
    @Getter
    @Setter
    private List<HclToken> trailing;

    /**
     * Indentation of the items, as found in source. Null lets the writer derive it.
     */
    @Getter
    @Setter
    private String indent;

    public Body() {
    }

    public Body(List<HclNode> items, List<HclToken> trailing, String indent) {
        this.items.addAll(items);
        this.trailing = trailing != null ? List.copyOf(trailing) : null;
        this.indent = indent;
    }

    public List<HclNode> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int indexOf(HclNode node) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * All attributes in body order.
     */
    public List<Attribute> getAttributes() {
        List<Attribute> attributes = new ArrayList<>();
        for (HclNode item : items) {
            if (item instanceof Attribute attribute) {
                attributes.add(attribute);
            }
        }
        return attributes;
    }

    /**
     * All nested blocks in body order.
     */
    public List<Block> getBlocks() {
        List<Block> blocks = new ArrayList<>();
        for (HclNode item : items) {
            if (item instanceof Block block) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    public Optional<Attribute> findAttribute(String name) {
        for (HclNode item : items) {
            if (item instanceof Attribute attribute && attribute.getName().equals(name)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    public boolean hasAttribute(String name) {
        return findAttribute(name).isPresent();
    }

    /**
     * First nested block of the given type.
     */
    public Optional<Block> findBlock(String type) {
        for (HclNode item : items) {
            if (item instanceof Block block && block.getType().equals(type)) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    /**
     * Snapshot of all nested blocks of the given type, in body order.
     */
    public List<Block> findBlocks(String type) {
        List<Block> matches = new ArrayList<>();
        for (HclNode item : items) {
            if (item instanceof Block block && block.getType().equals(type)) {
                matches.add(block);
            }
        }
        return matches;
    }

    /**
     * Sets an attribute to the given expression tokens. An existing attribute
     * keeps its position; otherwise a new attribute is appended.
     */
    public Attribute setAttributeRaw(@NonNull String name, @NonNull List<HclToken> tokens) {
        Optional<Attribute> existing = findAttribute(name);
        if (existing.isPresent()) {
            existing.get().setExpression(tokens);
            return existing.get();
        }
        Attribute attribute = new Attribute(name, tokens);
        items.add(attribute);
        return attribute;
    }

    /**
     * Sets an attribute at a given position. An existing attribute with the same
     * name is replaced and the new one takes the requested position.
     */
    public Attribute insertAttribute(int index, @NonNull String name, @NonNull List<HclToken> tokens) {
        int position = Math.max(0, Math.min(index, items.size()));
        Optional<Attribute> existing = findAttribute(name);
        if (existing.isPresent()) {
            int existingIndex = indexOf(existing.get());
            items.remove(existingIndex);
            if (existingIndex < position) {
                position--;
            }
        }
        Attribute attribute = new Attribute(name, tokens);
        items.add(position, attribute);
        return attribute;
    }

    public void appendAttribute(@NonNull Attribute attribute) {
        items.add(attribute);
    }

    /**
     * Renames an attribute in place, keeping its position and formatting.
     */
    public boolean renameAttribute(String oldName, String newName) {
        Optional<Attribute> existing = findAttribute(oldName);
        if (existing.isEmpty()) {
            return false;
        }
        if (!oldName.equals(newName)) {
            findAttribute(newName).ifPresent(this::remove);
        }
        existing.get().rename(newName);
        return true;
    }

    public boolean removeAttribute(String name) {
        Optional<Attribute> existing = findAttribute(name);
        existing.ifPresent(this::remove);
        return existing.isPresent();
    }

    public void appendBlock(@NonNull Block block) {
        items.add(block);
    }

    public Block appendNewBlock(String type, List<String> labels) {
        Block block = new Block(type, labels);
        items.add(block);
        return block;
    }

    /**
     * Removes the given block instance.
     */
    public boolean removeBlock(Block block) {
        return remove(block);
    }

    private boolean remove(HclNode node) {
        int index = indexOf(node);
        if (index < 0) {
            return false;
        }
        items.remove(index);
        return true;
    }

    /**
     * True when the body holds at least one node built by the engine.
     */
    public boolean hasSyntheticItems() {
        return items.stream().anyMatch(HclNode::isSynthetic);
    }
}
