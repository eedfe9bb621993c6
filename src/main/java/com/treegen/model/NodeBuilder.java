package com.treegen.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates the declaration of one node type before it is added to a
 * {@link Specification}.
 *
 * <pre>
 * NodeBuilder entry = new NodeBuilder("entry", "A directory entry.")
 *         .withPrimitive("java.lang.String", "name", "Name of the entry.");
 * NodeBuilder file = new NodeBuilder("file", "A file.")
 *         .deriveFrom(entry)
 *         .withPrimitive("java.lang.String", "contents", "Contents of the file.");
 * </pre>
 */
public class NodeBuilder {

    private final NodeType node;

    /**
     * Starts a node type with the given snake_case name and documentation.
     */
    public NodeBuilder(String name, String doc) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("node name must not be blank");
        }
        this.node = new NodeType(name, doc);
    }

    public NodeBuilder(String name) {
        this(name, "");
    }

    /**
     * Marks this node type as deriving from the given one. The parent records
     * this node among its derived types.
     */
    public NodeBuilder deriveFrom(NodeBuilder parent) {
        return deriveFrom(parent.node);
    }

    public NodeBuilder deriveFrom(NodeType parent) {
        Objects.requireNonNull(parent, "parent");
        if (node.getParent() != null) {
            throw new IllegalStateException(node.getTitleCaseName() + " already derives from "
                    + node.getParent().getTitleCaseName());
        }
        node.setParent(parent);
        parent.addDerived(node);
        return this;
    }

    /**
     * Adds an edge of the given kind to the node type named {@code nodeName}.
     * The name is resolved when the specification is built.
     */
    public NodeBuilder withChild(EdgeKind kind, String nodeName, String name, String doc) {
        node.addField(Field.child(kind, nodeName, name, doc));
        return this;
    }

    public NodeBuilder withChild(EdgeKind kind, String nodeName, String name) {
        return withChild(kind, nodeName, name, "");
    }

    /**
     * Adds a plain primitive field.
     */
    public NodeBuilder withPrimitive(String primitiveType, String name, String doc) {
        node.addField(Field.primitive(primitiveType, name, doc, null));
        return this;
    }

    /**
     * Adds a primitive field that carries an edge kind, for nodes of an
     * external tree.
     */
    public NodeBuilder withPrimitive(String primitiveType, String name, String doc, EdgeKind kind) {
        node.addField(Field.primitive(primitiveType, name, doc, kind));
        return this;
    }

    /**
     * Sets the order in which fields appear in constructors and dumps.
     */
    public NodeBuilder withOrder(List<String> fieldNames) {
        node.setOrder(fieldNames);
        return this;
    }

    public NodeBuilder withOrder(String... fieldNames) {
        return withOrder(Arrays.asList(fieldNames));
    }

    /**
     * Marks this node type as the placeholder for a recovered parse error.
     * Trees containing such a node are never complete.
     */
    public NodeBuilder markError() {
        node.markErrorMarker();
        return this;
    }

    public String getName() {
        return node.getSnakeCaseName();
    }

    public NodeType getNode() {
        return node;
    }
}
