package com.treegen.model;

import java.util.Objects;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * A field of a node type: either an edge to another node type of the same
 * specification, or a primitive value.
 *
 * Primitive fields may carry an edge kind of their own. Those wrap nodes of
 * an external tree (for instance {@code Many<other.tree.Expr>}) and follow
 * the edge kind's runtime contract, while plain primitives carry none.
 */
@Getter
@ToString(exclude = "nodeType")
public class Field {

    private final String name;
    private final String doc;

    /**
     * Edge kind, or null for a plain primitive.
     */
    private final EdgeKind edgeKind;

    /**
     * Name of the referenced node type for node fields, as declared. Null for
     * primitives.
     */
    private final String targetName;

    /**
     * Java type of a primitive field (a class name, possibly qualified). Null
     * for node fields.
     */
    private final String primitiveType;

    /**
     * Resolved target, set by {@link Specification#build()}. Shared with the
     * specification's node table, not owned by this field.
     */
    private NodeType nodeType;

    private Field(String name, String doc, EdgeKind edgeKind, String targetName, String primitiveType) {
        this.name = Objects.requireNonNull(name, "name");
        this.doc = doc == null ? "" : doc;
        this.edgeKind = edgeKind;
        this.targetName = targetName;
        this.primitiveType = primitiveType;
    }

    /**
     * Creates an edge to the node type with the given snake_case name.
     */
    public static Field child(EdgeKind kind, String targetName, String name, String doc) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(targetName, "targetName");
        return new Field(name, doc, kind, targetName, null);
    }

    /**
     * Creates a primitive field. {@code kind} may be null for a plain
     * primitive value.
     */
    public static Field primitive(String primitiveType, String name, String doc, EdgeKind kind) {
        Objects.requireNonNull(primitiveType, "primitiveType");
        return new Field(name, doc, kind, null, primitiveType);
    }

    public boolean isPrimitive() {
        return primitiveType != null;
    }

    /**
     * Whether this is a primitive without an edge kind.
     */
    public boolean isPlainPrimitive() {
        return primitiveType != null && edgeKind == null;
    }

    /**
     * Whether this field refers to a node type of the same specification.
     */
    public boolean isNodeReference() {
        return targetName != null;
    }

    /**
     * The effective edge kind of this field; empty for plain primitives.
     */
    public Optional<EdgeKind> getExtKind() {
        return Optional.ofNullable(edgeKind);
    }

    public boolean isOwning() {
        return edgeKind != null && edgeKind.isOwning();
    }

    public boolean isLink() {
        return edgeKind != null && edgeKind.isLink();
    }

    public boolean isResolved() {
        return !isNodeReference() || nodeType != null;
    }

    void resolve(NodeType target) {
        this.nodeType = target;
    }

    /**
     * Name of the type the field refers to: the resolved node's title case
     * name, or the primitive type.
     */
    public String getTypeName() {
        if (isPrimitive()) {
            return primitiveType;
        }
        return nodeType != null ? nodeType.getTitleCaseName() : targetName;
    }
}
