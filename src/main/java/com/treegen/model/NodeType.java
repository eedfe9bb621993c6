package com.treegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import com.treegen.model.exception.DuplicateDefinitionException;
import com.treegen.model.exception.UnresolvedReferenceException;

import lombok.Getter;

/**
 * A node type of the specification.
 *
 * Node types form a single-inheritance hierarchy. Only leaf types (no derived
 * types) are instantiable; the others share fields and act as dispatch
 * targets. All node types are owned by the {@link Specification}'s node
 * table; {@link #getParent()} and {@link #getDerived()} are references into
 * that table.
 */
@Getter
public class NodeType {

    private final String snakeCaseName;
    private final String titleCaseName;
    private final String doc;

    private NodeType parent;
    private final List<NodeType> derived = new ArrayList<>();
    private final List<Field> fields = new ArrayList<>();
    private final List<String> order = new ArrayList<>();
    private boolean errorMarker;

    NodeType(String snakeCaseName, String doc) {
        this.snakeCaseName = snakeCaseName;
        this.titleCaseName = toTitleCase(snakeCaseName);
        this.doc = doc == null ? "" : doc;
    }

    public List<NodeType> getDerived() {
        return Collections.unmodifiableList(derived);
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<String> getOrder() {
        return Collections.unmodifiableList(order);
    }

    public boolean isLeaf() {
        return derived.isEmpty();
    }

    public boolean isAbstract() {
        return !derived.isEmpty();
    }

    /**
     * Returns all fields of this node type: the fields of the ancestors,
     * root-most first, followed by the node's own fields, then reordered by
     * the explicit field order if one was given. Fields named in the order
     * list come first, in that order; the rest keep their relative order.
     *
     * @throws UnresolvedReferenceException if the order names a field that
     *         neither this node nor its ancestors have
     */
    public List<Field> getAllFields() {
        List<Field> all = new ArrayList<>();
        for (NodeType ancestor : getAncestors()) {
            all.addAll(ancestor.fields);
        }
        all.addAll(fields);
        if (order.isEmpty()) {
            return all;
        }

        LinkedList<Field> remaining = new LinkedList<>(all);
        List<Field> reordered = new ArrayList<>();
        for (String name : order) {
            Field found = remaining.stream()
                    .filter(field -> field.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> UnresolvedReferenceException.unknownOrderedField(titleCaseName, name));
            remaining.remove(found);
            reordered.add(found);
        }
        reordered.addAll(remaining);
        return reordered;
    }

    /**
     * Returns the chain of ancestors, root-most first. Empty for root types.
     */
    public List<NodeType> getAncestors() {
        LinkedList<NodeType> ancestors = new LinkedList<>();
        for (NodeType current = parent; current != null; current = current.parent) {
            ancestors.addFirst(current);
        }
        return ancestors;
    }

    /**
     * Returns the leaf node types this type dispatches to: itself when it is a
     * leaf, otherwise the leaves of all derived types, depth first.
     */
    public List<NodeType> getLeafDescendants() {
        List<NodeType> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    private static void collectLeaves(NodeType node, List<NodeType> leaves) {
        if (node.isLeaf()) {
            leaves.add(node);
            return;
        }
        for (NodeType child : node.derived) {
            collectLeaves(child, leaves);
        }
    }

    /**
     * Whether this type is {@code other} or one of its ancestors.
     */
    public boolean isSameOrAncestorOf(NodeType other) {
        for (NodeType current = other; current != null; current = current.parent) {
            if (current == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks the full field list: the order override must resolve and no name
     * may occur twice.
     */
    void validateFields() {
        Set<String> names = new HashSet<>();
        for (Field field : getAllFields()) {
            if (!names.add(field.getName())) {
                throw new DuplicateDefinitionException("field", titleCaseName + "." + field.getName());
            }
        }
    }

    void setParent(NodeType parent) {
        this.parent = parent;
    }

    void addDerived(NodeType child) {
        derived.add(child);
    }

    void addField(Field field) {
        fields.add(field);
    }

    void setOrder(List<String> names) {
        order.clear();
        order.addAll(names);
    }

    void markErrorMarker() {
        this.errorMarker = true;
    }

    static String toTitleCase(String snakeCase) {
        StringBuilder sb = new StringBuilder();
        for (String token : snakeCase.split("_")) {
            if (token.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(token.charAt(0))).append(token.substring(1));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "NodeType(" + titleCaseName + ")";
    }
}
