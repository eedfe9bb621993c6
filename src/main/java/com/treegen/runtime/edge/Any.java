package com.treegen.runtime.edge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.NodeEquality;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborArrayWriter;
import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;
import com.treegen.runtime.cbor.CborReader;

/**
 * Owning edge to an ordered list of zero or more nodes.
 *
 * Index arguments of {@link #add(BaseNode, int)} and {@link #remove(int)} may
 * be negative to count from the end. Adding a node that the list (or the tree)
 * already owns is allowed; the well-formedness check reports it.
 */
public class Any<T extends BaseNode> implements Edge, Iterable<T> {

    private final List<T> nodes = new ArrayList<>();

    public Any() {
    }

    public Any(Iterable<? extends T> nodes) {
        extend(nodes);
    }

    public Any(CborMapReader map, IdentifierMap ids, NodeDeserializer<? extends T> deserializer) {
        EdgeSupport.expectKind(map, getKind());
        for (CborReader element : map.at(EdgeSupport.ELEMENTS_KEY).asArray()) {
            nodes.add(EdgeSupport.readNode(element.asMap(), ids, deserializer));
        }
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.ANY;
    }

    @Override
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public int size() {
        return nodes.size();
    }

    public T get(int index) {
        return nodes.get(index);
    }

    public void set(int index, T node) {
        nodes.set(index, Objects.requireNonNull(node, "node"));
    }

    /**
     * Appends a node.
     *
     * @return this edge, for chaining
     */
    public Any<T> add(T node) {
        nodes.add(Objects.requireNonNull(node, "node"));
        return this;
    }

    /**
     * Inserts a node so that it ends up at the given position. A negative
     * position counts from the end: {@code -1} appends, {@code -2} inserts
     * before the last node.
     *
     * @throws IndexOutOfBoundsException if the position is outside the list
     */
    public Any<T> add(T node, int index) {
        Objects.requireNonNull(node, "node");
        int position = index < 0 ? index + nodes.size() + 1 : index;
        if (position < 0 || position > nodes.size()) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for size " + nodes.size());
        }
        nodes.add(position, node);
        return this;
    }

    /**
     * Appends a newly constructed node.
     *
     * @return this edge, for chaining
     */
    public Any<T> emplace(Supplier<? extends T> factory) {
        return add(factory.get());
    }

    public Any<T> extend(Iterable<? extends T> other) {
        for (T node : other) {
            add(node);
        }
        return this;
    }

    /**
     * Removes the last node. Does nothing when the list is empty.
     */
    public void remove() {
        remove(-1);
    }

    /**
     * Removes the node at the given position, negative positions counting
     * from the end. Does nothing when the list is empty.
     *
     * @throws IndexOutOfBoundsException if the list is not empty and the
     *         position is outside it
     */
    public void remove(int index) {
        if (nodes.isEmpty()) {
            return;
        }
        int position = index < 0 ? index + nodes.size() : index;
        if (position < 0 || position >= nodes.size()) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for size " + nodes.size());
        }
        nodes.remove(position);
    }

    public void clear() {
        nodes.clear();
    }

    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }

    public Stream<T> stream() {
        return nodes.stream();
    }

    /**
     * Unmodifiable view of the nodes.
     */
    public List<T> asList() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Returns an edge to the same nodes.
     */
    public Any<T> copy() {
        return new Any<>(nodes);
    }

    /**
     * Returns an edge to deep copies of the nodes.
     */
    public Any<T> clone() {
        Any<T> result = new Any<>();
        cloneInto(result);
        return result;
    }

    void cloneInto(Any<T> target) {
        for (T node : nodes) {
            target.add(EdgeSupport.cloneNode(node));
        }
    }

    @Override
    public void findReachable(PointerMap map) {
        for (T node : nodes) {
            EdgeSupport.addReachable(node, map);
        }
    }

    @Override
    public void checkComplete(PointerMap map, String fieldName) {
        for (T node : nodes) {
            node.checkComplete(map);
        }
    }

    @Override
    public boolean equalsStructurally(Edge other, NodeEquality equality) {
        if (!(other instanceof Any) || other.getKind() != getKind()) {
            return false;
        }
        List<?> otherNodes = ((Any<?>) other).nodes;
        if (nodes.size() != otherNodes.size()) {
            return false;
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (!equality.nodes(nodes.get(i), (BaseNode) otherNodes.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void serializeInto(CborMapWriter map, PointerMap ids) {
        map.appendString(EdgeSupport.KIND_KEY, getKind().getWireTag());
        CborArrayWriter elements = map.appendArray(EdgeSupport.ELEMENTS_KEY);
        for (T node : nodes) {
            CborMapWriter element = elements.appendMap();
            node.serializeNode(element, ids);
            element.close();
        }
        elements.close();
    }

    @Override
    public String toString() {
        return getKind().getContainerName() + "(size=" + nodes.size() + ")";
    }
}
