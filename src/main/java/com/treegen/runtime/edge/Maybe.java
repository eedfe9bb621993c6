package com.treegen.runtime.edge;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Supplier;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.NodeEquality;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;

/**
 * Owning edge to zero or one node.
 *
 * Setting a node does not check whether it is owned elsewhere; that is left
 * to the well-formedness check.
 */
public class Maybe<T extends BaseNode> implements Edge {

    private T value;

    public Maybe() {
    }

    public Maybe(T value) {
        this.value = value;
    }

    /**
     * Reads the edge from its serialized map.
     */
    public Maybe(CborMapReader map, IdentifierMap ids, NodeDeserializer<? extends T> deserializer) {
        EdgeSupport.expectKind(map, getKind());
        if (!map.at(EdgeSupport.TYPE_KEY).isNull()) {
            this.value = EdgeSupport.readNode(map, ids, deserializer);
        }
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.MAYBE;
    }

    @Override
    public boolean isEmpty() {
        return value == null;
    }

    @Override
    public int size() {
        return value == null ? 0 : 1;
    }

    /**
     * @throws NoSuchElementException if the edge is empty
     */
    public T get() {
        if (value == null) {
            throw new NoSuchElementException(getKind().getContainerName() + " edge is empty");
        }
        return value;
    }

    public T orElseNull() {
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Points the edge at a node. Null empties the edge.
     */
    public void set(T value) {
        this.value = value;
    }

    public void reset() {
        this.value = null;
    }

    /**
     * Sets the edge to a newly constructed node and returns that node.
     */
    public <S extends T> S emplace(Supplier<S> factory) {
        S node = factory.get();
        this.value = node;
        return node;
    }

    /**
     * Returns an edge to the same node.
     */
    public Maybe<T> copy() {
        return new Maybe<>(value);
    }

    /**
     * Returns an edge to a deep copy of the node.
     */
    public Maybe<T> clone() {
        return new Maybe<>(value == null ? null : EdgeSupport.cloneNode(value));
    }

    @Override
    public void findReachable(PointerMap map) {
        if (value != null) {
            EdgeSupport.addReachable(value, map);
        }
    }

    @Override
    public void checkComplete(PointerMap map, String fieldName) {
        if (value != null) {
            value.checkComplete(map);
        }
    }

    @Override
    public boolean equalsStructurally(Edge other, NodeEquality equality) {
        if (!(other instanceof Maybe) || other.getKind() != getKind()) {
            return false;
        }
        return equality.nodes(value, ((Maybe<?>) other).value);
    }

    @Override
    public void serializeInto(CborMapWriter map, PointerMap ids) {
        map.appendString(EdgeSupport.KIND_KEY, getKind().getWireTag());
        if (value == null) {
            map.appendNull(EdgeSupport.TYPE_KEY);
        } else {
            value.serializeNode(map, ids);
        }
    }

    @Override
    public String toString() {
        return getKind().getContainerName() + "(" + (value == null ? "" : value.getTypeName()) + ")";
    }
}
