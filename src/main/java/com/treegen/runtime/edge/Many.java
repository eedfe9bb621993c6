package com.treegen.runtime.edge;

import java.util.function.Supplier;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.NotWellFormedException;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapReader;

/**
 * Owning edge to an ordered list of one or more nodes. Like {@link Any}, but
 * the completeness check rejects an empty list.
 */
public class Many<T extends BaseNode> extends Any<T> {

    public Many() {
    }

    public Many(Iterable<? extends T> nodes) {
        super(nodes);
    }

    public Many(CborMapReader map, IdentifierMap ids, NodeDeserializer<? extends T> deserializer) {
        super(map, ids, deserializer);
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.MANY;
    }

    @Override
    public Many<T> add(T node) {
        super.add(node);
        return this;
    }

    @Override
    public Many<T> add(T node, int index) {
        super.add(node, index);
        return this;
    }

    @Override
    public Many<T> emplace(Supplier<? extends T> factory) {
        super.emplace(factory);
        return this;
    }

    @Override
    public Many<T> extend(Iterable<? extends T> other) {
        super.extend(other);
        return this;
    }

    @Override
    public Many<T> copy() {
        return new Many<>(asList());
    }

    @Override
    public Many<T> clone() {
        Many<T> result = new Many<>();
        cloneInto(result);
        return result;
    }

    @Override
    public void checkComplete(PointerMap map, String fieldName) {
        if (isEmpty()) {
            throw new NotWellFormedException(fieldName + " needs at least one node but has zero");
        }
        super.checkComplete(map, fieldName);
    }
}
