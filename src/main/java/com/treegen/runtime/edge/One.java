package com.treegen.runtime.edge;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.NotWellFormedException;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapReader;

/**
 * Owning edge to exactly one node. May be empty while a tree is being built;
 * only the completeness check requires a node.
 */
public class One<T extends BaseNode> extends Maybe<T> {

    public One() {
    }

    public One(T value) {
        super(value);
    }

    public One(CborMapReader map, IdentifierMap ids, NodeDeserializer<? extends T> deserializer) {
        super(map, ids, deserializer);
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.ONE;
    }

    @Override
    public One<T> copy() {
        return new One<>(orElseNull());
    }

    @Override
    public One<T> clone() {
        return new One<>(isEmpty() ? null : EdgeSupport.cloneNode(get()));
    }

    @Override
    public void checkComplete(PointerMap map, String fieldName) {
        if (isEmpty()) {
            throw new NotWellFormedException(fieldName + " is required but not set");
        }
        super.checkComplete(map, fieldName);
    }
}
