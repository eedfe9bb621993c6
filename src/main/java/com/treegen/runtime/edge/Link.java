package com.treegen.runtime.edge;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.NotWellFormedException;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapReader;

/**
 * Non-owning reference to exactly one node owned elsewhere in the same tree.
 */
public class Link<T extends BaseNode> extends OptLink<T> {

    public Link() {
    }

    public Link(T target) {
        super(target);
    }

    public Link(CborMapReader map, IdentifierMap ids, Class<T> targetType) {
        super(map, ids, targetType);
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.LINK;
    }

    @Override
    public Link<T> copy() {
        return new Link<>(orElseNull());
    }

    @Override
    public Link<T> clone() {
        return copy();
    }

    @Override
    public void checkComplete(PointerMap map, String fieldName) {
        if (isEmpty()) {
            throw new NotWellFormedException(fieldName + " is required but not set");
        }
        super.checkComplete(map, fieldName);
    }
}
