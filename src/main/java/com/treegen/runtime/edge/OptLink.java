package com.treegen.runtime.edge;

import java.util.NoSuchElementException;
import java.util.Optional;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.NodeEquality;
import com.treegen.runtime.NotWellFormedException;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;
import com.treegen.runtime.cbor.CborReader;

/**
 * Non-owning reference to zero or one node owned elsewhere in the same tree.
 *
 * The target is not checked on assignment. The completeness check requires
 * it to be reachable from the root being checked; links may point anywhere in
 * the tree, including at an ancestor of the link's owner.
 */
public class OptLink<T extends BaseNode> implements Edge {

    private T target;

    public OptLink() {
    }

    public OptLink(T target) {
        this.target = target;
    }

    /**
     * Reads the edge from its serialized map. The target is filled in by
     * {@link IdentifierMap#restoreLinks()} once the whole tree is read.
     */
    public OptLink(CborMapReader map, IdentifierMap ids, Class<T> targetType) {
        EdgeSupport.expectKind(map, getKind());
        CborReader sequence = map.at(EdgeSupport.LINK_KEY);
        if (!sequence.isNull()) {
            ids.registerLink(this, sequence.asInt(), targetType);
        }
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.OPT_LINK;
    }

    @Override
    public boolean isEmpty() {
        return target == null;
    }

    @Override
    public int size() {
        return target == null ? 0 : 1;
    }

    /**
     * @throws NoSuchElementException if the link is empty
     */
    public T get() {
        if (target == null) {
            throw new NoSuchElementException(getKind().getContainerName() + " edge is empty");
        }
        return target;
    }

    public T orElseNull() {
        return target;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(target);
    }

    public void set(T target) {
        this.target = target;
    }

    public void reset() {
        this.target = null;
    }

    /**
     * Returns a link to the same target.
     */
    public OptLink<T> copy() {
        return new OptLink<>(target);
    }

    /**
     * Same as {@link #copy()}: cloning a tree does not redirect its links into
     * the clone.
     */
    public OptLink<T> clone() {
        return copy();
    }

    @Override
    public void findReachable(PointerMap map) {
        // Links own nothing.
    }

    @Override
    public void checkComplete(PointerMap map, String fieldName) {
        if (target != null && !map.contains(target)) {
            throw new NotWellFormedException(fieldName + " links to unreachable node");
        }
    }

    @Override
    public boolean equalsStructurally(Edge other, NodeEquality equality) {
        if (!(other instanceof OptLink) || other.getKind() != getKind()) {
            return false;
        }
        return equality.links(target, ((OptLink<?>) other).target);
    }

    @Override
    public void serializeInto(CborMapWriter map, PointerMap ids) {
        map.appendString(EdgeSupport.KIND_KEY, getKind().getWireTag());
        if (target == null) {
            map.appendNull(EdgeSupport.LINK_KEY);
        } else {
            map.appendInt(EdgeSupport.LINK_KEY, ids.get(target));
        }
    }

    @Override
    public String toString() {
        return getKind().getContainerName() + "(" + (target == null ? "" : "--> " + target.getTypeName()) + ")";
    }
}
