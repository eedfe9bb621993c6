package com.treegen.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.runtime.annotation.Annotatable;
import com.treegen.runtime.cbor.CborMapWriter;

/**
 * Base class of every generated tree node.
 *
 * Generated subclasses implement the per-field parts of the tree algorithms;
 * this class composes them into the well-formedness check and the node
 * serialization format.
 */
public abstract class BaseNode extends Annotatable {
    private static final Logger log = LoggerFactory.getLogger(BaseNode.class);

    /**
     * Type tag of the node, the title case name of its node type.
     */
    public abstract String getTypeName();

    /**
     * Adds every node reachable from this one through owning edges to the map,
     * depth first. The node itself must already be in it.
     *
     * @throws NotWellFormedException if a node is reached twice
     */
    public abstract void findReachable(PointerMap map);

    /**
     * Checks that required edges are filled and that links point at nodes in
     * the map, for this node and everything it owns.
     *
     * @throws NotWellFormedException on the first violation
     */
    public abstract void checkComplete(PointerMap map);

    /**
     * Returns a shallow copy: owned children are shared with this node, so
     * the result is not well-formed together with the original.
     */
    public abstract BaseNode copy();

    /**
     * Returns a deep copy of everything this node owns. Links in the copy
     * still point at the nodes this tree links to.
     */
    @Override
    public abstract BaseNode clone();

    /**
     * Compares the fields of this node with those of a node of the same
     * class.
     */
    public abstract boolean equalsStructurally(BaseNode other, NodeEquality equality);

    /**
     * Whether the trees rooted at this node and at {@code other} have equal
     * shape, primitive values and link targets.
     */
    public boolean equalsStructurally(BaseNode other) {
        return NodeEquality.equal(this, other);
    }

    /**
     * Appends a human-readable dump of the tree rooted at this node, starting
     * at the given indentation level.
     */
    public abstract void dump(StringBuilder out, int indent);

    public String dump() {
        StringBuilder out = new StringBuilder();
        dump(out, 0);
        return out.toString();
    }

    /**
     * Checks the tree rooted at this node.
     *
     * @throws NotWellFormedException on the first violation found
     */
    public void checkWellFormed() {
        PointerMap map = new PointerMap();
        map.add(this);
        findReachable(map);
        checkComplete(map);
    }

    public boolean isWellFormed() {
        try {
            checkWellFormed();
            return true;
        } catch (NotWellFormedException e) {
            log.debug("{} tree is not well-formed: {}", getTypeName(), e.getMessage());
            return false;
        }
    }

    /**
     * Writes this node into an open map: the type tag, the sequence number
     * from {@code ids}, one entry per field and the annotations.
     */
    public final void serializeNode(CborMapWriter map, PointerMap ids) {
        map.appendString("@t", getTypeName());
        map.appendInt("@i", ids.get(this));
        serializeFields(map, ids);
        serializeAnnotations(map);
    }

    /**
     * Writes one entry per field. Trees generated without primitive
     * serialization functions do not support this.
     */
    protected void serializeFields(CborMapWriter map, PointerMap ids) {
        throw new UnsupportedOperationException("serialization is not supported for " + getTypeName());
    }
}
