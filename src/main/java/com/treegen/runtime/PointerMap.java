package com.treegen.runtime;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps the nodes reachable from a root, by identity, to the order in which
 * they were first reached. The order doubles as the node's sequence number in
 * serialized form.
 *
 * A strict map (the default) rejects a node reached twice; that is what
 * enforces the tree shape of owning edges. A lenient map just ignores repeats,
 * which is what structural comparison needs when a tree is not well-formed.
 */
public class PointerMap {

    private final Map<BaseNode, Integer> sequence = new IdentityHashMap<>();
    private final boolean strict;

    public PointerMap() {
        this(true);
    }

    private PointerMap(boolean strict) {
        this.strict = strict;
    }

    public static PointerMap lenient() {
        return new PointerMap(false);
    }

    /**
     * Registers a node reached through an owning edge.
     *
     * @return true if the node was new, false if a lenient map already had it
     * @throws NotWellFormedException if a strict map already had it
     */
    public boolean add(BaseNode node) {
        if (sequence.containsKey(node)) {
            if (strict) {
                throw new NotWellFormedException("Duplicate node of type " + node.getTypeName()
                        + " found in tree: node occurs more than once");
            }
            return false;
        }
        sequence.put(node, sequence.size());
        return true;
    }

    /**
     * Returns the sequence number of a node that must be in the map, for
     * serializing a link to it.
     *
     * @throws NotWellFormedException if the node was never reached
     */
    public int get(BaseNode node) {
        Integer seq = sequence.get(node);
        if (seq == null) {
            throw new NotWellFormedException("Link to node of type " + node.getTypeName()
                    + " not found in tree");
        }
        return seq;
    }

    public OptionalInt find(BaseNode node) {
        Integer seq = sequence.get(node);
        return seq == null ? OptionalInt.empty() : OptionalInt.of(seq);
    }

    public boolean contains(BaseNode node) {
        return sequence.containsKey(node);
    }

    public int size() {
        return sequence.size();
    }
}
