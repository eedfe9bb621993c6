package com.treegen.runtime;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * State of one structural comparison between two trees.
 *
 * Links are equal when they point at the same node, or at nodes with the
 * same position in their respective trees. The latter is what makes a tree
 * equal to the result of deserializing it.
 *
 * An owned node that is reached again while it is still being compared, as
 * happens in trees with an owning cycle, is compared like a link.
 */
public class NodeEquality {

    private final PointerMap left = PointerMap.lenient();
    private final PointerMap right = PointerMap.lenient();
    private final Set<BaseNode> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

    private NodeEquality(BaseNode leftRoot, BaseNode rightRoot) {
        left.add(leftRoot);
        leftRoot.findReachable(left);
        right.add(rightRoot);
        rightRoot.findReachable(right);
    }

    /**
     * Compares the trees rooted at the two nodes.
     */
    public static boolean equal(BaseNode a, BaseNode b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        return new NodeEquality(a, b).nodes(a, b);
    }

    /**
     * Compares two owned nodes, either of which may be null.
     */
    public boolean nodes(BaseNode a, BaseNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.getClass() != b.getClass()) {
            return false;
        }
        if (!inProgress.add(a)) {
            return links(a, b);
        }
        try {
            return a.equalsStructurally(b, this);
        } finally {
            inProgress.remove(a);
        }
    }

    /**
     * Compares two link targets, either of which may be null.
     */
    public boolean links(BaseNode a, BaseNode b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        OptionalInt leftSeq = left.find(a);
        OptionalInt rightSeq = right.find(b);
        return leftSeq.isPresent() && rightSeq.isPresent() && leftSeq.getAsInt() == rightSeq.getAsInt();
    }

    /**
     * Compares two primitive values.
     */
    public boolean values(Object a, Object b) {
        return Objects.deepEquals(a, b);
    }
}
