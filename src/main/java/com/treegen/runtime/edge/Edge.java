package com.treegen.runtime.edge;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.NodeEquality;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapWriter;

/**
 * A field of a tree node that refers to other nodes, with the cardinality and
 * ownership rules of its {@link EdgeKind}.
 */
public interface Edge {

    EdgeKind getKind();

    boolean isEmpty();

    /**
     * Number of nodes the edge refers to.
     */
    int size();

    /**
     * Adds the owned nodes to the map and descends into them. Links add
     * nothing.
     */
    void findReachable(PointerMap map);

    /**
     * Checks the edge against its kind's completeness rules.
     *
     * @param fieldName qualified field name used in error messages, e.g.
     *        {@code Drive.root_dir}
     */
    void checkComplete(PointerMap map, String fieldName);

    boolean equalsStructurally(Edge other, NodeEquality equality);

    /**
     * Writes the edge as a map entry under {@code key}.
     */
    default void serialize(CborMapWriter parent, String key, PointerMap ids) {
        CborMapWriter map = parent.appendMap(key);
        serializeInto(map, ids);
        map.close();
    }

    /**
     * Writes the kind tag and contents of the edge into an open map.
     */
    void serializeInto(CborMapWriter map, PointerMap ids);
}
