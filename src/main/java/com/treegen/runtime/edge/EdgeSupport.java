package com.treegen.runtime.edge;

import com.treegen.model.EdgeKind;
import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.PointerMap;
import com.treegen.runtime.cbor.CborMapReader;

/**
 * Steps shared by the owning edge containers.
 */
final class EdgeSupport {

    static final String KIND_KEY = "@T";
    static final String TYPE_KEY = "@t";
    static final String SEQUENCE_KEY = "@i";
    static final String ELEMENTS_KEY = "@d";
    static final String LINK_KEY = "@l";

    private EdgeSupport() {
        // Utility class
    }

    static void expectKind(CborMapReader map, EdgeKind kind) {
        map.expectString(KIND_KEY, kind.getWireTag());
    }

    /**
     * Deserializes one node map and registers the node under its sequence
     * number.
     */
    static <T extends BaseNode> T readNode(CborMapReader map, IdentifierMap ids,
            NodeDeserializer<? extends T> deserializer) {
        long sequenceNumber = map.at(SEQUENCE_KEY).asInt();
        T node = deserializer.deserialize(map, ids);
        ids.register(sequenceNumber, node);
        node.deserializeAnnotations(map);
        return node;
    }

    static void addReachable(BaseNode node, PointerMap map) {
        if (map.add(node)) {
            node.findReachable(map);
        }
    }

    @SuppressWarnings("unchecked")
    static <T extends BaseNode> T cloneNode(T node) {
        return (T) node.clone();
    }
}
