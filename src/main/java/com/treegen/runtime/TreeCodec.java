package com.treegen.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;
import com.treegen.runtime.cbor.CborReader;
import com.treegen.runtime.cbor.CborWriter;
import com.treegen.runtime.edge.NodeDeserializer;
import com.treegen.runtime.edge.One;

/**
 * Entry points for converting whole trees to and from CBOR.
 *
 * The root is written like the contents of a {@code One} edge. Nodes are
 * numbered in reachability order and links are written as the number of
 * their target.
 */
public final class TreeCodec {
    private static final Logger log = LoggerFactory.getLogger(TreeCodec.class);

    private TreeCodec() {
        // Utility class
    }

    /**
     * Serializes the tree rooted at the given node.
     *
     * @throws NotWellFormedException if a node is owned twice or a link
     *         points outside the tree
     */
    public static byte[] serialize(BaseNode root) {
        PointerMap ids = new PointerMap();
        ids.add(root);
        root.findReachable(ids);

        CborWriter writer = new CborWriter();
        CborMapWriter map = writer.startMap();
        new One<>(root).serializeInto(map, ids);
        map.close();
        byte[] data = writer.toByteArray();
        log.debug("Serialized {} tree of {} nodes into {} bytes", root.getTypeName(), ids.size(), data.length);
        return data;
    }

    /**
     * Deserializes a tree written by {@link #serialize(BaseNode)}.
     *
     * @param deserializer static {@code deserialize} method of the expected
     *        root type, e.g. {@code Directory::deserialize}
     * @throws SchemaValidationException if the data does not describe a tree
     *         of the expected type
     */
    public static <T extends BaseNode> T deserialize(byte[] data, NodeDeserializer<T> deserializer) {
        CborMapReader map = CborReader.parse(data).asMap();
        IdentifierMap ids = new IdentifierMap();
        One<T> root = new One<>(map, ids, deserializer);
        if (root.isEmpty()) {
            throw new SchemaValidationException("Schema validation failed: serialized tree has no root node");
        }
        ids.restoreLinks();
        log.debug("Deserialized {} tree of {} nodes", root.get().getTypeName(), ids.size());
        return root.get();
    }
}
