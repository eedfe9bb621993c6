package com.treegen.runtime.edge;

import com.treegen.runtime.BaseNode;
import com.treegen.runtime.IdentifierMap;
import com.treegen.runtime.cbor.CborMapReader;

/**
 * Builds a node from its serialized map. Generated node classes provide one
 * as their static {@code deserialize} method.
 */
@FunctionalInterface
public interface NodeDeserializer<T extends BaseNode> {

    T deserialize(CborMapReader map, IdentifierMap ids);
}
