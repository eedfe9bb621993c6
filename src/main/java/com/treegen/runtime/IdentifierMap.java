package com.treegen.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.treegen.runtime.edge.OptLink;

/**
 * Collects the nodes of a tree being deserialized by sequence number, plus the
 * links whose targets could not be set yet.
 *
 * Links may point forward in the serialized order, or back up to an ancestor
 * of the link owner, so link targets are patched in a second pass by
 * {@link #restoreLinks()} once every node exists.
 */
public class IdentifierMap {

    private final Map<Long, BaseNode> nodes = new HashMap<>();
    private final List<PendingLink<?>> links = new ArrayList<>();

    /**
     * Registers a freshly deserialized node under its sequence number.
     *
     * @throws SchemaValidationException if the number is already taken
     */
    public void register(long sequenceNumber, BaseNode node) {
        BaseNode previous = nodes.putIfAbsent(sequenceNumber, node);
        if (previous != null) {
            throw new SchemaValidationException("Schema validation failed: duplicate sequence number "
                    + sequenceNumber + " (nodes of type " + previous.getTypeName() + " and "
                    + node.getTypeName() + ")");
        }
    }

    /**
     * Records a link to be pointed at the node with the given sequence number
     * once all nodes are known.
     */
    public <T extends BaseNode> void registerLink(OptLink<T> link, long sequenceNumber, Class<T> targetType) {
        links.add(new PendingLink<>(link, sequenceNumber, targetType));
    }

    /**
     * Patches every recorded link.
     *
     * @throws SchemaValidationException if a link refers to an unregistered
     *         sequence number or to a node of the wrong type
     */
    public void restoreLinks() {
        for (PendingLink<?> link : links) {
            link.restore(nodes);
        }
        links.clear();
    }

    public int size() {
        return nodes.size();
    }

    private static final class PendingLink<T extends BaseNode> {
        private final OptLink<T> link;
        private final long sequenceNumber;
        private final Class<T> targetType;

        private PendingLink(OptLink<T> link, long sequenceNumber, Class<T> targetType) {
            this.link = link;
            this.sequenceNumber = sequenceNumber;
            this.targetType = targetType;
        }

        private void restore(Map<Long, BaseNode> nodes) {
            BaseNode target = nodes.get(sequenceNumber);
            if (target == null) {
                throw new SchemaValidationException(
                        "Schema validation failed: link to unknown sequence number " + sequenceNumber);
            }
            if (!targetType.isInstance(target)) {
                throw new SchemaValidationException("Schema validation failed: link to node of type "
                        + target.getTypeName() + ", expected " + targetType.getSimpleName());
            }
            link.set(targetType.cast(target));
        }
    }
}
