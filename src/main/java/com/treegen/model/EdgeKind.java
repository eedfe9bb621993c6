package com.treegen.model;

import java.util.Arrays;

/**
 * The six kinds of edges a node can have to other nodes.
 *
 * Owning kinds (Maybe, One, Any, Many) make the referenced node part of the
 * tree: it must occur exactly once in the whole tree. Link kinds (Link,
 * OptLink) only refer to a node that is owned elsewhere in the same tree.
 */
public enum EdgeKind {

    /** Zero or one owned node. */
    MAYBE("Maybe", "?", true, false, false),

    /** Exactly one owned node. */
    ONE("One", "1", true, false, true),

    /** Zero or more owned nodes, in insertion order. */
    ANY("Any", "*", true, true, false),

    /** One or more owned nodes, in insertion order. */
    MANY("Many", "+", true, true, true),

    /** Exactly one reference to a node owned elsewhere in the tree. */
    LINK("Link", "$", false, false, true),

    /** Zero or one reference to a node owned elsewhere in the tree. */
    OPT_LINK("OptLink", "@", false, false, false);

    private final String containerName;
    private final String wireTag;
    private final boolean owning;
    private final boolean multiple;
    private final boolean required;

    EdgeKind(String containerName, String wireTag, boolean owning, boolean multiple, boolean required) {
        this.containerName = containerName;
        this.wireTag = wireTag;
        this.owning = owning;
        this.multiple = multiple;
        this.required = required;
    }

    /**
     * Name of the container type implementing this kind (e.g. {@code OptLink}).
     */
    public String getContainerName() {
        return containerName;
    }

    /**
     * Value of the {@code @T} entry written for edges of this kind.
     */
    public String getWireTag() {
        return wireTag;
    }

    public boolean isOwning() {
        return owning;
    }

    public boolean isLink() {
        return !owning;
    }

    public boolean isMultiple() {
        return multiple;
    }

    /**
     * Whether a complete tree must populate this edge (at least one node for
     * the multiple kinds).
     */
    public boolean isRequired() {
        return required;
    }

    public int getMinimumCount() {
        return required ? 1 : 0;
    }

    /**
     * Maximum number of nodes, or -1 when unbounded.
     */
    public int getMaximumCount() {
        return multiple ? -1 : 1;
    }

    /**
     * Looks up a kind by its container name, as written in schemas
     * ({@code Maybe}, {@code One}, {@code Any}, {@code Many}, {@code Link},
     * {@code OptLink}).
     */
    public static EdgeKind fromContainerName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.containerName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown edge kind: " + name));
    }

    /**
     * Looks up a kind by its {@code @T} wire tag.
     */
    public static EdgeKind fromWireTag(String tag) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireTag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown edge tag: " + tag));
    }
}
