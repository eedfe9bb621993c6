package com.treegen.codegen.backend;

/**
 * The available code generation targets.
 */
public enum BackendKind {
    /** Java node classes, visitors and dumper. */
    JAVA,
    /** Graphviz class diagram of the node types. */
    DOT
}
