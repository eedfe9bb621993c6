package com.treegen.codegen.java;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * A node type as seen by the tree-wide files (Node, visitors, dumper).
 */
@Value
@Builder
public class TreeNodeView {
    String className;
    String enumConstant;
    boolean leaf;
    /** Visit method of the parent type without the {@code visit} prefix. */
    String parentVisit;
    /** Statements of the recursive visitor that descend into owned nodes. */
    List<String> childVisits;
    /** Body of the dumper's visit method, indented. */
    String dumpCode;
}
