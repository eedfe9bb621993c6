package com.treegen.codegen.java;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Data model of the tree-wide templates.
 */
@Value
@Builder(toBuilder = true)
public class TreeView {
    FileHeaderView header;
    String javadoc;
    boolean serdes;
    /** All node types, ancestors first. */
    List<TreeNodeView> nodes;
    /** Leaf node types in declaration order. */
    List<TreeNodeView> leaves;
}
