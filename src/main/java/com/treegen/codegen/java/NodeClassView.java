package com.treegen.codegen.java;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Data model of the NodeClass template: one class per node type.
 */
@Value
@Builder
public class NodeClassView {
    FileHeaderView header;
    String className;
    String superClassName;
    String javadoc;
    boolean abstractType;
    boolean errorMarker;
    boolean serdes;
    String typeName;
    String enumConstant;

    /** Fields declared by this node type itself. */
    List<FieldView> fields;
    /** Edges the reachability pass descends into, in field order. */
    List<FieldView> reachableFields;
    /** All edges, in field order, for the completeness check. */
    List<FieldView> edgeFields;
    /** All fields, inherited ones included, in field order. */
    List<FieldView> allFields;

    String constructorVisibility;
    String constructorParams;
    String superArgs;
    String defaultArgs;
    String copyArgs;
    String cloneArgs;
    String equalsExpr;
    String deserializeArgs;

    /** Leaf classes an abstract type dispatches to when deserializing. */
    List<String> leafClassNames;
}
