package com.treegen.codegen.java;

import lombok.Builder;
import lombok.Value;

/**
 * One field of a generated node class, with the code snippets that involve
 * it already rendered.
 */
@Value
@Builder
public class FieldView {
    /** Declared snake_case name, used as the serialized key. */
    String name;
    String javaName;
    String getter;
    String setter;
    /** Java type of the field, e.g. {@code One<Directory>}. */
    String type;
    /** Indented Javadoc, possibly empty. */
    String javadoc;
    /** Expression assigning the parameter of the same name. */
    String assignExpr;
    /** Statements writing the field into {@code map}, indented. */
    String serializeCode;
    /** Name used in well-formedness messages, e.g. {@code Drive.root_dir}. */
    String qualifiedName;
}
