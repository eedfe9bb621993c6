package com.treegen.model.exception;

/**
 * Thrown when a node type or a field name is declared twice.
 */
public class DuplicateDefinitionException extends SpecificationException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public DuplicateDefinitionException(String what, String name) {
        super("duplicate " + what + " " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
