package com.treegen.model.exception;

/**
 * Base class for errors detected while assembling or resolving a tree
 * specification.
 */
public class SpecificationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SpecificationException(String message) {
        super(message);
    }

    public SpecificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
