package com.treegen.runtime;

/**
 * Thrown when a tree violates one of its structural invariants: an owned node
 * occurring more than once, a required edge left empty, a link to a node
 * outside the tree, or an error-marker node.
 *
 * Checking never modifies the tree, so callers may fix the tree and check
 * again.
 */
public class NotWellFormedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotWellFormedException(String message) {
        super(message);
    }
}
