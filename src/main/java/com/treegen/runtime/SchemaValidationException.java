package com.treegen.runtime;

/**
 * Thrown when serialized tree data does not match the tree's schema: an
 * unexpected type tag, a missing reserved key, a duplicate sequence number or
 * a link to a sequence number that no node carries. The partially
 * deserialized tree is discarded.
 */
public class SchemaValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaValidationException(String message) {
        super(message);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SchemaValidationException unexpectedType(String expected, String found) {
        return new SchemaValidationException(
                "Schema validation failed: unexpected node type " + found + ", expected " + expected);
    }
}
