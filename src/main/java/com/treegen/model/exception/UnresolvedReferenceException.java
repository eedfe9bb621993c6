package com.treegen.model.exception;

/**
 * Thrown when a field refers to a node type that was never declared, or when
 * a field order override names a field the node does not have.
 */
public class UnresolvedReferenceException extends SpecificationException {

    private static final long serialVersionUID = 1L;

    private final String reference;

    public UnresolvedReferenceException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    public static UnresolvedReferenceException undefinedNode(String nodeName, String fieldName, String targetName) {
        return new UnresolvedReferenceException(
                "use of undefined node " + targetName + " in field " + nodeName + "." + fieldName, targetName);
    }

    public static UnresolvedReferenceException unknownOrderedField(String nodeName, String fieldName) {
        return new UnresolvedReferenceException(
                "Unknown field in field order of " + nodeName + ": " + fieldName, fieldName);
    }

    public String getReference() {
        return reference;
    }
}
