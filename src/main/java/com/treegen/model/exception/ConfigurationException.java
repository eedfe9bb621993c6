package com.treegen.model.exception;

/**
 * Thrown when generator-wide settings are missing or declared more than once.
 */
public class ConfigurationException extends SpecificationException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
