package com.treegen.codegen.model.output;

/**
 * Categories of generated artifacts.
 */
public enum GeneratedFileType {
    JAVA,
    DIAGRAM
}
