package com.treegen.codegen.util;

/**
 * Turns documentation strings of the specification into comments of
 * generated code. Lines are kept as written; no rewrapping is done.
 */
public class DocFormatter {

    private DocFormatter() {
        // Utility class
    }

    /**
     * Formats a Javadoc comment at the given indentation, ending in a newline.
     * Returns an empty string for blank documentation.
     */
    public static String javadoc(String doc, String indent) {
        if (doc == null || doc.isBlank()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append("/**\n");
        for (String line : doc.strip().split("\\R", -1)) {
            sb.append(indent).append(" *");
            if (!line.isBlank()) {
                sb.append(' ').append(escapeCommentEnd(line.stripTrailing()));
            }
            sb.append('\n');
        }
        sb.append(indent).append(" */\n");
        return sb.toString();
    }

    /**
     * Formats a block comment, ending in a newline, for file headers.
     */
    public static String blockComment(String doc) {
        if (doc == null || doc.isBlank()) {
            return "";
        }
        return javadoc(doc, "").replaceFirst("^/\\*\\*", "/*");
    }

    /**
     * First sentence of the documentation on a single line, for labels.
     */
    public static String summary(String doc) {
        if (doc == null || doc.isBlank()) {
            return "";
        }
        String flat = doc.strip().replaceAll("\\s+", " ");
        int end = flat.indexOf(". ");
        return end < 0 ? flat : flat.substring(0, end + 1);
    }

    private static String escapeCommentEnd(String line) {
        return line.replace("*/", "*&#47;");
    }
}
