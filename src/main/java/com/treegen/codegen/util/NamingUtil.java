package com.treegen.codegen.util;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Naming conventions for generated Java code. Node and field names are
 * declared in snake_case.
 */
public class NamingUtil {

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "yield", "record", "sealed", "permits");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts snake_case to PascalCase. Existing capitals are kept, so
     * {@code root_dir} becomes {@code RootDir} and {@code cQASM} stays
     * {@code CQASM}.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("_"))
                .filter(token -> !token.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts snake_case to camelCase.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase() + pascal.substring(1);
    }

    /**
     * Converts snake_case or PascalCase to SCREAMING_SNAKE_CASE for enum
     * constants.
     */
    public static String toScreamingSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        result = result.replaceAll("[-\\s]+", "_");
        return result.toUpperCase();
    }

    /**
     * Java identifier for a field: camelCase, with a trailing underscore when
     * that would be a keyword.
     */
    public static String toFieldName(String name) {
        String camel = toCamelCase(name);
        return JAVA_KEYWORDS.contains(camel) ? camel + "_" : camel;
    }

    /**
     * Getter name for a field. Avoids {@code getClass}, which Object already
     * declares final.
     */
    public static String toGetterName(String name) {
        String getter = "get" + toPascalCase(name);
        return "getClass".equals(getter) ? getter + "_" : getter;
    }

    public static String toSetterName(String name) {
        return "set" + toPascalCase(name);
    }

    public static boolean isJavaKeyword(String name) {
        return JAVA_KEYWORDS.contains(name);
    }

    /**
     * Simple name of a possibly qualified class name.
     */
    public static String simpleName(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? qualifiedName : qualifiedName.substring(lastDot + 1);
    }

    /**
     * Package of a qualified class name, empty for simple names.
     */
    public static String packageName(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? "" : qualifiedName.substring(0, lastDot);
    }

    /**
     * Converts a package name to the directory path it lives in.
     */
    public static String packageToPath(String packageName) {
        return packageName.replace('.', '/');
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) {
            return str;
        }
        return str.substring(0, 1).toUpperCase() + str.substring(1);
    }
}
