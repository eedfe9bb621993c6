package com.treegen.codegen.util;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Manages import statements for generated Java classes. Standard library
 * imports come first, the rest after a blank line.
 */
public class ImportManager {

    private final Set<String> javaImports = new TreeSet<>();
    private final Set<String> otherImports = new TreeSet<>();
    private final Map<String, String> importedSimpleNames = new HashMap<>();
    private final String currentPackage;
    private final Set<String> localNames;

    public ImportManager(String currentPackage) {
        this(currentPackage, Set.of());
    }

    /**
     * @param localNames simple names declared in the current package; types
     *        from elsewhere with these names are never imported
     */
    public ImportManager(String currentPackage, Set<String> localNames) {
        this.currentPackage = currentPackage;
        this.localNames = localNames;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips simple names, classes in the same package and java.lang.
     *
     * @return whether the class can now be referred to by its simple name
     */
    public boolean addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return false;
        }

        String packageName = NamingUtil.packageName(fullQualifiedName);
        if (packageName.isEmpty() || packageName.equals(currentPackage)) {
            return true;
        }
        String simpleName = NamingUtil.simpleName(fullQualifiedName);
        if (localNames.contains(simpleName)) {
            return false;
        }
        String previous = importedSimpleNames.putIfAbsent(simpleName, fullQualifiedName);
        if (previous != null && !previous.equals(fullQualifiedName)) {
            return false;
        }
        if (packageName.equals("java.lang")) {
            return true;
        }

        if (fullQualifiedName.startsWith("java.") || fullQualifiedName.startsWith("javax.")) {
            javaImports.add(fullQualifiedName);
        } else {
            otherImports.add(fullQualifiedName);
        }
        return true;
    }

    /**
     * Adds multiple imports.
     */
    public void addImports(Iterable<String> fullQualifiedNames) {
        for (String fqn : fullQualifiedNames) {
            addImport(fqn);
        }
    }

    /**
     * Imports a class if possible and returns the name to refer to it by: the
     * simple name, or the qualified name when the simple name is taken.
     */
    public String use(String fullQualifiedName) {
        return addImport(fullQualifiedName) ? NamingUtil.simpleName(fullQualifiedName) : fullQualifiedName;
    }

    /**
     * Generates import statements as a string.
     */
    public String generateImports() {
        StringBuilder sb = new StringBuilder();
        for (String imp : javaImports) {
            sb.append("import ").append(imp).append(";\n");
        }
        if (!javaImports.isEmpty() && !otherImports.isEmpty()) {
            sb.append('\n');
        }
        for (String imp : otherImports) {
            sb.append("import ").append(imp).append(";\n");
        }
        return sb.toString();
    }
}
