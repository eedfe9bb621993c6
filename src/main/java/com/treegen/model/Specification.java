package com.treegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.model.exception.ConfigurationException;
import com.treegen.model.exception.DuplicateDefinitionException;
import com.treegen.model.exception.UnresolvedReferenceException;

/**
 * Complete description of a tree: its node types plus the generator-wide
 * settings the backends need.
 *
 * A specification is filled through {@link #addNode(NodeBuilder)} and the
 * setters, then resolved once with {@link #build()}. After a successful build
 * every node field refers directly to its target {@link NodeType} and the
 * specification can no longer be modified.
 */
public class Specification {
    private static final Logger log = LoggerFactory.getLogger(Specification.class);

    public static final String DEFAULT_SUPPORT_PACKAGE = "com.treegen.runtime";

    /** Node builders by snake_case name, in declaration order. */
    private final Map<String, NodeBuilder> builders = new LinkedHashMap<>();

    /** Resolved node types, populated by build(). */
    private final List<NodeType> nodes = new ArrayList<>();

    private final List<String> imports = new ArrayList<>();

    private String treePackage;
    private String supportPackage;
    private String initializeFunction;
    private String serializeFunction;
    private String deserializeFunction;
    private String sourceLocation;
    private String headerDoc = "";
    private String namespaceDoc = "";

    private boolean built;

    /**
     * Adds the node type declared by the given builder.
     *
     * @throws DuplicateDefinitionException if a node with the same name was
     *         already added
     */
    public Specification addNode(NodeBuilder builder) {
        checkMutable();
        String name = builder.getName();
        if (builders.containsKey(name)) {
            throw new DuplicateDefinitionException("node name", name);
        }
        builders.put(name, builder);
        return this;
    }

    /**
     * Returns the builder of a previously added node, for declaring derived
     * types or late fields.
     */
    public Optional<NodeBuilder> findBuilder(String name) {
        return Optional.ofNullable(builders.get(name));
    }

    /**
     * Sets the Java package of the generated tree classes.
     */
    public void setTreePackage(String treePackage) {
        checkMutable();
        if (this.treePackage != null) {
            throw new ConfigurationException("duplicate tree namespace declaration");
        }
        this.treePackage = treePackage;
    }

    /**
     * Sets the Java package of the runtime support library the generated code
     * uses. Defaults to {@value #DEFAULT_SUPPORT_PACKAGE}.
     */
    public void setSupportPackage(String supportPackage) {
        checkMutable();
        if (this.supportPackage != null) {
            throw new ConfigurationException("duplicate support namespace declaration");
        }
        this.supportPackage = supportPackage;
    }

    /**
     * Sets the fully qualified static method that yields the default value of
     * a primitive type, e.g. {@code com.example.Primitives.initialize}. It is
     * called as {@code Primitives.initialize(Type.class)}.
     */
    public void setInitializeFunction(String initializeFunction) {
        checkMutable();
        if (this.initializeFunction != null) {
            throw new ConfigurationException("duplicate initialization function declaration");
        }
        this.initializeFunction = initializeFunction;
    }

    /**
     * Sets the fully qualified static methods used to (de)serialize primitive
     * values. Without them no serialization code is generated.
     */
    public void setSerdesFunctions(String serializeFunction, String deserializeFunction) {
        checkMutable();
        if (this.serializeFunction != null) {
            throw new ConfigurationException("duplicate serialize/deserialize function declaration");
        }
        this.serializeFunction = Objects.requireNonNull(serializeFunction, "serializeFunction");
        this.deserializeFunction = Objects.requireNonNull(deserializeFunction, "deserializeFunction");
    }

    /**
     * Sets the annotation type holding source location information. Dumps
     * print it next to each node that carries one.
     */
    public void setSourceLocation(String sourceLocation) {
        checkMutable();
        if (this.sourceLocation != null) {
            throw new ConfigurationException("duplicate source location object declaration");
        }
        this.sourceLocation = sourceLocation;
    }

    public void setHeaderDoc(String headerDoc) {
        checkMutable();
        this.headerDoc = headerDoc == null ? "" : headerDoc;
    }

    public void setNamespaceDoc(String namespaceDoc) {
        checkMutable();
        this.namespaceDoc = namespaceDoc == null ? "" : namespaceDoc;
    }

    /**
     * Adds a type to import in every generated file.
     */
    public void addImport(String qualifiedName) {
        checkMutable();
        imports.add(qualifiedName);
    }

    /**
     * Checks the specification for errors, resolves node names, and builds the
     * node list. Nothing is resolved when an error is found.
     *
     * @throws ConfigurationException if the initialization function or the
     *         tree package was never set
     * @throws UnresolvedReferenceException if a field refers to an undeclared
     *         node type, or a field order names an unknown field
     * @throws DuplicateDefinitionException if a node's fields (including
     *         inherited ones) share a name
     */
    public void build() {
        if (built) {
            throw new IllegalStateException("specification was already built");
        }
        if (initializeFunction == null || initializeFunction.isBlank()) {
            throw new ConfigurationException("initialization function not specified");
        }
        if (treePackage == null || treePackage.isBlank()) {
            throw new ConfigurationException("tree namespace not specified");
        }

        // Look everything up before touching any field, so a failure leaves
        // the specification unresolved.
        Map<Field, NodeType> resolved = new LinkedHashMap<>();
        for (NodeBuilder builder : builders.values()) {
            NodeType node = builder.getNode();
            NodeBuilder parentBuilder = node.getParent() == null
                    ? null : builders.get(node.getParent().getSnakeCaseName());
            if (node.getParent() != null && (parentBuilder == null || parentBuilder.getNode() != node.getParent())) {
                throw new UnresolvedReferenceException(
                        "node " + node.getTitleCaseName() + " derives from undeclared node "
                                + node.getParent().getSnakeCaseName(),
                        node.getParent().getSnakeCaseName());
            }
            for (Field field : node.getFields()) {
                if (!field.isNodeReference()) {
                    continue;
                }
                NodeBuilder target = builders.get(field.getTargetName());
                if (target == null) {
                    throw UnresolvedReferenceException.undefinedNode(
                            node.getTitleCaseName(), field.getName(), field.getTargetName());
                }
                resolved.put(field, target.getNode());
            }
        }
        for (NodeBuilder builder : builders.values()) {
            builder.getNode().validateFields();
        }

        if (supportPackage == null) {
            supportPackage = DEFAULT_SUPPORT_PACKAGE;
        }
        resolved.forEach(Field::resolve);
        for (NodeBuilder builder : builders.values()) {
            nodes.add(builder.getNode());
        }
        built = true;
        log.debug("Built specification {} with {} node types ({} leaves)",
                treePackage, nodes.size(), getLeafNodes().size());
    }

    public boolean isBuilt() {
        return built;
    }

    /**
     * Resolved node types in declaration order.
     */
    public List<NodeType> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Resolved node types ordered such that every type comes after its
     * ancestors, otherwise keeping declaration order.
     */
    public List<NodeType> getNodesAncestorsFirst() {
        Set<NodeType> ordered = new LinkedHashSet<>();
        for (NodeType node : nodes) {
            ordered.addAll(node.getAncestors());
            ordered.add(node);
        }
        return new ArrayList<>(ordered);
    }

    /**
     * The instantiable node types, in declaration order.
     */
    public List<NodeType> getLeafNodes() {
        return nodes.stream().filter(NodeType::isLeaf).toList();
    }

    public Optional<NodeType> findNode(String snakeCaseName) {
        return nodes.stream()
                .filter(node -> node.getSnakeCaseName().equals(snakeCaseName))
                .findFirst();
    }

    public List<String> getImports() {
        return Collections.unmodifiableList(imports);
    }

    public String getTreePackage() {
        return treePackage;
    }

    public String getSupportPackage() {
        return supportPackage != null ? supportPackage : DEFAULT_SUPPORT_PACKAGE;
    }

    public String getInitializeFunction() {
        return initializeFunction;
    }

    public Optional<String> getSerializeFunction() {
        return Optional.ofNullable(serializeFunction);
    }

    public Optional<String> getDeserializeFunction() {
        return Optional.ofNullable(deserializeFunction);
    }

    public boolean hasSerdes() {
        return serializeFunction != null;
    }

    public Optional<String> getSourceLocation() {
        return Optional.ofNullable(sourceLocation);
    }

    public String getHeaderDoc() {
        return headerDoc;
    }

    public String getNamespaceDoc() {
        return namespaceDoc;
    }

    private void checkMutable() {
        if (built) {
            throw new IllegalStateException("specification is immutable once built");
        }
    }
}
