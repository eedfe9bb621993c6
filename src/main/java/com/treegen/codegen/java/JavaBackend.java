package com.treegen.codegen.java;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.codegen.backend.BackendKind;
import com.treegen.codegen.backend.CodeBackend;
import com.treegen.codegen.model.output.GeneratedFile;
import com.treegen.codegen.model.output.GeneratedFileType;
import com.treegen.codegen.util.DocFormatter;
import com.treegen.codegen.util.ImportManager;
import com.treegen.codegen.util.NamingUtil;
import com.treegen.model.EdgeKind;
import com.treegen.model.Field;
import com.treegen.model.NodeType;
import com.treegen.model.Specification;
import com.treegen.model.exception.ConfigurationException;

/**
 * Generates the Java implementation of a tree: the {@code NodeType} enum,
 * the {@code Node} base class, one class per node type, the visitor
 * interface, a recursive visitor and a debug dumper.
 *
 * Code snippets are rendered here and laid out by the FreeMarker templates
 * under {@code /templates/java}.
 */
public class JavaBackend implements CodeBackend {
    private static final Logger log = LoggerFactory.getLogger(JavaBackend.class);

    /** Classes generated for every tree; node types may not use these names. */
    static final Set<String> GENERATED_CLASS_NAMES = Set.of(
            "Node", "NodeType", "Visitor", "RecursiveVisitor", "Dumper");

    private static final String INDENT = "        ";

    private final TemplateRenderer renderer;

    public JavaBackend() {
        this(new TemplateRenderer());
    }

    public JavaBackend(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.JAVA;
    }

    @Override
    public List<GeneratedFile> generate(Specification spec) {
        if (!spec.isBuilt()) {
            throw new IllegalStateException("specification must be built before generating code");
        }
        checkClassNames(spec);

        Set<String> localNames = new HashSet<>(GENERATED_CLASS_NAMES);
        spec.getNodes().forEach(node -> localNames.add(node.getTitleCaseName()));

        List<GeneratedFile> files = new ArrayList<>();
        files.add(javaFile(spec, "NodeType",
                renderer.render("java/NodeType.ftl", "tree", treeView(spec, newImports(spec, localNames)))));
        files.add(javaFile(spec, "Node",
                renderer.render("java/Node.ftl", "tree", nodeBaseView(spec, localNames))));
        files.add(javaFile(spec, "Visitor",
                renderer.render("java/Visitor.ftl", "tree", treeView(spec, newImports(spec, localNames)))));
        files.add(javaFile(spec, "RecursiveVisitor",
                renderer.render("java/RecursiveVisitor.ftl", "tree", treeView(spec, newImports(spec, localNames)))));
        files.add(javaFile(spec, "Dumper",
                renderer.render("java/Dumper.ftl", "tree", dumperView(spec, localNames))));

        for (NodeType node : spec.getNodesAncestorsFirst()) {
            log.debug("Generating class {}", node.getTitleCaseName());
            NodeClassView view = nodeClassView(spec, node, newImports(spec, localNames));
            files.add(javaFile(spec, node.getTitleCaseName(), renderer.render("java/NodeClass.ftl", "node", view)));
        }
        log.info("Generated {} Java files for package {}", files.size(), spec.getTreePackage());
        return files;
    }

    private void checkClassNames(Specification spec) {
        for (NodeType node : spec.getNodes()) {
            if (GENERATED_CLASS_NAMES.contains(node.getTitleCaseName())) {
                throw new ConfigurationException("node name " + node.getSnakeCaseName()
                        + " clashes with generated class " + node.getTitleCaseName());
            }
        }
    }

    private ImportManager newImports(Specification spec, Set<String> localNames) {
        ImportManager imports = new ImportManager(spec.getTreePackage(), localNames);
        imports.addImports(spec.getImports());
        return imports;
    }

    private GeneratedFile javaFile(Specification spec, String className, String contents) {
        Path path = Path.of(NamingUtil.packageToPath(spec.getTreePackage()), className + ".java");
        return GeneratedFile.builder()
                .path(path)
                .contents(contents)
                .type(GeneratedFileType.JAVA)
                .build();
    }

    private FileHeaderView header(Specification spec, ImportManager imports) {
        String comment = DocFormatter.blockComment(spec.getHeaderDoc().isBlank()
                ? "Generated by treegen. Do not edit."
                : spec.getHeaderDoc() + "\n\nGenerated by treegen. Do not edit.");
        return FileHeaderView.builder()
                .comment(comment)
                .packageName(spec.getTreePackage())
                .imports(imports.generateImports())
                .build();
    }

    private String runtime(Specification spec, String name) {
        return spec.getSupportPackage() + "." + name;
    }

    // Tree-wide files

    private TreeView treeView(Specification spec, ImportManager imports) {
        return treeView(spec, imports, Optional.empty());
    }

    private TreeView treeView(Specification spec, ImportManager imports, Optional<String> sourceLocation) {
        List<TreeNodeView> nodes = new ArrayList<>();
        for (NodeType node : spec.getNodesAncestorsFirst()) {
            nodes.add(treeNodeView(node, sourceLocation));
        }
        List<TreeNodeView> leaves = spec.getLeafNodes().stream()
                .map(node -> treeNodeView(node, sourceLocation))
                .collect(Collectors.toList());
        return TreeView.builder()
                .header(header(spec, imports))
                .javadoc(DocFormatter.javadoc(spec.getNamespaceDoc(), ""))
                .serdes(spec.hasSerdes())
                .nodes(nodes)
                .leaves(leaves)
                .build();
    }

    private TreeView nodeBaseView(Specification spec, Set<String> localNames) {
        ImportManager imports = newImports(spec, localNames);
        imports.addImport(runtime(spec, "BaseNode"));
        if (spec.hasSerdes()) {
            imports.addImport(runtime(spec, "IdentifierMap"));
            imports.addImport(runtime(spec, "SchemaValidationException"));
            imports.addImport(runtime(spec, "cbor.CborMapReader"));
        }
        return treeView(spec, imports);
    }

    private TreeView dumperView(Specification spec, Set<String> localNames) {
        ImportManager imports = newImports(spec, localNames);
        Optional<String> sourceLocation = spec.getSourceLocation().map(imports::use);
        return treeView(spec, imports, sourceLocation);
    }

    private TreeNodeView treeNodeView(NodeType node, Optional<String> sourceLocation) {
        return TreeNodeView.builder()
                .className(node.getTitleCaseName())
                .enumConstant(NamingUtil.toScreamingSnakeCase(node.getTitleCaseName()))
                .leaf(node.isLeaf())
                .parentVisit(node.getParent() == null ? "Node" : node.getParent().getTitleCaseName())
                .childVisits(childVisits(node))
                .dumpCode(node.isLeaf() ? dumpCode(node, sourceLocation) : "")
                .build();
    }

    /**
     * Statements descending into the owned node edges a type declares
     * itself. Inherited edges are visited by the parent's visit method, and
     * primitive edges belong to another tree's visitors.
     */
    private List<String> childVisits(NodeType node) {
        List<String> visits = new ArrayList<>();
        for (Field field : node.getFields()) {
            if (!field.isNodeReference() || !field.isOwning()) {
                continue;
            }
            String getter = "node." + NamingUtil.toGetterName(field.getName()) + "()";
            if (field.getEdgeKind().isMultiple()) {
                visits.add(getter + ".forEach(child -> child.accept(this));");
            } else {
                visits.add(getter + ".toOptional().ifPresent(child -> child.accept(this));");
            }
        }
        return visits;
    }

    private String dumpCode(NodeType node, Optional<String> sourceLocation) {
        StringBuilder sb = new StringBuilder();
        line(sb, 0, "writeIndent();");
        line(sb, 0, "out.append(\"" + node.getTitleCaseName() + "(\");");
        sourceLocation.ifPresent(type -> line(sb, 0, "node.findAnnotation(" + type
                + ".class).ifPresent(location -> out.append(\" # \").append(location));"));
        line(sb, 0, "out.append('\\n');");
        List<Field> fields = node.getAllFields();
        if (!fields.isEmpty()) {
            line(sb, 0, "indent++;");
            for (Field field : fields) {
                dumpField(sb, field);
            }
            line(sb, 0, "indent--;");
        }
        line(sb, 0, "writeIndent();");
        line(sb, 0, "out.append(\")\\n\");");
        return sb.toString();
    }

    private void dumpField(StringBuilder sb, Field field) {
        String getter = "node." + NamingUtil.toGetterName(field.getName()) + "()";
        line(sb, 0, "writeIndent();");
        if (field.isPlainPrimitive()) {
            line(sb, 0, "out.append(\"" + field.getName() + ": \");");
            line(sb, 0, "out.append(" + getter + ").append('\\n');");
            return;
        }
        EdgeKind kind = field.getEdgeKind();
        line(sb, 0, "out.append(\"" + field.getName() + (kind.isLink() ? " --> " : ": ") + "\");");
        line(sb, 0, "if (" + getter + ".isEmpty()) {");
        if (kind.isMultiple()) {
            line(sb, 1, "out.append(\"" + (kind.isRequired() ? "!MISSING" : "[]") + "\\n\");");
            line(sb, 0, "} else {");
            line(sb, 1, "out.append(\"[\\n\");");
            line(sb, 1, "indent++;");
            line(sb, 1, getter + ".forEach(child -> " + dumpChild(field, "child") + ");");
            line(sb, 1, "indent--;");
            line(sb, 1, "writeIndent();");
            line(sb, 1, "out.append(\"]\\n\");");
        } else {
            line(sb, 1, "out.append(\"" + (kind.isRequired() ? "!MISSING" : "-") + "\\n\");");
            line(sb, 0, "} else {");
            line(sb, 1, "out.append(\"<\\n\");");
            line(sb, 1, "indent++;");
            if (kind.isLink()) {
                line(sb, 1, "if (!inLink) {");
                line(sb, 2, "inLink = true;");
                line(sb, 2, dumpChild(field, getter + ".get()") + ";");
                line(sb, 2, "inLink = false;");
                line(sb, 1, "} else {");
                line(sb, 2, "writeIndent();");
                line(sb, 2, "out.append(\"...\\n\");");
                line(sb, 1, "}");
            } else {
                line(sb, 1, dumpChild(field, getter + ".get()") + ";");
            }
            line(sb, 1, "indent--;");
            line(sb, 1, "writeIndent();");
            line(sb, 1, "out.append(\">\\n\");");
        }
        line(sb, 0, "}");
    }

    private String dumpChild(Field field, String expr) {
        return field.isPrimitive() ? expr + ".dump(out, indent)" : expr + ".accept(this)";
    }

    private static void line(StringBuilder sb, int depth, String code) {
        sb.append(INDENT).append("    ".repeat(depth)).append(code).append('\n');
    }

    // Node classes

    private NodeClassView nodeClassView(Specification spec, NodeType node, ImportManager imports) {
        String className = node.getTitleCaseName();
        List<Field> allFields = node.getAllFields();
        boolean serdes = spec.hasSerdes();
        boolean leaf = node.isLeaf();
        HookCalls hooks = new HookCalls(spec, imports);

        List<FieldView> own = new ArrayList<>();
        List<FieldView> all = new ArrayList<>();
        List<FieldView> reachable = new ArrayList<>();
        List<FieldView> edges = new ArrayList<>();
        for (Field field : allFields) {
            FieldView view = fieldView(spec, className, field, leaf && serdes, imports, hooks);
            all.add(view);
            if (node.getFields().contains(field)) {
                own.add(view);
            }
            if (field.isOwning()) {
                reachable.add(view);
            }
            if (field.getEdgeKind() != null) {
                edges.add(view);
            }
        }
        List<Field> parentFields = node.getParent() == null ? List.of() : node.getParent().getAllFields();

        String defaultArgs = "";
        String copyArgs = "";
        String cloneArgs = "";
        String equalsExpr = "";
        String deserializeArgs = "";
        if (leaf) {
            defaultArgs = allFields.stream()
                    .map(field -> defaultValue(spec, field, imports, hooks))
                    .collect(Collectors.joining(", "));
            copyArgs = allFields.stream()
                    .map(field -> copyExpr(field, false))
                    .collect(Collectors.joining(", "));
            cloneArgs = allFields.stream()
                    .map(field -> copyExpr(field, true))
                    .collect(Collectors.joining(", "));
            equalsExpr = allFields.stream()
                    .map(this::equalsExpr)
                    .collect(Collectors.joining("\n" + INDENT + "        && "));
            if (serdes) {
                deserializeArgs = allFields.stream()
                        .map(field -> "\n" + INDENT + "        " + deserializeExpr(spec, field, imports, hooks))
                        .collect(Collectors.joining(","));
            }
        }

        if (node.getFields().stream().anyMatch(field -> field.getEdgeKind() != null)) {
            imports.addImport("java.util.Objects");
        }
        if (leaf) {
            imports.addImport(runtime(spec, "BaseNode"));
            imports.addImport(runtime(spec, "NodeEquality"));
            imports.addImport(runtime(spec, "PointerMap"));
            if (node.isErrorMarker()) {
                imports.addImport(runtime(spec, "NotWellFormedException"));
            }
        }
        if (serdes) {
            imports.addImport(runtime(spec, "IdentifierMap"));
            imports.addImport(runtime(spec, "SchemaValidationException"));
            imports.addImport(runtime(spec, "cbor.CborMapReader"));
            if (leaf) {
                imports.addImport(runtime(spec, "cbor.CborMapWriter"));
            }
        }

        return NodeClassView.builder()
                .header(header(spec, imports))
                .className(className)
                .superClassName(node.getParent() == null ? "Node" : node.getParent().getTitleCaseName())
                .javadoc(DocFormatter.javadoc(node.getDoc(), ""))
                .abstractType(!leaf)
                .errorMarker(node.isErrorMarker())
                .serdes(serdes)
                .typeName(className)
                .enumConstant(NamingUtil.toScreamingSnakeCase(className))
                .fields(own)
                .reachableFields(reachable)
                .edgeFields(edges)
                .allFields(all)
                .constructorVisibility(leaf ? "public" : "protected")
                .constructorParams(all.stream()
                        .map(field -> field.getType() + " " + field.getJavaName())
                        .collect(Collectors.joining(", ")))
                .superArgs(parentFields.stream()
                        .map(field -> NamingUtil.toFieldName(field.getName()))
                        .collect(Collectors.joining(", ")))
                .defaultArgs(defaultArgs)
                .copyArgs(copyArgs)
                .cloneArgs(cloneArgs)
                .equalsExpr(equalsExpr)
                .deserializeArgs(deserializeArgs)
                .leafClassNames(node.getLeafDescendants().stream()
                        .map(NodeType::getTitleCaseName)
                        .collect(Collectors.toList()))
                .build();
    }

    private FieldView fieldView(Specification spec, String className, Field field, boolean serializable,
            ImportManager imports, HookCalls hooks) {
        String javaName = NamingUtil.toFieldName(field.getName());
        String getter = NamingUtil.toGetterName(field.getName());
        String assign = field.getEdgeKind() != null
                ? "Objects.requireNonNull(" + javaName + ", \"" + javaName + "\")"
                : javaName;
        return FieldView.builder()
                .name(field.getName())
                .javaName(javaName)
                .getter(getter)
                .setter(NamingUtil.toSetterName(field.getName()))
                .type(javaType(spec, field, imports))
                .javadoc(DocFormatter.javadoc(field.getDoc(), "    "))
                .assignExpr(assign)
                .serializeCode(serializable ? serializeCode(field, getter, javaName, imports, hooks) : "")
                .qualifiedName(className + "." + field.getName())
                .build();
    }

    private String javaType(Specification spec, Field field, ImportManager imports) {
        String target = targetType(field, imports);
        if (field.getEdgeKind() == null) {
            return target;
        }
        return container(spec, field, imports) + "<" + target + ">";
    }

    private String container(Specification spec, Field field, ImportManager imports) {
        return imports.use(runtime(spec, "edge." + field.getEdgeKind().getContainerName()));
    }

    private String targetType(Field field, ImportManager imports) {
        if (field.isNodeReference()) {
            return field.getNodeType().getTitleCaseName();
        }
        String type = field.getPrimitiveType();
        if (type.contains("<")) {
            throw new ConfigurationException("primitive type " + type + " of field " + field.getName()
                    + " must not be generic");
        }
        return imports.use(type);
    }

    private String defaultValue(Specification spec, Field field, ImportManager imports, HookCalls hooks) {
        if (field.getEdgeKind() == null) {
            return hooks.initialize(targetType(field, imports));
        }
        return "new " + container(spec, field, imports) + "<>()";
    }

    private String copyExpr(Field field, boolean deep) {
        String getter = NamingUtil.toGetterName(field.getName()) + "()";
        if (field.getEdgeKind() == null) {
            return getter;
        }
        return getter + (deep ? ".clone()" : ".copy()");
    }

    private String equalsExpr(Field field) {
        String getter = NamingUtil.toGetterName(field.getName());
        if (field.getEdgeKind() == null) {
            return "equality.values(" + getter + "(), that." + getter + "())";
        }
        return getter + "().equalsStructurally(that." + getter + "(), equality)";
    }

    private String serializeCode(Field field, String getter, String javaName, ImportManager imports,
            HookCalls hooks) {
        if (field.getEdgeKind() != null) {
            return INDENT + getter + "().serialize(map, \"" + field.getName() + "\", ids);\n";
        }
        String local = javaName + "Map";
        return INDENT + "CborMapWriter " + local + " = map.appendMap(\"" + field.getName() + "\");\n"
                + INDENT + hooks.serialize(targetType(field, imports), getter + "()", local) + ";\n"
                + INDENT + local + ".close();\n";
    }

    private String deserializeExpr(Specification spec, Field field, ImportManager imports, HookCalls hooks) {
        String submap = "map.at(\"" + field.getName() + "\").asMap()";
        String target = targetType(field, imports);
        if (field.getEdgeKind() == null) {
            return hooks.deserialize(target, submap);
        }
        String source = field.isLink() ? target + ".class" : target + "::deserialize";
        return "new " + container(spec, field, imports) + "<>(" + submap + ", ids, " + source + ")";
    }

    /**
     * Renders calls to the primitive hook functions of a specification. The
     * hook classes are imported on first use only.
     */
    private static final class HookCalls {
        private final Specification spec;
        private final ImportManager imports;

        private HookCalls(Specification spec, ImportManager imports) {
            this.spec = spec;
            this.imports = imports;
        }

        private String reference(String function) {
            String owner = NamingUtil.packageName(function);
            if (owner.isEmpty()) {
                throw new ConfigurationException("primitive function " + function
                        + " must be qualified with its class, e.g. Primitives." + function);
            }
            return imports.use(owner) + "." + NamingUtil.simpleName(function);
        }

        String initialize(String type) {
            return reference(spec.getInitializeFunction()) + "(" + type + ".class)";
        }

        String serialize(String type, String value, String map) {
            String function = spec.getSerializeFunction()
                    .orElseThrow(() -> new IllegalStateException("no serialize function configured"));
            return reference(function) + "(" + type + ".class, " + value + ", " + map + ")";
        }

        String deserialize(String type, String map) {
            String function = spec.getDeserializeFunction()
                    .orElseThrow(() -> new IllegalStateException("no deserialize function configured"));
            return reference(function) + "(" + type + ".class, " + map + ")";
        }
    }
}
