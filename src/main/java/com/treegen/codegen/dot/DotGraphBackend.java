package com.treegen.codegen.dot;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.codegen.backend.BackendKind;
import com.treegen.codegen.backend.CodeBackend;
import com.treegen.codegen.model.output.GeneratedFile;
import com.treegen.codegen.model.output.GeneratedFileType;
import com.treegen.codegen.util.DocFormatter;
import com.treegen.codegen.util.NamingUtil;
import com.treegen.model.EdgeKind;
import com.treegen.model.Field;
import com.treegen.model.NodeType;
import com.treegen.model.Specification;

/**
 * Generates a Graphviz class diagram of the node types: one record per type,
 * dotted arrows from parent to derived types and one labelled arrow per
 * field. Arrow style and the label suffix show the edge kind.
 */
public class DotGraphBackend implements CodeBackend {
    private static final Logger log = LoggerFactory.getLogger(DotGraphBackend.class);

    public static final String DEFAULT_FILE_NAME = "tree.dot";

    private static final String FONT = "fontname=Helvetica, fontsize=10";

    private final String fileName;

    public DotGraphBackend() {
        this(DEFAULT_FILE_NAME);
    }

    public DotGraphBackend(String fileName) {
        this.fileName = fileName;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.DOT;
    }

    @Override
    public List<GeneratedFile> generate(Specification spec) {
        if (!spec.isBuilt()) {
            throw new IllegalStateException("specification must be built before generating a diagram");
        }
        String contents = render(spec);
        log.info("Generated class diagram {} with {} node types", fileName, spec.getNodes().size());
        return List.of(GeneratedFile.builder()
                .path(Path.of(fileName))
                .contents(contents)
                .type(GeneratedFileType.DIAGRAM)
                .build());
    }

    /**
     * Renders the diagram source.
     */
    public String render(Specification spec) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph tree {\n");
        String label = DocFormatter.summary(spec.getNamespaceDoc());
        if (!label.isEmpty()) {
            sb.append("  label=\"").append(escape(label)).append("\";\n");
        }
        sb.append("  node [shape=record, ").append(FONT).append("];\n");

        for (NodeType node : spec.getNodes()) {
            sb.append("  ").append(node.getTitleCaseName())
                    .append(" [ label=\"").append(node.getTitleCaseName()).append('"');
            if (node.isAbstract()) {
                sb.append(", style=dotted");
            }
            sb.append("];\n");
        }
        for (NodeType node : spec.getNodes()) {
            if (node.getParent() != null) {
                sb.append("  ").append(node.getParent().getTitleCaseName())
                        .append(" -> ").append(node.getTitleCaseName())
                        .append(" [ arrowhead=open, style=dotted ];\n");
            }
        }

        int primitiveId = 0;
        for (NodeType node : spec.getNodes()) {
            for (Field field : node.getFields()) {
                String target;
                if (field.isNodeReference()) {
                    target = field.getNodeType().getTitleCaseName();
                } else {
                    target = "prim" + primitiveId++;
                    sb.append("  ").append(target)
                            .append(" [ label=\"").append(escape(NamingUtil.simpleName(field.getPrimitiveType())))
                            .append("\" ];\n");
                }
                sb.append("  ").append(node.getTitleCaseName()).append(" -> ").append(target)
                        .append(" [ label=\"").append(field.getName()).append(edgeStyle(field.getEdgeKind()))
                        .append(FONT).append("];\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Label suffix and arrow style of an edge kind, up to the font settings.
     */
    static String edgeStyle(EdgeKind kind) {
        if (kind == null) {
            return "\", arrowhead=normal, style=solid, ";
        }
        return switch (kind) {
            case ANY -> "*\", arrowhead=open, style=bold, ";
            case OPT_LINK -> "@?\", arrowhead=open, style=dashed, ";
            case MAYBE -> "?\", arrowhead=open, style=solid, ";
            case MANY -> "+\", arrowhead=normal, style=bold, ";
            case LINK -> "@\", arrowhead=normal, style=dashed, ";
            case ONE -> "\", arrowhead=normal, style=solid, ";
        };
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
