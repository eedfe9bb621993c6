package com.treegen.codegen.dot;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.treegen.codegen.model.output.GeneratedFile;
import com.treegen.codegen.model.output.GeneratedFileType;
import com.treegen.model.EdgeKind;
import com.treegen.model.SampleSpecifications;
import com.treegen.model.Specification;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the Graphviz class diagram.
 */
class DotGraphBackendTest {

    @Test
    void testDiagramOfDirectoryTree() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        String dot = new DotGraphBackend().render(spec);

        assertThat(dot)
                .startsWith("digraph tree {\n")
                .endsWith("}\n")
                .contains("  label=\"Example tree describing the file systems of a machine.\";\n")
                .contains("  Entry [ label=\"Entry\", style=dotted];\n")
                .contains("  File [ label=\"File\"];\n")
                .contains("  Entry -> Mount [ arrowhead=open, style=dotted ];\n")
                .contains("  Machine -> Drive [ label=\"drives+\", arrowhead=normal, style=bold, ")
                .contains("  Directory -> Entry [ label=\"entries*\", arrowhead=open, style=bold, ")
                .contains("  Mount -> Directory [ label=\"target@\", arrowhead=normal, style=dashed, ")
                .contains("  Shortcut -> Entry [ label=\"target@?\", arrowhead=open, style=dashed, ")
                .contains("  prim0 [ label=\"Character\" ];\n")
                .contains("  Drive -> prim0 [ label=\"letter\", arrowhead=normal, style=solid, ");
    }

    @Test
    void testGeneratedFile() {
        Specification spec = SampleSpecifications.expressionTree();

        List<GeneratedFile> files = new DotGraphBackend("docs/expr.dot").generate(spec);

        assertThat(files).hasSize(1);
        assertThat(files.get(0).getPath()).isEqualTo(Path.of("docs/expr.dot"));
        assertThat(files.get(0).getType()).isEqualTo(GeneratedFileType.DIAGRAM);
        assertThat(files.get(0).getContents()).contains("  Expression -> Literal [ arrowhead=open, style=dotted ];\n");
    }

    @Test
    void testEdgeStyles() {
        assertThat(DotGraphBackend.edgeStyle(EdgeKind.ONE)).isEqualTo("\", arrowhead=normal, style=solid, ");
        assertThat(DotGraphBackend.edgeStyle(EdgeKind.MAYBE)).isEqualTo("?\", arrowhead=open, style=solid, ");
        assertThat(DotGraphBackend.edgeStyle(EdgeKind.ANY)).isEqualTo("*\", arrowhead=open, style=bold, ");
        assertThat(DotGraphBackend.edgeStyle(EdgeKind.MANY)).isEqualTo("+\", arrowhead=normal, style=bold, ");
        assertThat(DotGraphBackend.edgeStyle(EdgeKind.LINK)).isEqualTo("@\", arrowhead=normal, style=dashed, ");
        assertThat(DotGraphBackend.edgeStyle(EdgeKind.OPT_LINK)).isEqualTo("@?\", arrowhead=open, style=dashed, ");
        assertThat(DotGraphBackend.edgeStyle(null)).isEqualTo("\", arrowhead=normal, style=solid, ");
    }
}
