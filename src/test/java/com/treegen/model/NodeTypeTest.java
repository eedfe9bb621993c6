package com.treegen.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for node type hierarchy queries.
 */
class NodeTypeTest {

    @Test
    void testTitleCaseName() {
        assertThat(new NodeBuilder("error_entry").getNode().getTitleCaseName()).isEqualTo("ErrorEntry");
        assertThat(new NodeBuilder("file").getNode().getTitleCaseName()).isEqualTo("File");
    }

    @Test
    void testAllFieldsStartWithAncestors() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        NodeType directory = spec.findNode("directory").orElseThrow();
        assertThat(directory.getAllFields()).extracting(Field::getName).containsExactly("name", "entries");
        assertThat(directory.getAncestors()).extracting(NodeType::getSnakeCaseName).containsExactly("entry");
    }

    @Test
    void testFieldOrderOverride() {
        Specification spec = SampleSpecifications.expressionTree();

        NodeType binary = spec.findNode("binary").orElseThrow();
        assertThat(binary.getAllFields()).extracting(Field::getName).containsExactly("operator", "lhs", "rhs");
        assertThat(binary.getFields()).extracting(Field::getName).containsExactly("lhs", "rhs", "operator");
    }

    @Test
    void testLeafDescendants() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        NodeType entry = spec.findNode("entry").orElseThrow();
        assertThat(entry.isAbstract()).isTrue();
        assertThat(entry.getLeafDescendants()).extracting(NodeType::getTitleCaseName)
                .containsExactly("Directory", "File", "Mount", "Shortcut", "ErrorEntry");
        assertThat(entry.isSameOrAncestorOf(spec.findNode("mount").orElseThrow())).isTrue();
        assertThat(entry.isSameOrAncestorOf(spec.findNode("drive").orElseThrow())).isFalse();
    }

    @Test
    void testErrorMarker() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        assertThat(spec.findNode("error_entry").orElseThrow().isErrorMarker()).isTrue();
        assertThat(spec.findNode("file").orElseThrow().isErrorMarker()).isFalse();
    }

    @Test
    void testDeriveTwice() {
        NodeBuilder a = new NodeBuilder("a");
        NodeBuilder b = new NodeBuilder("b");
        NodeBuilder c = new NodeBuilder("c").deriveFrom(a);

        assertThatThrownBy(() -> c.deriveFrom(b)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBlankNameIsRejected() {
        assertThatThrownBy(() -> new NodeBuilder(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFieldKinds() {
        Field plain = Field.primitive("String", "name", "", null);
        Field external = Field.primitive("org.other.Expr", "exprs", "", EdgeKind.MANY);
        Field link = Field.child(EdgeKind.LINK, "directory", "target", "");

        assertThat(plain.isPlainPrimitive()).isTrue();
        assertThat(plain.getExtKind()).isEmpty();
        assertThat(external.isPlainPrimitive()).isFalse();
        assertThat(external.isOwning()).isTrue();
        assertThat(link.isLink()).isTrue();
        assertThat(link.isResolved()).isFalse();
        assertThat(link.getTypeName()).isEqualTo("directory");
    }
}
