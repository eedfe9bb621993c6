package com.treegen.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.treegen.model.exception.ConfigurationException;
import com.treegen.model.exception.DuplicateDefinitionException;
import com.treegen.model.exception.UnresolvedReferenceException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for building and resolving specifications.
 */
class SpecificationTest {

    @Test
    void testBuildResolvesNodeReferences() {
        Specification spec = SampleSpecifications.directoryTree();

        spec.build();

        assertThat(spec.isBuilt()).isTrue();
        NodeType drive = spec.findNode("drive").orElseThrow();
        Field rootDir = drive.getFields().get(1);
        assertThat(rootDir.isResolved()).isTrue();
        assertThat(rootDir.getNodeType()).isSameAs(spec.findNode("directory").orElseThrow());
        assertThat(rootDir.getTypeName()).isEqualTo("Directory");
    }

    @Test
    void testNodesKeepDeclarationOrder() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        assertThat(spec.getNodes()).extracting(NodeType::getTitleCaseName)
                .containsExactly("Machine", "Drive", "Entry", "Directory", "File", "Mount", "Shortcut", "ErrorEntry");
        assertThat(spec.getLeafNodes()).extracting(NodeType::getTitleCaseName)
                .containsExactly("Machine", "Drive", "Directory", "File", "Mount", "Shortcut", "ErrorEntry");
    }

    @Test
    void testAncestorsComeFirst() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        NodeBuilder base = new NodeBuilder("base");
        NodeBuilder middle = new NodeBuilder("middle").deriveFrom(base);
        NodeBuilder leaf = new NodeBuilder("leaf").deriveFrom(middle);
        spec.addNode(leaf);
        spec.addNode(middle);
        spec.addNode(base);
        spec.build();

        assertThat(spec.getNodesAncestorsFirst()).extracting(NodeType::getSnakeCaseName)
                .containsExactly("base", "middle", "leaf");
    }

    @Test
    void testDuplicateNodeName() {
        Specification spec = new Specification();
        spec.addNode(new NodeBuilder("file"));

        assertThatThrownBy(() -> spec.addNode(new NodeBuilder("file")))
                .isInstanceOf(DuplicateDefinitionException.class)
                .hasMessage("duplicate node name file");
    }

    @Test
    void testUndefinedNodeReference() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        spec.addNode(new NodeBuilder("directory").withChild(EdgeKind.ANY, "entry", "entries"));

        assertThatThrownBy(spec::build)
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessageContaining("use of undefined node entry")
                .extracting(e -> ((UnresolvedReferenceException) e).getReference())
                .isEqualTo("entry");
        assertThat(spec.isBuilt()).isFalse();
    }

    @Test
    void testUndeclaredParent() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        spec.addNode(new NodeBuilder("file").deriveFrom(new NodeBuilder("entry")));

        assertThatThrownBy(spec::build).isInstanceOf(UnresolvedReferenceException.class);
    }

    @Test
    void testFailedBuildResolvesNothing() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        NodeBuilder file = new NodeBuilder("file");
        NodeBuilder directory = new NodeBuilder("directory")
                .withChild(EdgeKind.ANY, "file", "files")
                .withChild(EdgeKind.ONE, "missing", "broken");
        spec.addNode(file);
        spec.addNode(directory);

        assertThatThrownBy(spec::build).isInstanceOf(UnresolvedReferenceException.class);
        assertThat(directory.getNode().getFields().get(0).isResolved()).isFalse();
        assertThat(spec.getNodes()).isEmpty();
    }

    @Test
    void testMissingInitializeFunction() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");

        assertThatThrownBy(spec::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("initialization function not specified");
    }

    @Test
    void testMissingTreePackage() {
        Specification spec = new Specification();
        spec.setInitializeFunction("com.example.Values.initialize");

        assertThatThrownBy(spec::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("tree namespace not specified");
    }

    @Test
    void testSettingsCanOnlyBeSetOnce() {
        Specification spec = SampleSpecifications.directoryTree();

        assertThatThrownBy(() -> spec.setTreePackage("com.other"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("duplicate tree namespace declaration");
        assertThatThrownBy(() -> spec.setInitializeFunction("com.other.Values.initialize"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> spec.setSerdesFunctions("a.B.ser", "a.B.des"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> spec.setSourceLocation("a.Loc"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testSupportPackageDefault() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        assertThat(spec.getSupportPackage()).isEqualTo(Specification.DEFAULT_SUPPORT_PACKAGE);
        assertThat(spec.hasSerdes()).isTrue();
        assertThat(spec.getSerializeFunction()).hasValue("com.treegen.runtime.fixture.Primitives.serialize");
    }

    @Test
    void testBuiltSpecificationIsFrozen() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.build();

        assertThatThrownBy(() -> spec.addNode(new NodeBuilder("late"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> spec.addImport("java.util.List")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(spec::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testDuplicateInheritedFieldName() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        NodeBuilder entry = new NodeBuilder("entry").withPrimitive("String", "name", "");
        spec.addNode(entry);
        spec.addNode(new NodeBuilder("file").deriveFrom(entry).withPrimitive("String", "name", ""));

        assertThatThrownBy(spec::build)
                .isInstanceOf(DuplicateDefinitionException.class)
                .hasMessage("duplicate field File.name");
    }

    @Test
    void testUnknownOrderedField() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        spec.addNode(new NodeBuilder("file").withPrimitive("String", "name", "").withOrder("size"));

        assertThatThrownBy(spec::build)
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessage("Unknown field in field order of File: size");
    }

    @Test
    void testImports() {
        Specification spec = SampleSpecifications.directoryTree();
        spec.addImport("java.util.List");

        assertThat(spec.getImports()).isEqualTo(List.of("java.util.List"));
    }
}
