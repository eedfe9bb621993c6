package com.treegen.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.treegen.codegen.backend.BackendKind;
import com.treegen.model.EdgeKind;
import com.treegen.model.NodeBuilder;
import com.treegen.model.SampleSpecifications;
import com.treegen.model.Specification;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process.
 */
class TreeGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void testGenerateDirectoryTree() throws IOException {
        GeneratorConfig config = GeneratorConfig.builder()
                .outputDir(tempDir)
                .backends(List.of(BackendKind.JAVA, BackendKind.DOT))
                .build();

        GeneratorResult result = new TreeGenerator(config).generate(SampleSpecifications.directoryTree());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrorMessage()).isNull();
        assertThat(result.getNodeTypes()).isEqualTo(8);
        assertThat(result.getLeafNodeTypes()).isEqualTo(7);
        assertThat(result.getFilesGenerated()).isEqualTo(14);
        assertThat(result.getFilesWritten()).isEqualTo(14);
        assertThat(result.getOutputPath()).isEqualTo(tempDir);

        Path packageDir = tempDir.resolve("com/treegen/runtime/fixture");
        assertThat(packageDir.resolve("Drive.java")).exists();
        assertThat(packageDir.resolve("Dumper.java")).exists();
        assertThat(Files.readString(tempDir.resolve("tree.dot"))).startsWith("digraph tree {");
    }

    @Test
    void testUnchangedFilesAreNotRewritten() {
        GeneratorConfig config = GeneratorConfig.builder().outputDir(tempDir).build();

        GeneratorResult first = new TreeGenerator(config).generate(SampleSpecifications.directoryTree());
        GeneratorResult second = new TreeGenerator(config).generate(SampleSpecifications.directoryTree());

        assertThat(first.getFilesWritten()).isEqualTo(13);
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getFilesWritten()).isZero();
    }

    @Test
    void testAlwaysWrite() {
        GeneratorConfig config = GeneratorConfig.builder().outputDir(tempDir).writeIfChanged(false).build();

        new TreeGenerator(config).generate(SampleSpecifications.directoryTree());
        GeneratorResult second = new TreeGenerator(config).generate(SampleSpecifications.directoryTree());

        assertThat(second.getFilesWritten()).isEqualTo(13);
    }

    @Test
    void testDryRunWritesNothing() throws IOException {
        GeneratorConfig config = GeneratorConfig.builder().outputDir(tempDir).dryRun(true).build();

        GeneratorResult result = new TreeGenerator(config).generate(SampleSpecifications.directoryTree());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFiles()).hasSize(13);
        assertThat(result.getFilesWritten()).isZero();
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void testInvalidSpecificationIsReported() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        spec.addNode(new NodeBuilder("directory").withChild(EdgeKind.ANY, "entry", "entries"));
        GeneratorConfig config = GeneratorConfig.builder().outputDir(tempDir).build();

        GeneratorResult result = new TreeGenerator(config).generate(spec);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("use of undefined node entry");
    }

    @Test
    void testEmptySpecification() {
        Specification spec = new Specification();
        spec.setTreePackage("com.example");
        spec.setInitializeFunction("com.example.Values.initialize");
        GeneratorConfig config = GeneratorConfig.builder().outputDir(tempDir).build();

        GeneratorResult result = new TreeGenerator(config).generate(spec);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("Specification declares no node types");
    }

    @Test
    void testMissingOutputDirectory() {
        GeneratorConfig config = GeneratorConfig.builder().build();

        GeneratorResult result = new TreeGenerator(config).generate(SampleSpecifications.directoryTree());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("No output directory configured");
    }
}
