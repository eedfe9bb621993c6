package com.treegen.codegen;

import java.nio.file.Path;
import java.util.List;

import com.treegen.codegen.backend.BackendKind;
import com.treegen.codegen.dot.DotGraphBackend;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the tree generator.
 */
@Data
@Builder
public class GeneratorConfig {

    /** Directory the generated files are written below. */
    private Path outputDir;

    /** Generate in memory only, writing nothing. */
    private boolean dryRun;

    /** Only write files whose contents changed. */
    @Builder.Default
    private boolean writeIfChanged = true;

    @Builder.Default
    private List<BackendKind> backends = List.of(BackendKind.JAVA);

    /** File name of the Graphviz diagram, relative to the output directory. */
    @Builder.Default
    private String dotFileName = DotGraphBackend.DEFAULT_FILE_NAME;
}
