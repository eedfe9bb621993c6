package com.treegen.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.codegen.backend.BackendKind;
import com.treegen.codegen.backend.CodeBackend;
import com.treegen.codegen.dot.DotGraphBackend;
import com.treegen.codegen.java.JavaBackend;
import com.treegen.codegen.model.output.GeneratedFile;
import com.treegen.codegen.util.FileWriteUtil;
import com.treegen.model.Specification;
import com.treegen.model.exception.SpecificationException;

/**
 * Main generator: builds a specification, runs the configured backends and
 * writes what they produce.
 */
public class TreeGenerator {
    private static final Logger log = LoggerFactory.getLogger(TreeGenerator.class);

    private final GeneratorConfig config;

    public TreeGenerator(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Generates code for the specification, building it first if needed.
     * Errors in the specification are reported through the result rather than
     * thrown.
     */
    public GeneratorResult generate(Specification spec) {
        try {
            log.info("Starting tree generation...");

            // Step 1: Resolve the specification
            if (!spec.isBuilt()) {
                log.info("Step 1: Building specification...");
                spec.build();
            }
            if (spec.getNodes().isEmpty()) {
                return GeneratorResult.failure("Specification declares no node types");
            }

            // Step 2: Run backends
            List<GeneratedFile> files = new ArrayList<>();
            int step = 2;
            for (BackendKind kind : config.getBackends()) {
                log.info("Step {}: Running {} backend...", step++, kind);
                files.addAll(createBackend(kind).generate(spec));
            }

            // Step 3: Write files
            int written = 0;
            if (config.isDryRun()) {
                log.info("Dry run, not writing {} files", files.size());
            } else {
                log.info("Step {}: Writing {} files to {}...", step, files.size(), config.getOutputDir());
                written = writeFiles(files);
            }

            log.info("Generation complete!");
            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputDir())
                    .nodeTypes(spec.getNodes().size())
                    .leafNodeTypes(spec.getLeafNodes().size())
                    .filesGenerated(files.size())
                    .filesWritten(written)
                    .files(List.copyOf(files))
                    .build();

        } catch (SpecificationException e) {
            log.error("Invalid specification: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private CodeBackend createBackend(BackendKind kind) {
        return switch (kind) {
            case JAVA -> new JavaBackend();
            case DOT -> new DotGraphBackend(config.getDotFileName());
        };
    }

    private int writeFiles(List<GeneratedFile> files) throws IOException {
        if (config.getOutputDir() == null) {
            throw new IllegalStateException("No output directory configured");
        }
        int written = 0;
        for (GeneratedFile file : files) {
            Path target = config.getOutputDir().resolve(file.getPath());
            if (config.isWriteIfChanged()) {
                if (FileWriteUtil.writeIfChanged(target, file.getContents())) {
                    written++;
                } else {
                    log.debug("Unchanged: {}", target);
                }
            } else {
                FileWriteUtil.safeWriteString(target, file.getContents());
                written++;
            }
        }
        return written;
    }
}
