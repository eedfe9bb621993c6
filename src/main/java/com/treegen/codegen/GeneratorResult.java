package com.treegen.codegen;

import java.nio.file.Path;
import java.util.List;

import com.treegen.codegen.model.output.GeneratedFile;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generator run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int nodeTypes;
    private int leafNodeTypes;
    private int filesGenerated;
    private int filesWritten;

    @Builder.Default
    private List<GeneratedFile> files = List.of();

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
