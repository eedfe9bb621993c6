package com.treegen.codegen.backend;

import java.util.List;

import com.treegen.codegen.model.output.GeneratedFile;
import com.treegen.model.Specification;

/**
 * A code generation target. Backends read a built {@link Specification} and
 * return the files to write; they do not touch the file system.
 */
public interface CodeBackend {

    BackendKind getKind();

    /**
     * Generates all files for the specification.
     *
     * @throws IllegalStateException if the specification was not built
     */
    List<GeneratedFile> generate(Specification specification);
}
