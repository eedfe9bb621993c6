package com.treegen.codegen.java;

import lombok.Builder;
import lombok.Value;

/**
 * Leading part of a generated Java file.
 */
@Value
@Builder
public class FileHeaderView {
    /** File comment including the trailing newline, possibly empty. */
    String comment;
    String packageName;
    /** Import statements, one per line, possibly empty. */
    String imports;
}
