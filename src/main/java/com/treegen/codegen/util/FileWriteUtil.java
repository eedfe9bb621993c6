package com.treegen.codegen.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes content only when the file does not exist or differs, so build
     * tools watching the output do not see spurious changes.
     *
     * @return whether the file was written
     */
    public static boolean writeIfChanged(Path filePath, String content) throws IOException {
        if (Files.exists(filePath) && Files.readString(filePath).equals(content)) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }
}
