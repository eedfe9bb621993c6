package com.treegen.runtime.cbor;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Rethrows the generator's checked I/O failures unchecked. Writing goes to
 * memory, so these only surface on codec bugs.
 */
final class CborIo {

    private CborIo() {
        // Utility class
    }

    @FunctionalInterface
    interface IoAction {
        void run() throws IOException;
    }

    static void write(IoAction action) {
        try {
            action.run();
        } catch (IOException e) {
            throw new UncheckedIOException("CBOR write failed", e);
        }
    }
}
