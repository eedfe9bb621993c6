package com.treegen.runtime.cbor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;

/**
 * Writes a single CBOR data item into memory.
 *
 * <pre>
 * CborWriter writer = new CborWriter();
 * CborMapWriter map = writer.startMap();
 * map.appendString("name", "root");
 * map.close();
 * byte[] bytes = writer.toByteArray();
 * </pre>
 */
public class CborWriter {

    private static final CBORFactory FACTORY = new CBORFactory();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final CBORGenerator generator;
    private boolean started;

    public CborWriter() {
        try {
            this.generator = FACTORY.createGenerator(out);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create CBOR generator", e);
        }
    }

    /**
     * Starts the top-level map. Only one top-level item may be written.
     */
    public CborMapWriter startMap() {
        checkNotStarted();
        CborIo.write(generator::writeStartObject);
        return new CborMapWriter(generator);
    }

    public CborArrayWriter startArray() {
        checkNotStarted();
        CborIo.write(generator::writeStartArray);
        return new CborArrayWriter(generator);
    }

    /**
     * Returns the encoded bytes. The top-level item must have been closed.
     */
    public byte[] toByteArray() {
        CborIo.write(generator::flush);
        return out.toByteArray();
    }

    private void checkNotStarted() {
        if (started) {
            throw new IllegalStateException("top-level CBOR item already written");
        }
        started = true;
    }
}
