package com.treegen.runtime.cbor;

import java.io.IOException;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;

/**
 * Appends key/value pairs to an open CBOR map. Keys are always text strings.
 * Nested writers returned by {@link #appendMap(String)} and
 * {@link #appendArray(String)} must be closed before appending to this map
 * again.
 */
public class CborMapWriter {

    private final CBORGenerator generator;
    private boolean closed;

    CborMapWriter(CBORGenerator generator) {
        this.generator = generator;
    }

    public void appendNull(String key) {
        CborIo.write(() -> {
            field(key);
            generator.writeNull();
        });
    }

    public void appendBool(String key, boolean value) {
        CborIo.write(() -> {
            field(key);
            generator.writeBoolean(value);
        });
    }

    public void appendInt(String key, long value) {
        CborIo.write(() -> {
            field(key);
            generator.writeNumber(value);
        });
    }

    public void appendFloat(String key, double value) {
        CborIo.write(() -> {
            field(key);
            generator.writeNumber(value);
        });
    }

    public void appendString(String key, String value) {
        CborIo.write(() -> {
            field(key);
            generator.writeString(value);
        });
    }

    public void appendBinary(String key, byte[] value) {
        CborIo.write(() -> {
            field(key);
            generator.writeBinary(value);
        });
    }

    public CborMapWriter appendMap(String key) {
        CborIo.write(() -> {
            field(key);
            generator.writeStartObject();
        });
        return new CborMapWriter(generator);
    }

    public CborArrayWriter appendArray(String key) {
        CborIo.write(() -> {
            field(key);
            generator.writeStartArray();
        });
        return new CborArrayWriter(generator);
    }

    /**
     * Ends the map. Closing twice is an error.
     */
    public void close() {
        if (closed) {
            throw new IllegalStateException("CBOR map already closed");
        }
        closed = true;
        CborIo.write(generator::writeEndObject);
    }

    private void field(String key) throws IOException {
        if (closed) {
            throw new IllegalStateException("CBOR map already closed");
        }
        generator.writeFieldName(key);
    }
}
