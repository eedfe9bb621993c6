package com.treegen.runtime.cbor;

import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;

/**
 * Appends items to an open CBOR array.
 */
public class CborArrayWriter {

    private final CBORGenerator generator;
    private boolean closed;

    CborArrayWriter(CBORGenerator generator) {
        this.generator = generator;
    }

    public void appendNull() {
        checkOpen();
        CborIo.write(generator::writeNull);
    }

    public void appendBool(boolean value) {
        checkOpen();
        CborIo.write(() -> generator.writeBoolean(value));
    }

    public void appendInt(long value) {
        checkOpen();
        CborIo.write(() -> generator.writeNumber(value));
    }

    public void appendFloat(double value) {
        checkOpen();
        CborIo.write(() -> generator.writeNumber(value));
    }

    public void appendString(String value) {
        checkOpen();
        CborIo.write(() -> generator.writeString(value));
    }

    public void appendBinary(byte[] value) {
        checkOpen();
        CborIo.write(() -> generator.writeBinary(value));
    }

    public CborMapWriter appendMap() {
        checkOpen();
        CborIo.write(generator::writeStartObject);
        return new CborMapWriter(generator);
    }

    public CborArrayWriter appendArray() {
        checkOpen();
        CborIo.write(generator::writeStartArray);
        return new CborArrayWriter(generator);
    }

    public void close() {
        checkOpen();
        closed = true;
        CborIo.write(generator::writeEndArray);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("CBOR array already closed");
        }
    }
}
