package com.treegen.runtime.annotation;

import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;

/**
 * Serializes and deserializes annotations of one type. The value is written
 * into, and read back from, a map of its own.
 */
public interface AnnotationCodec<T> {

    void serialize(T value, CborMapWriter map);

    T deserialize(CborMapReader map);
}
