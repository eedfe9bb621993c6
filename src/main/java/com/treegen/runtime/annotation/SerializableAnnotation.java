package com.treegen.runtime.annotation;

import com.treegen.runtime.cbor.CborMapWriter;

/**
 * An annotation type that knows how to write itself. Register it with
 * {@link AnnotationSerdesRegistry#registerSerializable(Class, java.util.function.Function)}
 * together with a factory reading it back.
 */
public interface SerializableAnnotation {

    void serialize(CborMapWriter map);
}
