package com.treegen.runtime.annotation;

import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;

import lombok.NonNull;
import lombok.Value;

/**
 * Source file region a node was parsed from. Dumps of trees whose
 * specification names this type print it after the node's type.
 */
@Value
public class SourceLocation implements SerializableAnnotation {

    @NonNull
    String filename;
    int firstLine;
    int firstColumn;
    int lastLine;
    int lastColumn;

    /**
     * A location covering a single point.
     */
    public static SourceLocation at(String filename, int line, int column) {
        return new SourceLocation(filename, line, column, line, column);
    }

    /**
     * Registers the codec for this annotation type.
     */
    public static void register(AnnotationSerdesRegistry registry) {
        registry.registerSerializable(SourceLocation.class, SourceLocation::deserialize);
    }

    public static SourceLocation deserialize(CborMapReader map) {
        return new SourceLocation(
                map.at("filename").asString(),
                (int) map.at("first_line").asInt(),
                (int) map.at("first_column").asInt(),
                (int) map.at("last_line").asInt(),
                (int) map.at("last_column").asInt());
    }

    @Override
    public void serialize(CborMapWriter map) {
        map.appendString("filename", filename);
        map.appendInt("first_line", firstLine);
        map.appendInt("first_column", firstColumn);
        map.appendInt("last_line", lastLine);
        map.appendInt("last_column", lastColumn);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(filename).append(':').append(firstLine).append(':').append(firstColumn);
        if (lastLine != firstLine || lastColumn != firstColumn) {
            sb.append("..");
            if (lastLine != firstLine) {
                sb.append(lastLine).append(':');
            }
            sb.append(lastColumn);
        }
        return sb.toString();
    }
}
