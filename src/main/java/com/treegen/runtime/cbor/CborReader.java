package com.treegen.runtime.cbor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.treegen.runtime.SchemaValidationException;

/**
 * Read access to one decoded CBOR data item.
 *
 * The {@code asXxx} accessors fail with a {@link SchemaValidationException}
 * when the item has a different type, since a type mismatch always means the
 * data does not match the expected schema.
 */
public class CborReader {

    private static final CBORMapper MAPPER = new CBORMapper();

    private final JsonNode node;

    CborReader(JsonNode node) {
        this.node = node;
    }

    /**
     * Decodes a complete CBOR item.
     *
     * @throws SchemaValidationException if the bytes are not valid CBOR
     */
    public static CborReader parse(byte[] data) {
        try {
            JsonNode root = MAPPER.readTree(data);
            if (root == null || root.isMissingNode()) {
                throw new SchemaValidationException("no CBOR data item found");
            }
            return new CborReader(root);
        } catch (IOException e) {
            throw new SchemaValidationException("invalid CBOR data: " + e.getMessage(), e);
        }
    }

    public boolean isNull() {
        return node.isNull();
    }

    public boolean isBool() {
        return node.isBoolean();
    }

    public boolean isInt() {
        return node.isIntegralNumber();
    }

    public boolean isFloat() {
        return node.isFloatingPointNumber();
    }

    public boolean isString() {
        return node.isTextual();
    }

    public boolean isBinary() {
        return node.isBinary();
    }

    public boolean isMap() {
        return node.isObject();
    }

    public boolean isArray() {
        return node.isArray();
    }

    public boolean asBool() {
        expect(isBool(), "boolean");
        return node.booleanValue();
    }

    public long asInt() {
        expect(isInt(), "integer");
        return node.longValue();
    }

    public double asFloat() {
        expect(isFloat() || isInt(), "float");
        return node.doubleValue();
    }

    public String asString() {
        expect(isString(), "string");
        return node.textValue();
    }

    public byte[] asBinary() {
        expect(isBinary(), "byte string");
        try {
            return node.binaryValue();
        } catch (IOException e) {
            throw new SchemaValidationException("unreadable byte string", e);
        }
    }

    public CborMapReader asMap() {
        expect(isMap(), "map");
        return new CborMapReader((ObjectNode) node);
    }

    public List<CborReader> asArray() {
        expect(isArray(), "array");
        List<CborReader> items = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            items.add(new CborReader(item));
        }
        return Collections.unmodifiableList(items);
    }

    private void expect(boolean matches, String expected) {
        if (!matches) {
            throw new SchemaValidationException(
                    "Schema validation failed: expected " + expected + " but found " + node.getNodeType());
        }
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
