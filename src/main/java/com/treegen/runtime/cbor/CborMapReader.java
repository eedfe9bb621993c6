package com.treegen.runtime.cbor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.treegen.runtime.SchemaValidationException;

/**
 * Key-based access to a decoded CBOR map with text keys.
 */
public class CborMapReader {

    private final ObjectNode node;

    CborMapReader(ObjectNode node) {
        this.node = node;
    }

    /**
     * Returns the value stored under the key.
     *
     * @throws SchemaValidationException if the key is absent
     */
    public CborReader at(String key) {
        JsonNode value = node.get(key);
        if (value == null) {
            throw new SchemaValidationException("Schema validation failed: missing key " + key);
        }
        return new CborReader(value);
    }

    public Optional<CborReader> find(String key) {
        JsonNode value = node.get(key);
        return value == null ? Optional.empty() : Optional.of(new CborReader(value));
    }

    public boolean has(String key) {
        return node.has(key);
    }

    /**
     * Keys in encounter order.
     */
    public List<String> keys() {
        List<String> keys = new ArrayList<>(node.size());
        Iterator<String> names = node.fieldNames();
        names.forEachRemaining(keys::add);
        return keys;
    }

    public int size() {
        return node.size();
    }

    /**
     * Reads the string under {@code key} and checks it against the expected
     * value, typically a type tag.
     *
     * @throws SchemaValidationException on a mismatch
     */
    public void expectString(String key, String expected) {
        String found = at(key).asString();
        if (!expected.equals(found)) {
            throw new SchemaValidationException("Schema validation failed: unexpected value for "
                    + key + ": expected " + expected + " but found " + found);
        }
    }
}
