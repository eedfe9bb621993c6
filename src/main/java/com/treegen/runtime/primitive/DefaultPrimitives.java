package com.treegen.runtime.primitive;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.treegen.runtime.SchemaValidationException;
import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;
import com.treegen.runtime.cbor.CborReader;

/**
 * Primitive hooks for the usual Java value types, usable as the initialize,
 * serialize and deserialize functions of a specification.
 *
 * Values are serialized into their own map under the key {@code val}.
 * Specifications with other primitive types provide their own hooks and may
 * delegate to these.
 */
public final class DefaultPrimitives {

    static final String VALUE_KEY = "val";

    private DefaultPrimitives() {
        // Utility class
    }

    /**
     * Returns the default value of a primitive field of the given type.
     *
     * @throws IllegalArgumentException for unsupported types
     */
    public static <T> T initialize(Class<T> type) {
        Object value;
        if (type == String.class) {
            value = "";
        } else if (type == Boolean.class) {
            value = Boolean.FALSE;
        } else if (type == Character.class) {
            value = '\0';
        } else if (type == Byte.class) {
            value = (byte) 0;
        } else if (type == Short.class) {
            value = (short) 0;
        } else if (type == Integer.class) {
            value = 0;
        } else if (type == Long.class) {
            value = 0L;
        } else if (type == Float.class) {
            value = 0.0f;
        } else if (type == Double.class) {
            value = 0.0d;
        } else if (type == BigInteger.class) {
            value = BigInteger.ZERO;
        } else if (type == BigDecimal.class) {
            value = BigDecimal.ZERO;
        } else if (type == byte[].class) {
            value = new byte[0];
        } else {
            throw new IllegalArgumentException("no default value for primitive type " + type.getName());
        }
        return type.cast(value);
    }

    /**
     * Writes a primitive value into the given map.
     */
    public static <T> void serialize(Class<T> type, T value, CborMapWriter map) {
        if (value == null) {
            map.appendNull(VALUE_KEY);
        } else if (value instanceof String) {
            map.appendString(VALUE_KEY, (String) value);
        } else if (value instanceof Boolean) {
            map.appendBool(VALUE_KEY, (Boolean) value);
        } else if (value instanceof Character) {
            map.appendInt(VALUE_KEY, (Character) value);
        } else if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long) {
            map.appendInt(VALUE_KEY, ((Number) value).longValue());
        } else if (value instanceof Float || value instanceof Double) {
            map.appendFloat(VALUE_KEY, ((Number) value).doubleValue());
        } else if (value instanceof BigInteger || value instanceof BigDecimal) {
            map.appendString(VALUE_KEY, value.toString());
        } else if (value instanceof byte[]) {
            map.appendBinary(VALUE_KEY, (byte[]) value);
        } else {
            throw new IllegalArgumentException("cannot serialize primitive type " + type.getName());
        }
    }

    /**
     * Reads a primitive value from the given map.
     *
     * @throws SchemaValidationException if the stored value has the wrong type
     *         or does not fit the requested type
     */
    public static <T> T deserialize(Class<T> type, CborMapReader map) {
        CborReader value = map.at(VALUE_KEY);
        if (value.isNull()) {
            return null;
        }
        Object result;
        if (type == String.class) {
            result = value.asString();
        } else if (type == Boolean.class) {
            result = value.asBool();
        } else if (type == Character.class) {
            result = (char) inRange(value.asInt(), Character.MIN_VALUE, Character.MAX_VALUE, type);
        } else if (type == Byte.class) {
            result = (byte) inRange(value.asInt(), Byte.MIN_VALUE, Byte.MAX_VALUE, type);
        } else if (type == Short.class) {
            result = (short) inRange(value.asInt(), Short.MIN_VALUE, Short.MAX_VALUE, type);
        } else if (type == Integer.class) {
            result = (int) inRange(value.asInt(), Integer.MIN_VALUE, Integer.MAX_VALUE, type);
        } else if (type == Long.class) {
            result = value.asInt();
        } else if (type == Float.class) {
            result = (float) value.asFloat();
        } else if (type == Double.class) {
            result = value.asFloat();
        } else if (type == BigInteger.class || type == BigDecimal.class) {
            result = parseNumber(value.asString(), type);
        } else if (type == byte[].class) {
            result = value.asBinary();
        } else {
            throw new IllegalArgumentException("cannot deserialize primitive type " + type.getName());
        }
        return type.cast(result);
    }

    private static long inRange(long value, long min, long max, Class<?> type) {
        if (value < min || value > max) {
            throw new SchemaValidationException(
                    "Schema validation failed: value " + value + " out of range for " + type.getSimpleName());
        }
        return value;
    }

    private static Object parseNumber(String text, Class<?> type) {
        try {
            return type == BigInteger.class ? new BigInteger(text) : new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new SchemaValidationException(
                    "Schema validation failed: '" + text + "' is not a valid " + type.getSimpleName(), e);
        }
    }
}
