package com.treegen.runtime.annotation;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;

/**
 * Maps annotation types to the codecs that (de)serialize them, and serialized
 * annotation names back to types.
 *
 * Annotations without a registered codec are left out when a tree is
 * serialized, and unknown names are skipped when one is deserialized, so
 * trees written by a program that knows more annotation types can still be
 * read.
 *
 * The registry is not thread-safe. Register codecs during program
 * initialization, before any tree is (de)serialized.
 */
public final class AnnotationSerdesRegistry {
    private static final Logger log = LoggerFactory.getLogger(AnnotationSerdesRegistry.class);

    private static final AnnotationSerdesRegistry GLOBAL = new AnnotationSerdesRegistry();

    private final Map<Class<?>, Registration<?>> byType = new HashMap<>();
    private final Map<String, Registration<?>> byName = new HashMap<>();

    /**
     * The process-wide registry used by generated trees.
     */
    public static AnnotationSerdesRegistry global() {
        return GLOBAL;
    }

    /**
     * Registers a codec under the type's fully qualified class name.
     */
    public <T> void register(Class<T> type, AnnotationCodec<T> codec) {
        register(type, type.getName(), codec);
    }

    /**
     * Registers a codec under an explicit name. The serialized key is the name
     * wrapped in braces.
     *
     * @throws IllegalStateException if the type or the name is already taken
     */
    public <T> void register(Class<T> type, String name, AnnotationCodec<T> codec) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(codec, "codec");
        if (byType.containsKey(type)) {
            throw new IllegalStateException("annotation type " + type.getName() + " is already registered");
        }
        if (byName.containsKey(name)) {
            throw new IllegalStateException("annotation name " + name + " is already registered");
        }
        Registration<T> registration = new Registration<>(type, name, codec);
        byType.put(type, registration);
        byName.put(name, registration);
        log.debug("Registered annotation codec {} for {}", name, type.getName());
    }

    /**
     * Registers a self-serializing annotation type.
     */
    public <T extends SerializableAnnotation> void registerSerializable(
            Class<T> type, Function<CborMapReader, T> deserializer) {
        register(type, new AnnotationCodec<T>() {
            @Override
            public void serialize(T value, CborMapWriter map) {
                value.serialize(map);
            }

            @Override
            public T deserialize(CborMapReader map) {
                return deserializer.apply(map);
            }
        });
    }

    public boolean isRegistered(Class<?> type) {
        return byType.containsKey(type);
    }

    /**
     * Removes the codec of a type, if any.
     */
    public void unregister(Class<?> type) {
        Registration<?> removed = byType.remove(type);
        if (removed != null) {
            byName.remove(removed.getName());
        }
    }

    @SuppressWarnings("unchecked")
    <T> Optional<Registration<T>> find(Class<T> type) {
        return Optional.ofNullable((Registration<T>) byType.get(type));
    }

    Optional<Registration<?>> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    static final class Registration<T> {
        private final Class<T> type;
        private final String name;
        private final AnnotationCodec<T> codec;

        private Registration(Class<T> type, String name, AnnotationCodec<T> codec) {
            this.type = type;
            this.name = name;
            this.codec = codec;
        }

        Class<T> getType() {
            return type;
        }

        String getName() {
            return name;
        }

        AnnotationCodec<T> getCodec() {
            return codec;
        }
    }
}
