package com.treegen.runtime.annotation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.treegen.runtime.cbor.CborMapReader;
import com.treegen.runtime.cbor.CborMapWriter;

/**
 * Side-table of out-of-band values attached to an object, at most one per
 * annotation type. Tree nodes carry one to hold things like source locations
 * without changing the tree's schema.
 */
public abstract class Annotatable {
    private static final Logger log = LoggerFactory.getLogger(Annotatable.class);

    private final Map<Class<?>, Object> annotations = new LinkedHashMap<>();

    /**
     * Attaches a value keyed by its runtime class, replacing any value of that
     * class.
     */
    public <T> void setAnnotation(T value) {
        annotations.put(value.getClass(), value);
    }

    /**
     * Attaches a value under an explicit annotation type, for values whose
     * runtime class is a subtype.
     */
    public <T> void setAnnotation(Class<T> type, T value) {
        annotations.put(type, type.cast(value));
    }

    /**
     * Returns the annotation of the given type.
     *
     * @throws NoSuchElementException if there is none
     */
    public <T> T getAnnotation(Class<T> type) {
        return findAnnotation(type)
                .orElseThrow(() -> new NoSuchElementException("object has no " + type.getName() + " annotation"));
    }

    /**
     * Returns the annotation of the given type, or empty if there is none.
     */
    public <T> Optional<T> findAnnotation(Class<T> type) {
        return Optional.ofNullable(annotations.get(type)).map(type::cast);
    }

    public boolean hasAnnotation(Class<?> type) {
        return annotations.containsKey(type);
    }

    /**
     * Removes the annotation of the given type.
     *
     * @return whether there was one
     */
    public boolean eraseAnnotation(Class<?> type) {
        return annotations.remove(type) != null;
    }

    public Set<Class<?>> getAnnotationTypes() {
        return Collections.unmodifiableSet(annotations.keySet());
    }

    /**
     * Copies all annotations of another object onto this one. The values
     * themselves are shared.
     */
    public void copyAnnotationsFrom(Annotatable other) {
        annotations.putAll(other.annotations);
    }

    /**
     * Writes every annotation that has a codec in the global registry as an
     * entry of the map, keyed {@code {name}}.
     */
    public void serializeAnnotations(CborMapWriter map) {
        serializeAnnotations(map, AnnotationSerdesRegistry.global());
    }

    public void serializeAnnotations(CborMapWriter map, AnnotationSerdesRegistry registry) {
        for (Map.Entry<Class<?>, Object> entry : annotations.entrySet()) {
            registry.find(entry.getKey()).ifPresent(registration -> write(registration, entry.getValue(), map));
        }
    }

    private static <T> void write(AnnotationSerdesRegistry.Registration<T> registration, Object value,
            CborMapWriter map) {
        CborMapWriter submap = map.appendMap("{" + registration.getName() + "}");
        registration.getCodec().serialize(registration.getType().cast(value), submap);
        submap.close();
    }

    /**
     * Restores the annotations found in a serialized node map. Entries whose
     * name has no codec in the global registry are skipped.
     */
    public void deserializeAnnotations(CborMapReader map) {
        deserializeAnnotations(map, AnnotationSerdesRegistry.global());
    }

    public void deserializeAnnotations(CborMapReader map, AnnotationSerdesRegistry registry) {
        for (String key : map.keys()) {
            if (key.length() < 2 || !key.startsWith("{") || !key.endsWith("}")) {
                continue;
            }
            String name = key.substring(1, key.length() - 1);
            Optional<AnnotationSerdesRegistry.Registration<?>> registration = registry.findByName(name);
            if (registration.isEmpty()) {
                log.warn("Skipping annotation {} without a registered codec", name);
                continue;
            }
            read(registration.get(), map.at(key).asMap());
        }
    }

    private <T> void read(AnnotationSerdesRegistry.Registration<T> registration, CborMapReader submap) {
        annotations.put(registration.getType(), registration.getCodec().deserialize(submap));
    }
}
