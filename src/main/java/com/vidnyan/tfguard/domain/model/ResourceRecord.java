package com.vidnyan.tfguard.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single {@code resource "type" "name" { ... }} block.
 * Immutable value object.
 *
 * <p>Property values are one of Boolean, Long, Double, String, List or a nested
 * Map for sub-blocks (a List of Maps when the sub-block repeats). Typed getters
 * never coerce: a value of another type reads as absent.
 */
public record ResourceRecord(
    String type,
    String name,
    Map<String, Object> properties,
    String rawText,
    int startLine,
    int endLine
) {

    public ResourceRecord {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Terraform address, {@code type.name}.
     */
    public String fullName() {
        return type + "." + name;
    }

    /**
     * Resolve a dotted path through nested blocks. A repeated block resolves
     * through its first occurrence.
     */
    public Optional<Object> property(String path) {
        Object current = properties;
        for (String segment : path.split("\\.")) {
            if (current instanceof List<?> list && !list.isEmpty()) {
                current = list.get(0);
            }
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public <T> Optional<T> property(String path, Class<T> type) {
        return property(path).filter(type::isInstance).map(type::cast);
    }

    public Optional<String> getString(String path) {
        return property(path, String.class);
    }

    public Optional<Boolean> getBoolean(String path) {
        return property(path, Boolean.class);
    }

    public Optional<Number> getNumber(String path) {
        return property(path, Number.class);
    }

    public boolean hasProperty(String path) {
        return property(path).isPresent();
    }

    /**
     * True only when the property is literally {@code true}.
     */
    public boolean isTrue(String path) {
        return getBoolean(path).orElse(false);
    }
}
