package com.example.invoiceverify.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, insertion-ordered mapping from field name to {@link FieldValue} for one document.
 * Serialized as a plain JSON object so the persisted form is {@code {name: {value, confidence, present}}}.
 */
public final class FieldSet {

    private static final FieldSet EMPTY = new FieldSet(Map.of());

    private final Map<String, FieldValue> fields;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public FieldSet(Map<String, FieldValue> fields) {
        LinkedHashMap<String, FieldValue> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> copy.put(name, value == null ? FieldValue.absent() : value));
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    public static FieldSet empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, FieldValue> asMap() {
        return fields;
    }

    public Optional<FieldValue> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns a new set holding this set's entries overlaid with {@code other}; entries of {@code other} win.
     *
     * @param other values to merge on top
     * @return merged field set
     */
    public FieldSet withFields(Map<String, FieldValue> other) {
        LinkedHashMap<String, FieldValue> merged = new LinkedHashMap<>(fields);
        merged.putAll(other);
        return new FieldSet(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldSet that && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FieldSet" + fields;
    }
}
