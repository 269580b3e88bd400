package io.databrain.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open key/value metadata attached to nodes and links.
 *
 * <p>Values are whatever JSON can carry: strings, numbers, booleans, lists and nested maps.
 * The map is read schema-on-read: typed accessors return {@link Optional#empty()} when a key
 * is absent <em>or</em> holds a value of a different shape, and never throw.</p>
 *
 * <p>Keys written by the engine itself:</p>
 * <ul>
 *   <li>{@code decay_reason} (string): reason given to the last explicit DECAY_NODE</li>
 *   <li>{@code merged_from} (list of node ids): nodes merged into this one</li>
 * </ul>
 */
public final class Metadata {

    public static final String DECAY_REASON = "decay_reason";
    public static final String MERGED_FROM = "merged_from";

    private static final Metadata EMPTY = new Metadata(Map.of());

    private final Map<String, Object> values;

    private Metadata(Map<String, Object> values) {
        this.values = values;
    }

    public static Metadata empty() {
        return EMPTY;
    }

    @JsonCreator
    public static Metadata of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> getString(String key) {
        Object v = values.get(key);
        return v instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<Double> getDouble(String key) {
        Object v = values.get(key);
        if (v instanceof Number n) return Optional.of(n.doubleValue());
        if (v instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Boolean> getBoolean(String key) {
        Object v = values.get(key);
        return v instanceof Boolean b ? Optional.of(b) : Optional.empty();
    }

    /**
     * Returns a copy with {@code key} set. A null value removes the key.
     */
    public Metadata with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return of(copy);
    }

    /**
     * Returns a copy with every entry of {@code other} laid over this one.
     */
    public Metadata merge(Metadata other) {
        if (other == null || other.isEmpty()) return this;
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return of(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Metadata other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
