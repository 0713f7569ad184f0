package dev.systest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Values threaded through the steps of one test. Instances never change: every write returns a new context.
 * Null values are allowed and are distinct from an absent key only through {@link #containsKey(String)}.
 */
public final class Context {

    private static final Context EMPTY = new Context(Map.of());

    private final Map<String, Object> values;

    private Context(Map<String, Object> values) {
        this.values = values;
    }

    public static Context empty() {
        return EMPTY;
    }

    public static Context of(Map<String, ?> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Context(Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values)));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Walk nested maps starting at this context. Returns null as soon as a segment is missing
     * or an intermediate value is not a map.
     */
    public Object getIn(List<String> path) {
        if (path.isEmpty()) {
            return null;
        }
        Object current = values.get(path.get(0));
        for (String segment : path.subList(1, path.size())) {
            if (!(current instanceof Map<?, ?> nested)) {
                return null;
            }
            current = nested.get(segment);
        }
        return current;
    }

    public Context with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        var next = new LinkedHashMap<>(values);
        next.put(key, value);
        return new Context(Collections.unmodifiableMap(next));
    }

    public Context withAll(Map<String, ?> entries) {
        if (entries.isEmpty()) {
            return this;
        }
        var next = new LinkedHashMap<String, Object>(values);
        next.putAll(entries);
        return new Context(Collections.unmodifiableMap(next));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Context other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Context" + values;
    }
}
