package dev.systest.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Where a step input comes from. Resolved right before the step runs.
 */
public sealed interface InputSource {

    /** A fixed value, passed through as is. */
    record Literal(Object value) implements InputSource {}

    /** A named component of the system under test. Missing components are an error. */
    record ComponentRef(String key) implements InputSource {
        public ComponentRef {
            Objects.requireNonNull(key, "key");
        }
    }

    /** A single context key. Unset keys resolve to null. */
    record ContextKey(String key) implements InputSource {
        public ContextKey {
            Objects.requireNonNull(key, "key");
        }
    }

    /** A path through nested maps in the context. Broken paths resolve to null. */
    record ContextPath(List<String> path) implements InputSource {
        public ContextPath {
            path = List.copyOf(path);
            if (path.isEmpty()) {
                throw new IllegalArgumentException("Context path must not be empty");
            }
        }
    }

    /** Computed from the whole context. */
    record ContextFn(Function<Context, Object> fn) implements InputSource {
        public ContextFn {
            Objects.requireNonNull(fn, "fn");
        }
    }

    static InputSource literal(Object value) {
        return new Literal(value);
    }

    static InputSource component(String key) {
        return new ComponentRef(key);
    }

    static InputSource context(String key) {
        return new ContextKey(key);
    }

    static InputSource contextPath(String... path) {
        return new ContextPath(List.of(path));
    }

    static InputSource fromContext(Function<Context, Object> fn) {
        return new ContextFn(fn);
    }
}
