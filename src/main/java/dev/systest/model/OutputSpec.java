package dev.systest.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * How the value returned by a step procedure is folded into the context.
 */
public sealed interface OutputSpec {

    /** Leave the context untouched. */
    record None() implements OutputSpec {}

    /** Store the whole result under one key. */
    record Key(String key) implements OutputSpec {
        public Key {
            Objects.requireNonNull(key, "key");
        }
    }

    /** The result is a sequence; bind its elements positionally. */
    record Keys(List<String> keys) implements OutputSpec {
        public Keys {
            keys = List.copyOf(keys);
        }

        public boolean hasDuplicates() {
            return new HashSet<>(keys).size() != keys.size();
        }
    }

    /** Compute the complete next context. Keys the function drops are gone. */
    record Fn(BiFunction<Context, Object, Context> fn) implements OutputSpec {
        public Fn {
            Objects.requireNonNull(fn, "fn");
        }
    }

    OutputSpec NONE = new None();

    static OutputSpec none() {
        return NONE;
    }

    static OutputSpec key(String key) {
        return new Key(key);
    }

    static OutputSpec keys(String... keys) {
        return new Keys(List.of(keys));
    }

    static OutputSpec fn(BiFunction<Context, Object, Context> fn) {
        return new Fn(fn);
    }
}
