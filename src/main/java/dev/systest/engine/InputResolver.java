package dev.systest.engine;

import dev.systest.model.Context;
import dev.systest.model.InputSource;
import dev.systest.system.SystemUnderTest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the declared inputs of a step against the system and the current context.
 */
public final class InputResolver {

    private InputResolver() {}

    /**
     * Resolve every input in declaration order. The returned map may hold null values for unset context
     * keys and broken context paths.
     *
     * @throws MissingComponentException if a referenced component is absent
     */
    public static Map<String, Object> resolve(Map<String, InputSource> spec, Context context, SystemUnderTest system) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : spec.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), context, system));
        }
        return resolved;
    }

    public static Object resolve(InputSource source, Context context, SystemUnderTest system) {
        if (source instanceof InputSource.Literal literal) {
            return literal.value();
        } else if (source instanceof InputSource.ComponentRef ref) {
            return system.component(ref.key())
                .orElseThrow(() -> new MissingComponentException(ref.key()));
        } else if (source instanceof InputSource.ContextKey key) {
            return context.get(key.key());
        } else if (source instanceof InputSource.ContextPath path) {
            return context.getIn(path.path());
        } else if (source instanceof InputSource.ContextFn fn) {
            return fn.fn().apply(context);
        }
        throw new IllegalArgumentException("Unknown input source: " + source);
    }
}
