package dev.systest.engine;

import dev.systest.model.Context;
import dev.systest.model.OutputSpec;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Folds a step result into the context according to the step's output spec.
 */
public final class OutputRegistrar {

    private OutputRegistrar() {}

    /**
     * @return the context the next step sees
     * @throws OutputBindingException if the result does not fit the spec
     */
    public static Context register(OutputSpec spec, Context context, Object result) {
        if (spec instanceof OutputSpec.None) {
            return context;
        } else if (spec instanceof OutputSpec.Key key) {
            return context.with(key.key(), result);
        } else if (spec instanceof OutputSpec.Keys keys) {
            return bindPositionally(keys, context, result);
        } else if (spec instanceof OutputSpec.Fn fn) {
            Context next = fn.fn().apply(context, result);
            if (next == null) {
                throw new OutputBindingException("Output function returned no context");
            }
            return next;
        }
        throw new IllegalArgumentException("Unknown output spec: " + spec);
    }

    private static Context bindPositionally(OutputSpec.Keys keys, Context context, Object result) {
        List<?> values = asList(result);
        if (values == null) {
            throw new OutputBindingException("Output keys %s need a sequence result, got %s"
                .formatted(keys.keys(), result == null ? "null" : result.getClass().getName()));
        }
        if (values.size() != keys.keys().size()) {
            throw new OutputBindingException("Output keys %s need %d values, got %d"
                .formatted(keys.keys(), keys.keys().size(), values.size()));
        }
        var bound = new LinkedHashMap<String, Object>();
        for (int i = 0; i < values.size(); i++) {
            bound.put(keys.keys().get(i), values.get(i));
        }
        return context.withAll(bound);
    }

    private static List<?> asList(Object result) {
        if (result instanceof List<?> list) {
            return list;
        }
        if (result != null && result.getClass().isArray()) {
            int length = Array.getLength(result);
            var list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(result, i));
            }
            return list;
        }
        return null;
    }
}
