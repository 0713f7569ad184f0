package dev.systest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A step bound for one position in a test, with the effective inputs, output and title.
 */
public record StepInstance(
    Step step,
    Map<String, InputSource> inputs,
    OutputSpec output,
    String title
) {
    public StepInstance {
        Objects.requireNonNull(step, "step");
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(title, "title");
    }

    public String name() {
        return step.name();
    }

    /**
     * Returns a new instance with the overrides applied. Input overrides win key by key; a non-null output
     * or title replaces the current one.
     */
    public StepInstance bind(Map<String, InputSource> inputOverrides, OutputSpec outputOverride, String titleOverride) {
        var merged = new LinkedHashMap<>(inputs);
        if (inputOverrides != null) {
            merged.putAll(inputOverrides);
        }
        return new StepInstance(
            step,
            merged,
            outputOverride != null ? outputOverride : output,
            titleOverride != null ? titleOverride : title);
    }

    public StepInstance withInput(String key, InputSource source) {
        return bind(Map.of(key, source), null, null);
    }

    public StepInstance withOutput(OutputSpec output) {
        return bind(null, output, null);
    }

    public StepInstance withTitle(String title) {
        return bind(null, null, title);
    }
}
