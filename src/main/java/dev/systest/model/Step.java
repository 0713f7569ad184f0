package dev.systest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A reusable, named unit of test logic with declared inputs and output.
 * Steps are templates; tests hold {@link StepInstance}s produced by {@link #use()} or {@link #bind}.
 */
public record Step(
    String name,
    String title,
    String description, // nullable
    Map<String, InputSource> inputs,
    StepProcedure procedure,
    OutputSpec output,
    SourceLocation location
) {
    public Step {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(procedure, "procedure");
        title = title != null ? title : name;
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        output = output != null ? output : OutputSpec.none();
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    /** Bind the step with its own defaults. */
    public StepInstance use() {
        return new StepInstance(this, inputs, output, title);
    }

    /**
     * Bind the step for use in a test.
     *
     * @param inputOverrides merged key by key over the declared inputs; may be null
     * @param outputOverride replaces the declared output when non-null
     * @param titleOverride  replaces the declared title when non-null
     */
    public StepInstance bind(Map<String, InputSource> inputOverrides, OutputSpec outputOverride, String titleOverride) {
        return use().bind(inputOverrides, outputOverride, titleOverride);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String title;
        private String description;
        private final Map<String, InputSource> inputs = new LinkedHashMap<>();
        private StepProcedure procedure;
        private OutputSpec output = OutputSpec.none();

        private Builder(String name) {
            this.name = name;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(String key, InputSource source) {
            inputs.put(key, source);
            return this;
        }

        public Builder procedure(StepProcedure procedure) {
            this.procedure = procedure;
            return this;
        }

        public Builder output(OutputSpec output) {
            this.output = output;
            return this;
        }

        public Step build() {
            return new Step(name, title, description, inputs, procedure, output,
                SourceLocation.capture(Builder.class));
        }
    }
}
