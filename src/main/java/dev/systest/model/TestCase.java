package dev.systest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered composition of step instances sharing one context and one system.
 */
public record TestCase(
    String name,
    String title,
    String description, // nullable
    Set<String> tags,
    List<StepInstance> steps,
    SourceLocation location
) {
    public TestCase {
        Objects.requireNonNull(name, "name");
        title = title != null ? title : name;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        steps = steps == null ? List.of() : List.copyOf(steps);
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String title;
        private String description;
        private final Set<String> tags = new LinkedHashSet<>();
        private final List<StepInstance> steps = new ArrayList<>();

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

        public Builder tags(String... tags) {
            Collections.addAll(this.tags, tags);
            return this;
        }

        public Builder step(StepInstance step) {
            steps.add(step);
            return this;
        }

        public Builder step(Step step) {
            return step(step.use());
        }

        public TestCase build() {
            return new TestCase(name, title, description, tags, steps, SourceLocation.capture(Builder.class));
        }
    }
}
