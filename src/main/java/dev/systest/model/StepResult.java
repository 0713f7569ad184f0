package dev.systest.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one executed step.
 */
public record StepResult(
    String stepName,
    String title,
    Outcome outcome,
    List<AssertionEvent> assertions,
    Map<String, Object> inputs,
    Object value,     // nullable: what the procedure returned
    ErrorInfo error,  // nullable: set when outcome is ERROR
    Duration elapsed
) {
    public StepResult {
        assertions = List.copyOf(assertions);
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public long failedAssertions() {
        return assertions.stream().filter(a -> !a.passed()).count();
    }
}
