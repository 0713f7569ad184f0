package dev.systest.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one test, with its step results, cleanup results and the final context.
 */
public record TestResult(
    String testName,
    String title,
    Outcome outcome,
    List<StepResult> steps,
    List<CleanupResult> cleanups,
    Map<String, Object> context,
    Instant startedAt,
    Instant finishedAt,
    ErrorInfo lifecycleError, // nullable: the system could not be built or started
    ErrorInfo stopError       // nullable: the system failed to stop
) {
    public TestResult {
        steps = List.copyOf(steps);
        cleanups = List.copyOf(cleanups);
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /** A test that never ran because its system could not be started. */
    public static TestResult notStarted(TestCase test, ErrorInfo error, Instant startedAt, Instant finishedAt) {
        return new TestResult(test.name(), test.title(), Outcome.ERROR, List.of(), List.of(), Map.of(),
            startedAt, finishedAt, error, null);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean passed() {
        return outcome == Outcome.PASS;
    }

    /** True when every cleanup entry was released and the system stopped without error. */
    public boolean teardownClean() {
        return stopError == null && cleanups.stream().allMatch(CleanupResult::succeeded);
    }

    public TestResult withStopError(ErrorInfo error) {
        return new TestResult(testName, title, outcome, steps, cleanups, context, startedAt, finishedAt,
            lifecycleError, error);
    }
}
