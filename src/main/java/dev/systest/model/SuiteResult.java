package dev.systest.model;

import java.time.Duration;
import java.util.List;

/**
 * Results of a batch of tests, in execution order.
 */
public record SuiteResult(List<TestResult> tests, Duration elapsed) {

    public SuiteResult {
        tests = List.copyOf(tests);
    }

    public long passed() {
        return count(Outcome.PASS);
    }

    public long failed() {
        return count(Outcome.FAIL);
    }

    public long errored() {
        return count(Outcome.ERROR);
    }

    /** Tests whose teardown reported a cleanup or stop failure, whatever their outcome. */
    public long dirtyTeardowns() {
        return tests.stream().filter(t -> !t.teardownClean()).count();
    }

    public boolean allPassed() {
        return tests.stream().allMatch(TestResult::passed);
    }

    private long count(Outcome outcome) {
        return tests.stream().filter(t -> t.outcome() == outcome).count();
    }
}
