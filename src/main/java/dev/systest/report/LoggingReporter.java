package dev.systest.report;

import dev.systest.model.AssertionEvent;
import dev.systest.model.CleanupResult;
import dev.systest.model.Outcome;
import dev.systest.model.StepInstance;
import dev.systest.model.StepResult;
import dev.systest.model.SuiteResult;
import dev.systest.model.TestCase;
import dev.systest.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the event stream to the log.
 */
public final class LoggingReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingReporter.class);

    @Override
    public void testStarted(TestCase test) {
        log.info("Test '{}' ({}) started", test.title(), test.location());
    }

    @Override
    public void stepStarted(TestCase test, StepInstance step) {
        log.debug("  step '{}' started", step.title());
    }

    @Override
    public void stepFinished(TestCase test, StepResult result) {
        if (result.outcome() == Outcome.PASS) {
            log.info("  step '{}' passed in {} ms", result.title(), result.elapsed().toMillis());
            return;
        }
        log.warn("  step '{}' {}", result.title(), result.outcome().name().toLowerCase());
        for (AssertionEvent event : result.assertions()) {
            if (!event.passed()) {
                log.warn("    failed: {} (expected: {}, actual: {})",
                    event.message(), event.expected(), event.actual());
            }
        }
        if (result.error() != null) {
            log.warn("    error: {}", result.error().summary());
        }
    }

    @Override
    public void cleanupFinished(TestCase test, CleanupResult result) {
        if (!result.succeeded()) {
            log.warn("  cleanup {} {} failed: {}",
                result.entry().kind(), result.entry().key(), result.error().summary());
        }
    }

    @Override
    public void testFinished(TestCase test, TestResult result) {
        if (result.lifecycleError() != null) {
            log.error("Test '{}' could not start its system: {}", test.title(), result.lifecycleError().summary());
        }
        if (result.stopError() != null) {
            log.warn("Test '{}' could not stop its system: {}", test.title(), result.stopError().summary());
        }
        log.info("Test '{}' {} in {} ms", test.title(), result.outcome().name().toLowerCase(),
            result.elapsed().toMillis());
    }

    @Override
    public void suiteFinished(SuiteResult result) {
        log.info("{} tests: {} passed, {} failed, {} errors, {} dirty teardowns",
            result.tests().size(), result.passed(), result.failed(), result.errored(), result.dirtyTeardowns());
    }
}
