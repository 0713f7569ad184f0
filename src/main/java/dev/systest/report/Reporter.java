package dev.systest.report;

import dev.systest.model.CleanupResult;
import dev.systest.model.StepInstance;
import dev.systest.model.StepResult;
import dev.systest.model.SuiteResult;
import dev.systest.model.TestCase;
import dev.systest.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Observes a run. Events arrive in the order they happen; a reporter cannot influence the run.
 */
public interface Reporter {

    Reporter NONE = new Reporter() {};

    default void testStarted(TestCase test) {}

    default void stepStarted(TestCase test, StepInstance step) {}

    default void stepFinished(TestCase test, StepResult result) {}

    default void cleanupFinished(TestCase test, CleanupResult result) {}

    default void testFinished(TestCase test, TestResult result) {}

    default void suiteFinished(SuiteResult result) {}

    /**
     * Fan events out to several reporters. A reporter that throws is logged and skipped.
     */
    static Reporter composite(Reporter... reporters) {
        List<Reporter> targets = List.of(reporters);
        Logger log = LoggerFactory.getLogger(Reporter.class);
        return new Reporter() {
            private void each(Consumer<Reporter> event) {
                for (Reporter reporter : targets) {
                    try {
                        event.accept(reporter);
                    } catch (VirtualMachineError e) {
                        throw e;
                    } catch (Throwable e) {
                        log.warn("Reporter {} failed: {}", reporter.getClass().getName(), e.toString());
                    }
                }
            }

            @Override
            public void testStarted(TestCase test) {
                each(r -> r.testStarted(test));
            }

            @Override
            public void stepStarted(TestCase test, StepInstance step) {
                each(r -> r.stepStarted(test, step));
            }

            @Override
            public void stepFinished(TestCase test, StepResult result) {
                each(r -> r.stepFinished(test, result));
            }

            @Override
            public void cleanupFinished(TestCase test, CleanupResult result) {
                each(r -> r.cleanupFinished(test, result));
            }

            @Override
            public void testFinished(TestCase test, TestResult result) {
                each(r -> r.testFinished(test, result));
            }

            @Override
            public void suiteFinished(SuiteResult result) {
                each(r -> r.suiteFinished(result));
            }
        };
    }
}
