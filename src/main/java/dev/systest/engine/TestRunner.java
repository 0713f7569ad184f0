package dev.systest.engine;

import dev.systest.config.RunConfig;
import dev.systest.model.CleanupResult;
import dev.systest.model.Context;
import dev.systest.model.ErrorInfo;
import dev.systest.model.Outcome;
import dev.systest.model.StepInstance;
import dev.systest.model.StepResult;
import dev.systest.model.SuiteResult;
import dev.systest.model.TestCase;
import dev.systest.model.TestResult;
import dev.systest.report.Reporter;
import dev.systest.system.SystemConstructor;
import dev.systest.system.SystemLifecycle;
import dev.systest.system.SystemUnderTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs tests one after another, each against its own freshly started system.
 *
 * <p>Within a test, steps run in declaration order and the first step that fails or errors ends the test.
 * Cleanup entries are drained and the system is stopped whatever happened. A failing test never keeps the
 * next one from running, and no test failure escapes as an exception.
 */
public final class TestRunner {

    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private final CleanupRegistry cleanupRegistry;
    private final Reporter reporter;
    private final RunConfig config;

    public TestRunner(CleanupRegistry cleanupRegistry, Reporter reporter, RunConfig config) {
        this.cleanupRegistry = Objects.requireNonNull(cleanupRegistry, "cleanupRegistry");
        // isolates the run from reporters that throw
        this.reporter = Reporter.composite(Objects.requireNonNull(reporter, "reporter"));
        this.config = Objects.requireNonNull(config, "config");
    }

    public TestRunner() {
        this(new CleanupRegistry(), Reporter.NONE, RunConfig.defaults());
    }

    /**
     * @return true iff every test passed
     */
    public boolean runTests(SystemConstructor constructor, Iterable<TestCase> tests) {
        return runSuite(constructor, tests).allPassed();
    }

    /**
     * Run every test with its own system built from {@code constructor}. A test whose definition is invalid
     * is reported as an error without building a system, and the others still run.
     *
     * @throws IllegalArgumentException if two tests share a name; nothing runs in that case
     */
    public SuiteResult runSuite(SystemConstructor constructor, Iterable<TestCase> tests) {
        Objects.requireNonNull(constructor, "constructor");
        Objects.requireNonNull(tests, "tests");
        var batch = new ArrayList<TestCase>();
        tests.forEach(batch::add);

        List<String> errors = TestValidator.validateNames(batch);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid suite:\n  " + String.join("\n  ", errors));
        }

        Instant startedAt = Instant.now();
        var results = new ArrayList<TestResult>(batch.size());
        for (TestCase test : batch) {
            List<String> problems = TestValidator.validate(test);
            results.add(problems.isEmpty() ? runWithLifecycle(constructor, test) : rejected(test, problems));
        }
        var suite = new SuiteResult(results, Duration.between(startedAt, Instant.now()));
        log.debug("Suite finished: {} passed, {} failed, {} errors",
            suite.passed(), suite.failed(), suite.errored());
        reporter.suiteFinished(suite);
        return suite;
    }

    /**
     * Run a single test against a system that is already available. The system is neither started nor
     * stopped.
     */
    public TestResult runTest(SystemUnderTest system, TestCase test) {
        return runTest(system, test, Context.empty());
    }

    public TestResult runTest(SystemUnderTest system, TestCase test, Context initial) {
        reporter.testStarted(test);
        TestResult result = execute(system, test, initial, Instant.now());
        reporter.testFinished(test, result);
        return result;
    }

    private TestResult rejected(TestCase test, List<String> problems) {
        reporter.testStarted(test);
        Instant now = Instant.now();
        log.warn("Test '{}' not run, invalid definition: {}", test.name(), problems);
        var error = new IllegalArgumentException("Invalid test definition:\n  " + String.join("\n  ", problems));
        TestResult result = TestResult.notStarted(test, ErrorInfo.from(error), now, now);
        reporter.testFinished(test, result);
        return result;
    }

    private TestResult runWithLifecycle(SystemConstructor constructor, TestCase test) {
        reporter.testStarted(test);
        Instant startedAt = Instant.now();

        var lifecycle = new SystemLifecycle(constructor, config.systemConfig());
        SystemUnderTest system;
        try {
            system = lifecycle.start();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("System for test '{}' failed to start", test.name(), e);
            TestResult result = TestResult.notStarted(test, ErrorInfo.from(e), startedAt, Instant.now());
            reporter.testFinished(test, result);
            return result;
        }

        TestResult result;
        try (lifecycle) {
            result = execute(system, test, Context.empty(), startedAt);
        }
        if (lifecycle.stopError() != null) {
            result = result.withStopError(lifecycle.stopError());
        }
        reporter.testFinished(test, result);
        return result;
    }

    private TestResult execute(SystemUnderTest system, TestCase test, Context initial, Instant startedAt) {
        var cleanups = new CleanupStack();
        var stepResults = new ArrayList<StepResult>();
        Context context = initial;
        Outcome outcome = Outcome.PASS;
        List<CleanupResult> cleanupResults;
        try {
            for (StepInstance step : test.steps()) {
                reporter.stepStarted(test, step);
                StepRun run = runStep(step, system, context, cleanups);
                stepResults.add(run.result());
                reporter.stepFinished(test, run.result());
                context = run.context();
                if (run.result().outcome() != Outcome.PASS) {
                    outcome = run.result().outcome();
                    log.debug("Step '{}' {}, skipping the rest of '{}'",
                        step.name(), outcome.name().toLowerCase(), test.name());
                    break;
                }
            }
        } finally {
            cleanupResults = cleanups.drain(system, cleanupRegistry, r -> reporter.cleanupFinished(test, r));
        }
        return new TestResult(test.name(), test.title(), outcome, stepResults, cleanupResults,
            context.asMap(), startedAt, Instant.now(), null, null);
    }

    private StepRun runStep(StepInstance step, SystemUnderTest system, Context context, CleanupStack cleanups) {
        long started = System.nanoTime();
        var scope = new RecordingStepScope(cleanups, config.assertionsFatal());
        Map<String, Object> inputs = Map.of();
        Object value = null;
        Context next = context;
        ErrorInfo error = null;
        try {
            inputs = InputResolver.resolve(step.inputs(), context, system);
            value = step.step().procedure().run(inputs, scope);
            next = OutputRegistrar.register(step.output(), context, value);
        } catch (AssertionError e) {
            scope.recordEscaped(e);
        } catch (StackOverflowError e) {
            // the stack has unwound by now, so only this step is lost
            log.debug("Step '{}' overflowed the stack", step.name());
            error = ErrorInfo.from(e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.debug("Step '{}' threw", step.name(), e);
            error = ErrorInfo.from(e);
        }

        Outcome outcome = error != null ? Outcome.ERROR
            : scope.anyFailed() ? Outcome.FAIL
            : Outcome.PASS;
        var result = new StepResult(step.name(), step.title(), outcome, scope.events(), inputs, value, error,
            Duration.ofNanos(System.nanoTime() - started));
        return new StepRun(result, next);
    }

    private record StepRun(StepResult result, Context context) {}
}
