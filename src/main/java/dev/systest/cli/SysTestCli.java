package dev.systest.cli;

import dev.systest.config.RunConfig;
import dev.systest.config.RunConfigLoader;
import dev.systest.discovery.SuiteProvider;
import dev.systest.discovery.TestFinder;
import dev.systest.discovery.TestMatcher;
import dev.systest.engine.CleanupRegistry;
import dev.systest.engine.TestRunner;
import dev.systest.model.SuiteResult;
import dev.systest.model.TestCase;
import dev.systest.model.TestResult;
import dev.systest.report.JsonReportWriter;
import dev.systest.report.LoggingReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI entry point: runs the suites registered through {@link SuiteProvider}.
 */
@Command(
    name = "systest",
    mixinStandardHelpOptions = true,
    description = "Run integration-test suites against lifecycle-managed systems."
)
public class SysTestCli implements Callable<Integer> {

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_NOT_PASSED = 1;
    public static final int EXIT_MISCONFIGURED = 2;

    @Option(names = "--list", description = "List available suites and tests")
    private boolean list;

    @Option(names = "--suite", description = "Only run this suite (default: all)")
    private String suite;

    @Option(names = "--tag", description = "Only run tests carrying this tag")
    private String tag;

    @Option(names = "--pattern", description = "Only run tests whose name or title matches this regex")
    private String pattern;

    @Option(names = "--config", description = "JSON run configuration")
    private Path configFile;

    @Option(names = "--report", description = "Write a JSON report here (overrides the config's reportFile)")
    private Path reportFile;

    private final List<SuiteProvider> providers;

    public SysTestCli() {
        this(loadProviders());
    }

    SysTestCli(List<SuiteProvider> providers) {
        this.providers = providers;
    }

    @Override
    public Integer call() {
        List<SuiteProvider> selected = providers.stream()
            .filter(p -> suite == null || p.name().equals(suite))
            .collect(Collectors.toList());
        if (suite != null && selected.isEmpty()) {
            System.err.println("Error: unknown suite '" + suite + "'. Use --list to see available suites.");
            return EXIT_MISCONFIGURED;
        }

        if (list) {
            printSuites(selected);
            return EXIT_PASSED;
        }

        RunConfig config;
        TestMatcher matcher;
        try {
            config = configFile != null ? RunConfigLoader.loadFromFile(configFile) : RunConfig.defaults();
            matcher = matcher();
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_MISCONFIGURED;
        }
        if (reportFile != null) {
            config = config.withReportFile(reportFile);
        }

        var results = new ArrayList<TestResult>();
        Duration elapsed = Duration.ZERO;
        for (SuiteProvider provider : selected) {
            var registry = new CleanupRegistry();
            provider.registerCleanupHandlers(registry);
            var runner = new TestRunner(registry, new LoggingReporter(), config);
            try {
                SuiteResult result = runner.runSuite(provider.systemConstructor(),
                    TestFinder.findTests(provider.tests(), matcher));
                results.addAll(result.tests());
                elapsed = elapsed.plus(result.elapsed());
            } catch (IllegalArgumentException e) {
                System.err.println("Error in suite '" + provider.name() + "': " + e.getMessage());
                return EXIT_MISCONFIGURED;
            }
        }

        var total = new SuiteResult(results, elapsed);
        printSummary(total);
        if (config.reportFile() != null) {
            try {
                JsonReportWriter.write(total, config.reportFile());
            } catch (IOException e) {
                System.err.println("Error: could not write report to " + config.reportFile() + ": " + e.getMessage());
                return EXIT_MISCONFIGURED;
            }
        }
        return total.allPassed() ? EXIT_PASSED : EXIT_NOT_PASSED;
    }

    private TestMatcher matcher() {
        if (tag != null && pattern != null) {
            throw new IllegalArgumentException("--tag and --pattern cannot be combined");
        }
        if (tag != null) {
            return TestMatcher.tag(tag);
        }
        if (pattern != null) {
            return TestMatcher.pattern(pattern);
        }
        return TestMatcher.any();
    }

    private static void printSuites(List<SuiteProvider> suites) {
        System.out.println("Available suites:");
        for (SuiteProvider provider : suites) {
            System.out.println("  " + provider.name());
            for (TestCase test : provider.tests()) {
                String tags = test.tags().isEmpty() ? "" : " " + test.tags();
                System.out.println("    " + test.name() + " - " + test.title() + tags);
            }
        }
    }

    private static void printSummary(SuiteResult result) {
        for (TestResult test : result.tests()) {
            System.out.printf("%-5s %s%s%n", test.outcome().name(), test.title(),
                test.teardownClean() ? "" : " (dirty teardown)");
        }
        System.out.printf("%d tests, %d passed, %d failed, %d errors%n",
            result.tests().size(), result.passed(), result.failed(), result.errored());
    }

    private static List<SuiteProvider> loadProviders() {
        var providers = new ArrayList<SuiteProvider>();
        ServiceLoader.load(SuiteProvider.class).forEach(providers::add);
        return providers;
    }
}
