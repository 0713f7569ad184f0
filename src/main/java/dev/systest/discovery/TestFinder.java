package dev.systest.discovery;

import dev.systest.model.TestCase;

import java.util.Collection;
import java.util.Objects;

/**
 * Filters a collection of tests with a matcher.
 */
public final class TestFinder {

    private TestFinder() {}

    /**
     * Tests matching {@code matcher}, in the order of {@code allTests}. The result is evaluated lazily on
     * each iteration, so it reflects the collection at the time it is iterated.
     */
    public static Iterable<TestCase> findTests(Collection<TestCase> allTests, TestMatcher matcher) {
        Objects.requireNonNull(allTests, "allTests");
        Objects.requireNonNull(matcher, "matcher");
        return () -> allTests.stream().filter(matcher::matches).iterator();
    }
}
