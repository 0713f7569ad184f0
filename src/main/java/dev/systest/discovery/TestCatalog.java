package dev.systest.discovery;

import dev.systest.model.TestCase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Test definitions in registration order, unique by name.
 */
public final class TestCatalog {

    private final Map<String, TestCase> tests = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a test with the same name is already registered
     */
    public TestCatalog register(TestCase test) {
        if (tests.putIfAbsent(test.name(), test) != null) {
            throw new IllegalArgumentException("Test already registered: " + test.name()
                + " (first declared at " + tests.get(test.name()).location() + ")");
        }
        return this;
    }

    public TestCatalog registerAll(Iterable<TestCase> tests) {
        tests.forEach(this::register);
        return this;
    }

    public Optional<TestCase> get(String name) {
        return Optional.ofNullable(tests.get(name));
    }

    public List<TestCase> tests() {
        return List.copyOf(tests.values());
    }

    public Iterable<TestCase> find(TestMatcher matcher) {
        return TestFinder.findTests(Collections.unmodifiableCollection(tests.values()), matcher);
    }

    public int size() {
        return tests.size();
    }
}
