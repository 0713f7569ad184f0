package dev.systest.discovery;

import dev.systest.model.TestCase;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selects tests by tag or by name.
 */
public sealed interface TestMatcher {

    boolean matches(TestCase test);

    /** Tests whose tags contain {@code tag}. */
    record Tag(String tag) implements TestMatcher {
        public Tag {
            Objects.requireNonNull(tag, "tag");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("Tag must not be blank");
            }
        }

        @Override
        public boolean matches(TestCase test) {
            return test.tags().contains(tag);
        }
    }

    /** Tests whose name or title contains a match for {@code pattern}. */
    record NamePattern(Pattern pattern) implements TestMatcher {
        public NamePattern {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public boolean matches(TestCase test) {
            return pattern.matcher(test.name()).find() || pattern.matcher(test.title()).find();
        }
    }

    /** Every test. */
    record Any() implements TestMatcher {
        @Override
        public boolean matches(TestCase test) {
            return true;
        }
    }

    static TestMatcher tag(String tag) {
        return new Tag(tag);
    }

    /**
     * @throws IllegalArgumentException if {@code regex} is not a valid pattern
     */
    static TestMatcher pattern(String regex) {
        try {
            return new NamePattern(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid test name pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    static TestMatcher any() {
        return new Any();
    }
}
