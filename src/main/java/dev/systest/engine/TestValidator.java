package dev.systest.engine;

import dev.systest.model.OutputSpec;
import dev.systest.model.StepInstance;
import dev.systest.model.TestCase;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

/**
 * Validates test definitions before a suite runs.
 */
public final class TestValidator {

    private TestValidator() {}

    /**
     * Validate one test. Returns an empty list if valid, or a list of error messages if invalid.
     */
    public static List<String> validate(TestCase test) {
        var errors = new ArrayList<String>();

        if (test.name().isBlank()) {
            errors.add("Test at %s has a blank name".formatted(test.location()));
        }

        for (int i = 0; i < test.steps().size(); i++) {
            StepInstance step = test.steps().get(i);
            String where = "Test '%s', step %d".formatted(test.name(), i + 1);

            if (step.name().isBlank()) {
                errors.add(where + " has a blank name");
            }
            if (step.output() instanceof OutputSpec.Keys keys) {
                if (keys.keys().isEmpty()) {
                    errors.add("%s ('%s'): output keys are empty".formatted(where, step.name()));
                } else if (keys.hasDuplicates()) {
                    errors.add("%s ('%s'): duplicate output keys %s".formatted(where, step.name(), keys.keys()));
                }
            }
            for (String inputKey : step.inputs().keySet()) {
                if (inputKey == null || inputKey.isBlank()) {
                    errors.add("%s ('%s'): blank input key".formatted(where, step.name()));
                }
            }
        }

        return errors;
    }

    /**
     * Suite-level checks only: test names must be unique.
     */
    public static List<String> validateNames(Collection<TestCase> tests) {
        var errors = new ArrayList<String>();
        var seen = new HashSet<String>();
        for (TestCase test : tests) {
            if (!seen.add(test.name())) {
                errors.add("Duplicate test name: " + test.name());
            }
        }
        return errors;
    }

    /**
     * Validate a batch of tests, including that test names are unique.
     */
    public static List<String> validateAll(Collection<TestCase> tests) {
        var errors = new ArrayList<String>(validateNames(tests));
        for (TestCase test : tests) {
            errors.addAll(validate(test));
        }
        return errors;
    }
}
