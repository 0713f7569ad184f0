package dev.systest.engine;

import dev.systest.model.OutputSpec;
import dev.systest.model.Step;
import dev.systest.model.TestCase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TestValidatorTest {

    private static final Step NOOP = Step.builder("noop").procedure((inputs, scope) -> null).build();

    @Test
    void validTestReturnsNoErrors() {
        TestCase test = TestCase.builder("valid")
            .step(NOOP)
            .step(NOOP.bind(null, OutputSpec.keys("a", "b"), null))
            .build();

        assertThat(TestValidator.validate(test)).isEmpty();
    }

    @Test
    void testWithoutStepsIsValid() {
        assertThat(TestValidator.validate(TestCase.builder("empty").build())).isEmpty();
    }

    @Test
    void detectsBlankTestName() {
        var errors = TestValidator.validate(TestCase.builder(" ").build());

        assertThat(errors).anyMatch(e -> e.contains("blank name"));
    }

    @Test
    void detectsBlankStepName() {
        Step blank = Step.builder("").procedure((inputs, scope) -> null).build();

        var errors = TestValidator.validate(TestCase.builder("t").step(blank).build());

        assertThat(errors).anyMatch(e -> e.contains("step 1 has a blank name"));
    }

    @Test
    void detectsEmptyOutputKeys() {
        TestCase test = TestCase.builder("t").step(NOOP.bind(null, OutputSpec.keys(), null)).build();

        assertThat(TestValidator.validate(test)).anyMatch(e -> e.contains("output keys are empty"));
    }

    @Test
    void detectsDuplicateOutputKeys() {
        TestCase test = TestCase.builder("t").step(NOOP.bind(null, OutputSpec.keys("a", "a"), null)).build();

        assertThat(TestValidator.validate(test)).anyMatch(e -> e.contains("duplicate output keys"));
    }

    @Test
    void detectsDuplicateTestNames() {
        var errors = TestValidator.validateAll(List.of(
            TestCase.builder("same").build(),
            TestCase.builder("other").build(),
            TestCase.builder("same").build()));

        assertThat(errors).containsExactly("Duplicate test name: same");
    }

    @Test
    void nameCheckIgnoresPerTestProblems() {
        TestCase emptyKeys = TestCase.builder("empty-keys").step(NOOP.bind(null, OutputSpec.keys(), null)).build();

        assertThat(TestValidator.validateNames(List.of(emptyKeys, TestCase.builder("other").build()))).isEmpty();
        assertThat(TestValidator.validateAll(List.of(emptyKeys))).hasSize(1);
    }
}
