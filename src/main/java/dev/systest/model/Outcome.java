package dev.systest.model;

/**
 * Classification of a step or a test.
 */
public enum Outcome {
    PASS,
    /** At least one assertion failed and nothing was thrown. */
    FAIL,
    /** An uncaught exception escaped. */
    ERROR
}
