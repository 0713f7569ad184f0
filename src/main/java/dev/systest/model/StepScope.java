package dev.systest.model;

/**
 * Handle given to a running step procedure. Records assertions and accepts cleanup obligations for the
 * current test.
 */
public interface StepScope {

    /** Record a passing or failing check. Returns {@code condition}. */
    boolean check(boolean condition, String message);

    /** Record whether {@code actual} equals {@code expected}. Returns true on a match. */
    boolean checkEquals(Object expected, Object actual, String message);

    /**
     * Run a block of library assertions (AssertJ, JUnit, ...). An {@link AssertionError} thrown by the
     * block is recorded as a failure instead of propagating.
     */
    boolean verify(String message, Runnable assertions);

    /** Release {@code key} with the handler for {@code kind} once the test finishes. */
    void registerCleanup(String kind, Object key);
}
