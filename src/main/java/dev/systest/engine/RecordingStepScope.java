package dev.systest.engine;

import dev.systest.model.AssertionEvent;
import dev.systest.model.StepScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The {@link StepScope} handed to a procedure by the runner. Collects assertion events in order and forwards
 * cleanup registrations to the test's {@link CleanupStack}.
 */
final class RecordingStepScope implements StepScope {

    /** Ends a step at its first failed check when assertions are fatal. Already recorded. */
    static final class FatalAssertionError extends AssertionError {
        FatalAssertionError(String message) {
            super(message);
        }
    }

    private final CleanupStack cleanups;
    private final boolean assertionsFatal;
    private final List<AssertionEvent> events = new ArrayList<>();

    RecordingStepScope(CleanupStack cleanups, boolean assertionsFatal) {
        this.cleanups = cleanups;
        this.assertionsFatal = assertionsFatal;
    }

    @Override
    public boolean check(boolean condition, String message) {
        return record(condition, true, condition, message);
    }

    @Override
    public boolean checkEquals(Object expected, Object actual, String message) {
        return record(Objects.equals(expected, actual), expected, actual, message);
    }

    @Override
    public boolean verify(String message, Runnable assertions) {
        try {
            assertions.run();
        } catch (FatalAssertionError e) {
            throw e;
        } catch (AssertionError e) {
            return record(false, null, e.getMessage(), message);
        }
        return record(true, null, null, message);
    }

    @Override
    public void registerCleanup(String kind, Object key) {
        cleanups.register(kind, key);
    }

    /** Record an assertion error that escaped the procedure, unless it was one of ours. */
    void recordEscaped(AssertionError e) {
        if (!(e instanceof FatalAssertionError)) {
            events.add(AssertionEvent.fail(null, null, String.valueOf(e.getMessage())));
        }
    }

    List<AssertionEvent> events() {
        return events;
    }

    boolean anyFailed() {
        return events.stream().anyMatch(event -> !event.passed());
    }

    private boolean record(boolean passed, Object expected, Object actual, String message) {
        if (passed) {
            events.add(AssertionEvent.pass(expected, actual, message));
            return true;
        }
        events.add(AssertionEvent.fail(expected, actual, message));
        if (assertionsFatal) {
            throw new FatalAssertionError(message);
        }
        return false;
    }
}
