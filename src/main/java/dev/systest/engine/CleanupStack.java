package dev.systest.engine;

import dev.systest.model.CleanupEntry;
import dev.systest.model.CleanupResult;
import dev.systest.model.ErrorInfo;
import dev.systest.system.SystemUnderTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Cleanup obligations of one test execution. Entries are released last-in-first-out, exactly once.
 */
public final class CleanupStack {

    private static final Logger log = LoggerFactory.getLogger(CleanupStack.class);

    private final Deque<CleanupEntry> entries = new ArrayDeque<>();
    private boolean drained;

    public void register(String kind, Object key) {
        if (drained) {
            throw new IllegalStateException("Cleanup stack already drained; register cleanups while the test runs");
        }
        entries.push(new CleanupEntry(kind, key));
    }

    public int size() {
        return entries.size();
    }

    public boolean drained() {
        return drained;
    }

    /**
     * Release every entry in reverse registration order. A failing or missing handler is reported and the
     * remaining entries are still released.
     *
     * @param listener notified after each entry; may be null
     */
    public List<CleanupResult> drain(SystemUnderTest system, CleanupRegistry registry, Consumer<CleanupResult> listener) {
        if (drained) {
            throw new IllegalStateException("Cleanup stack already drained");
        }
        drained = true;
        var results = new ArrayList<CleanupResult>(entries.size());
        while (!entries.isEmpty()) {
            CleanupResult result = release(entries.pop(), system, registry);
            results.add(result);
            if (listener != null) {
                listener.accept(result);
            }
        }
        return results;
    }

    private static CleanupResult release(CleanupEntry entry, SystemUnderTest system, CleanupRegistry registry) {
        var handler = registry.lookup(entry.kind());
        if (handler.isEmpty()) {
            log.warn("No cleanup handler for kind '{}', leaving {}", entry.kind(), entry.key());
            return CleanupResult.failed(entry, ErrorInfo.from(
                new IllegalStateException("No cleanup handler registered for kind '" + entry.kind() + "'")));
        }
        try {
            log.debug("Releasing {} {}", entry.kind(), entry.key());
            handler.get().release(system, entry.key());
            return CleanupResult.released(entry);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Cleanup of {} {} failed: {}", entry.kind(), entry.key(), e.toString());
            return CleanupResult.failed(entry, ErrorInfo.from(e));
        }
    }
}
