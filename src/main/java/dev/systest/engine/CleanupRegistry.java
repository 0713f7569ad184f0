package dev.systest.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cleanup handlers by resource kind. Host applications register their kinds before running tests.
 */
public final class CleanupRegistry {

    private final Map<String, CleanupHandler> handlers = new LinkedHashMap<>();

    public CleanupRegistry register(String kind, CleanupHandler handler) {
        handlers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public Optional<CleanupHandler> lookup(String kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public Set<String> kinds() {
        return handlers.keySet();
    }
}
