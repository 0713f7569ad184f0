package dev.systest.system;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A system made of named components. Components implementing {@link Lifecycle} are started in
 * declaration order and stopped in reverse.
 */
public final class ComponentSystem implements SystemUnderTest {

    private static final Logger log = LoggerFactory.getLogger(ComponentSystem.class);

    private final Map<String, Object> components;
    private final Deque<Map.Entry<String, Lifecycle>> started = new ArrayDeque<>();

    public ComponentSystem(Map<String, ?> components) {
        this.components = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(components));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Object> component(String key) {
        return Optional.ofNullable(components.get(key));
    }

    public Map<String, Object> components() {
        return components;
    }

    /**
     * Start lifecycle components in order. If one fails, those already started are stopped again
     * before the failure is rethrown.
     */
    @Override
    public void start() throws Exception {
        for (var entry : components.entrySet()) {
            if (!(entry.getValue() instanceof Lifecycle lifecycle)) {
                continue;
            }
            try {
                log.debug("Starting component '{}'", entry.getKey());
                lifecycle.start();
                started.push(Map.entry(entry.getKey(), lifecycle));
            } catch (Exception e) {
                log.warn("Component '{}' failed to start, rolling back", entry.getKey());
                try {
                    stop();
                } catch (Exception rollback) {
                    e.addSuppressed(rollback);
                }
                throw e;
            }
        }
    }

    /**
     * Stop started components in reverse order. Every component gets its stop call; the first failure is
     * rethrown with later ones suppressed.
     */
    @Override
    public void stop() throws Exception {
        Exception failure = null;
        while (!started.isEmpty()) {
            var entry = started.pop();
            try {
                log.debug("Stopping component '{}'", entry.getKey());
                entry.getValue().stop();
            } catch (Exception e) {
                log.warn("Component '{}' failed to stop: {}", entry.getKey(), e.toString());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public static final class Builder {
        private final Map<String, Object> components = new LinkedHashMap<>();

        private Builder() {}

        public Builder component(String key, Object component) {
            components.put(Objects.requireNonNull(key, "key"), component);
            return this;
        }

        public ComponentSystem build() {
            return new ComponentSystem(components);
        }
    }
}
