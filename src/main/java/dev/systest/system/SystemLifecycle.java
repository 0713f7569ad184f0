package dev.systest.system;

import dev.systest.model.ErrorInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Owns one system for the duration of one test: {@code UNBUILT -> STARTED -> STOPPED}.
 * Use with try-with-resources after a successful {@link #start()}; {@link #close()} never throws.
 */
public final class SystemLifecycle implements AutoCloseable {

    public enum State { UNBUILT, STARTED, STOPPED }

    private static final Logger log = LoggerFactory.getLogger(SystemLifecycle.class);

    private final SystemConstructor constructor;
    private final Map<String, Object> config;
    private State state = State.UNBUILT;
    private SystemUnderTest system;
    private ErrorInfo stopError;

    public SystemLifecycle(SystemConstructor constructor, Map<String, Object> config) {
        this.constructor = Objects.requireNonNull(constructor, "constructor");
        this.config = config == null ? Map.of() : config;
    }

    /**
     * Build and start the system. On failure the lifecycle stays {@code UNBUILT}, nothing will be stopped,
     * and the exception is rethrown.
     */
    public SystemUnderTest start() throws Exception {
        if (state != State.UNBUILT) {
            throw new IllegalStateException("System already " + state.name().toLowerCase());
        }
        SystemUnderTest built = constructor.build(config);
        if (built == null) {
            throw new IllegalStateException("System constructor returned null");
        }
        built.start();
        system = built;
        state = State.STARTED;
        return built;
    }

    public SystemUnderTest system() {
        if (state != State.STARTED) {
            throw new IllegalStateException("System is " + state.name().toLowerCase());
        }
        return system;
    }

    public State state() {
        return state;
    }

    /** Failure raised while stopping, if any. */
    public ErrorInfo stopError() {
        return stopError;
    }

    @Override
    public void close() {
        if (state != State.STARTED) {
            return;
        }
        state = State.STOPPED;
        try {
            system.stop();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("System failed to stop: {}", e.toString());
            stopError = ErrorInfo.from(e);
        }
    }
}
