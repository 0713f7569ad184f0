package dev.systest.system;

/**
 * A component of a {@link ComponentSystem} that needs starting and stopping.
 */
public interface Lifecycle {

    void start() throws Exception;

    void stop() throws Exception;
}
