package dev.systest.engine;

import dev.systest.system.SystemUnderTest;

/**
 * Releases resources of one kind.
 */
@FunctionalInterface
public interface CleanupHandler {

    void release(SystemUnderTest system, Object key) throws Exception;
}
