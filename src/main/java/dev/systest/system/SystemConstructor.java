package dev.systest.system;

import java.util.Map;

/**
 * Builds a fresh, not yet started system. Called once per test.
 */
@FunctionalInterface
public interface SystemConstructor {

    SystemUnderTest build(Map<String, Object> config) throws Exception;
}
