package dev.systest.discovery;

import dev.systest.engine.CleanupRegistry;
import dev.systest.model.TestCase;
import dev.systest.system.SystemConstructor;

import java.util.List;

/**
 * A named suite contributed by a host application, found through {@link java.util.ServiceLoader}.
 * Register implementations in {@code META-INF/services/dev.systest.discovery.SuiteProvider}.
 */
public interface SuiteProvider {

    String name();

    SystemConstructor systemConstructor();

    /** Tests in declaration order. */
    List<TestCase> tests();

    /** Add handlers for the cleanup kinds this suite's steps register. */
    default void registerCleanupHandlers(CleanupRegistry registry) {}
}
