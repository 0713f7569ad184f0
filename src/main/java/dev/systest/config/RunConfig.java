package dev.systest.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for one run.
 */
public record RunConfig(
    Map<String, Object> systemConfig, // handed to the system constructor for every test
    boolean assertionsFatal,          // end a step at its first failed check
    Path reportFile                   // nullable: where to write the JSON report
) {
    public static final boolean DEFAULT_ASSERTIONS_FATAL = false;

    public RunConfig {
        systemConfig = systemConfig == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(systemConfig));
    }

    public static RunConfig defaults() {
        return new RunConfig(Map.of(), DEFAULT_ASSERTIONS_FATAL, null);
    }

    public RunConfig withSystemConfig(Map<String, Object> systemConfig) {
        return new RunConfig(systemConfig, assertionsFatal, reportFile);
    }

    public RunConfig withReportFile(Path reportFile) {
        return new RunConfig(systemConfig, assertionsFatal, reportFile);
    }
}
