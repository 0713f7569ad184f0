package dev.systest.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads run settings from JSON. Missing fields fall back to {@link RunConfig#defaults()}.
 *
 * <pre>
 * {
 *   "system": { "db.url": "jdbc:postgresql://localhost/test" },
 *   "assertionsFatal": false,
 *   "reportFile": "target/systest-report.json"
 * }
 * </pre>
 */
public final class RunConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private RunConfigLoader() {}

    public static RunConfig loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseConfig(root);
    }

    public static RunConfig loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseConfig(root);
    }

    private static RunConfig parseConfig(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return RunConfig.defaults();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Run config must be a JSON object: " + root);
        }

        Map<String, Object> system = Map.of();
        JsonNode systemNode = root.get("system");
        if (systemNode != null && !systemNode.isNull()) {
            if (!systemNode.isObject()) {
                throw new IllegalArgumentException("'system' must be a JSON object: " + systemNode);
            }
            system = MAPPER.convertValue(systemNode, MAP_TYPE);
        }

        boolean assertionsFatal = root.has("assertionsFatal")
            ? root.get("assertionsFatal").asBoolean() : RunConfig.DEFAULT_ASSERTIONS_FATAL;
        Path reportFile = root.hasNonNull("reportFile")
            ? Path.of(root.get("reportFile").asText()) : null;

        return new RunConfig(system, assertionsFatal, reportFile);
    }
}
