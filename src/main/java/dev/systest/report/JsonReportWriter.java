package dev.systest.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.systest.model.AssertionEvent;
import dev.systest.model.CleanupResult;
import dev.systest.model.ErrorInfo;
import dev.systest.model.StepResult;
import dev.systest.model.SuiteResult;
import dev.systest.model.TestResult;

import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

/**
 * Serializes suite results as JSON.
 */
public final class JsonReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonReportWriter() {}

    public static String toJson(SuiteResult suite) throws IOException {
        return MAPPER.writeValueAsString(toTree(suite));
    }

    public static void write(SuiteResult suite, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(file.toFile(), toTree(suite));
    }

    public static ObjectNode toTree(SuiteResult suite) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode summary = root.putObject("summary");
        summary.put("tests", suite.tests().size());
        summary.put("passed", suite.passed());
        summary.put("failed", suite.failed());
        summary.put("errored", suite.errored());
        summary.put("dirtyTeardowns", suite.dirtyTeardowns());
        summary.put("allPassed", suite.allPassed());
        summary.put("elapsedMs", suite.elapsed().toMillis());

        ArrayNode tests = root.putArray("tests");
        suite.tests().forEach(test -> tests.add(testNode(test)));
        return root;
    }

    private static ObjectNode testNode(TestResult test) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", test.testName());
        node.put("title", test.title());
        node.put("outcome", test.outcome().name().toLowerCase());
        node.put("startedAt", test.startedAt().toString());
        node.put("finishedAt", test.finishedAt().toString());
        node.put("elapsedMs", test.elapsed().toMillis());
        node.put("teardownClean", test.teardownClean());
        putError(node, "lifecycleError", test.lifecycleError());
        putError(node, "stopError", test.stopError());

        ArrayNode steps = node.putArray("steps");
        test.steps().forEach(step -> steps.add(stepNode(step)));
        ArrayNode cleanups = node.putArray("cleanups");
        test.cleanups().forEach(cleanup -> cleanups.add(cleanupNode(cleanup)));
        node.set("context", valuesNode(test.context()));
        return node;
    }

    private static ObjectNode stepNode(StepResult step) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", step.stepName());
        node.put("title", step.title());
        node.put("outcome", step.outcome().name().toLowerCase());
        node.put("elapsedMs", step.elapsed().toMillis());
        node.set("inputs", valuesNode(step.inputs()));
        node.set("value", value(step.value()));
        ArrayNode assertions = node.putArray("assertions");
        for (AssertionEvent event : step.assertions()) {
            ObjectNode a = assertions.addObject();
            a.put("type", event.type().name().toLowerCase());
            a.put("message", event.message());
            a.set("expected", value(event.expected()));
            a.set("actual", value(event.actual()));
        }
        putError(node, "error", step.error());
        return node;
    }

    private static ObjectNode cleanupNode(CleanupResult cleanup) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("kind", cleanup.entry().kind());
        node.set("key", value(cleanup.entry().key()));
        node.put("released", cleanup.succeeded());
        putError(node, "error", cleanup.error());
        return node;
    }

    private static ObjectNode valuesNode(Map<String, Object> values) {
        ObjectNode node = MAPPER.createObjectNode();
        values.forEach((key, v) -> node.set(key, value(v)));
        return node;
    }

    private static void putError(ObjectNode node, String field, ErrorInfo error) {
        if (error == null) {
            return;
        }
        ObjectNode e = node.putObject(field);
        e.put("type", error.type());
        e.put("message", error.message());
    }

    /**
     * Plain data (scalars, strings, maps, collections and arrays of them) is written as JSON. Anything else,
     * typically a live component such as a client or connection, is written as its {@code toString()} so
     * that no getters run.
     */
    private static JsonNode value(Object v) {
        if (v == null) {
            return NullNode.getInstance();
        }
        if (v instanceof JsonNode node) {
            return node;
        }
        if (v instanceof String || v instanceof Number || v instanceof Boolean) {
            return MAPPER.valueToTree(v);
        }
        if (v instanceof Map<?, ?> map) {
            ObjectNode node = MAPPER.createObjectNode();
            map.forEach((key, item) -> node.set(String.valueOf(key), value(item)));
            return node;
        }
        if (v instanceof Collection<?> items) {
            ArrayNode node = MAPPER.createArrayNode();
            items.forEach(item -> node.add(value(item)));
            return node;
        }
        if (v.getClass().isArray()) {
            ArrayNode node = MAPPER.createArrayNode();
            for (int i = 0; i < Array.getLength(v); i++) {
                node.add(value(Array.get(v, i)));
            }
            return node;
        }
        return MAPPER.getNodeFactory().textNode(String.valueOf(v));
    }
}
