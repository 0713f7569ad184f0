package dev.systest.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SysTestCliTest {

    @BeforeEach
    void reset() {
        FixtureSuiteProvider.RELEASED.clear();
    }

    private static int run(String... args) {
        return new CommandLine(new SysTestCli(List.of(new FixtureSuiteProvider()))).execute(args);
    }

    @Test
    void passingSelectionExitsZero() {
        assertThat(run("--tag", "smoke")).isEqualTo(SysTestCli.EXIT_PASSED);
        assertThat(FixtureSuiteProvider.RELEASED).containsExactly("sku-1");
    }

    @Test
    void failingTestExitsOne() {
        assertThat(run()).isEqualTo(SysTestCli.EXIT_NOT_PASSED);
        assertThat(FixtureSuiteProvider.RELEASED).hasSize(2);
    }

    @Test
    void patternSelectsByTitle() {
        assertThat(run("--pattern", "counts it")).isEqualTo(SysTestCli.EXIT_PASSED);
    }

    @Test
    void malformedPatternIsMisconfiguration() {
        assertThat(run("--pattern", "(")).isEqualTo(SysTestCli.EXIT_MISCONFIGURED);
    }

    @Test
    void tagAndPatternTogetherIsMisconfiguration() {
        assertThat(run("--tag", "smoke", "--pattern", "add")).isEqualTo(SysTestCli.EXIT_MISCONFIGURED);
    }

    @Test
    void unknownSuiteIsMisconfiguration() {
        assertThat(run("--suite", "billing")).isEqualTo(SysTestCli.EXIT_MISCONFIGURED);
    }

    @Test
    void listDoesNotRunAnything() {
        assertThat(run("--list")).isEqualTo(SysTestCli.EXIT_PASSED);
        assertThat(FixtureSuiteProvider.RELEASED).isEmpty();
    }

    @Test
    void writesJsonReport(@TempDir Path dir) throws IOException {
        Path report = dir.resolve("report.json");

        run("--report", report.toString());

        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(root.at("/summary/tests").asInt()).isEqualTo(2);
        assertThat(root.at("/tests/1/outcome").asText()).isEqualTo("fail");
        assertThat(root.at("/tests/1/steps/1/assertions/0/expected").asInt()).isEqualTo(2);
    }

    @Test
    void readsConfigFile(@TempDir Path dir) throws IOException {
        Path report = dir.resolve("from-config.json");
        Path config = dir.resolve("run.json");
        Files.writeString(config, "{\"reportFile\": \"" + report.toString().replace("\\", "\\\\") + "\"}");

        assertThat(run("--config", config.toString(), "--tag", "smoke")).isEqualTo(SysTestCli.EXIT_PASSED);
        assertThat(report).exists();
    }

    @Test
    void missingConfigFileIsMisconfiguration(@TempDir Path dir) {
        assertThat(run("--config", dir.resolve("absent.json").toString())).isEqualTo(SysTestCli.EXIT_MISCONFIGURED);
    }

    @Test
    void discoversProvidersThroughServiceLoader() {
        int exit = new CommandLine(new SysTestCli()).execute("--suite", "inventory", "--tag", "smoke");

        assertThat(exit).isEqualTo(SysTestCli.EXIT_PASSED);
    }
}
