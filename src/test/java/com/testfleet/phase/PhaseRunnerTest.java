package com.testfleet.phase;

import com.testfleet.core.model.PhaseSpec;
import com.testfleet.core.model.PhaseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class PhaseRunnerTest {

    @TempDir
    Path workDir;

    @TempDir
    Path logDir;

    private ScriptedExecutor executor;
    private PhaseRunner runner;

    @BeforeEach
    void setUp() {
        executor = new ScriptedExecutor();
        runner = new PhaseRunner(executor, workDir, logDir, 4);
    }

    private static PhaseSpec phase(String name, List<String> commands, String filter, boolean coverage) {
        return new PhaseSpec(name, commands, Optional.ofNullable(filter), coverage, Path.of(".coverage"),
                false, Duration.ofMinutes(5));
    }

    @Nested
    @DisplayName("command execution")
    class Execution {

        @Test
        @DisplayName("runs every command in order and succeeds")
        void allCommandsPass() {
            var result = runner.run("run-1", phase("lint", List.of("pylint --jobs=${jobs}", "echo done"), null, false),
                    Map.of("PATH", "/usr/bin"));

            assertEquals(PhaseStatus.SUCCESS, result.status());
            assertEquals(0, result.exitCode());
            assertEquals(List.of("pylint --jobs=4", "echo done"), executor.commands);
            assertEquals(logDir.resolve("run-1").resolve("lint.log"), result.logRef());
            assertTrue(Files.exists(result.logRef()));
        }

        @Test
        @DisplayName("stops at the first failing command")
        void shortCircuits() {
            executor.exitCodes.add(0);
            executor.exitCodes.add(2);

            var result = runner.run("run-1", phase("unit", List.of("a", "b", "c"), null, false), Map.of());

            assertEquals(PhaseStatus.FAILURE, result.status());
            assertEquals(2, result.exitCode());
            assertEquals("b", result.failedCommand());
            assertEquals("exited with code 2", result.failureReason());
            assertEquals(List.of("a", "b"), executor.commands);
        }

        @Test
        @DisplayName("exports the filter and phase name, quotes the filter in commands")
        void filterHandling() {
            runner.run("run-1", phase("integration", List.of("pytest -k ${filter}"), "integration_tests", false),
                    Map.of("PATH", "/usr/bin"));

            assertEquals(List.of("pytest -k 'integration_tests'"), executor.commands);
            var env = executor.envs.get(0);
            assertEquals("integration_tests", env.get("TESTFLEET_FILTER"));
            assertEquals("integration", env.get("TESTFLEET_PHASE"));
            assertEquals("/usr/bin", env.get("PATH"));
        }

        @Test
        @DisplayName("a timeout is a failure with its own reason")
        void timeout() {
            executor.exitCodes.add(CommandExecutor.TIMED_OUT);

            var result = runner.run("run-1", phase("unit", List.of("pytest"), null, false), Map.of());

            assertEquals(PhaseStatus.FAILURE, result.status());
            assertTrue(result.failureReason().startsWith("timed out"));
        }

        @Test
        @DisplayName("a command that cannot start becomes a failure result")
        void launchError() {
            executor.error = new PhaseExecutionException(null, "Could not start 'pytest': no such file");

            var result = runner.run("run-1", phase("unit", List.of("pytest"), null, false), Map.of());

            assertEquals(PhaseStatus.FAILURE, result.status());
            assertEquals("pytest", result.failedCommand());
            assertTrue(result.failureReason().contains("no such file"));
        }
    }

    @Nested
    @DisplayName("coverage")
    class Coverage {

        @Test
        @DisplayName("artifact written during the phase is captured")
        void freshArtifact() {
            executor.sideEffect = cmd -> write(workDir.resolve(".coverage"));

            var result = runner.run("run-1", phase("unit", List.of("pytest --cov"), null, true), Map.of());

            assertEquals(PhaseStatus.SUCCESS, result.status());
            assertEquals(Optional.of(workDir.resolve(".coverage")), result.coverageArtifact());
        }

        @Test
        @DisplayName("missing artifact fails the phase even when commands pass")
        void missingArtifact() {
            var result = runner.run("run-1", phase("unit", List.of("pytest --cov"), null, true), Map.of());

            assertEquals(PhaseStatus.FAILURE, result.status());
            assertTrue(result.failureReason().contains(".coverage"));
            assertTrue(result.coverageArtifact().isEmpty());
        }

        @Test
        @DisplayName("artifact left over from an earlier phase does not count")
        void staleArtifact() throws IOException {
            Path artifact = workDir.resolve(".coverage");
            write(artifact);
            Files.setLastModifiedTime(artifact, FileTime.from(Instant.now().minus(Duration.ofHours(1))));

            var result = runner.run("run-1", phase("snapshot", List.of("pytest --cov"), null, true), Map.of());

            assertEquals(PhaseStatus.FAILURE, result.status());
        }

        @Test
        @DisplayName("coverage is not checked for a failed phase")
        void failedPhaseSkipsCoverageCheck() {
            executor.exitCodes.add(1);

            var result = runner.run("run-1", phase("unit", List.of("pytest --cov"), null, true), Map.of());

            assertEquals(1, result.exitCode());
            assertEquals("exited with code 1", result.failureReason());
        }
    }

    private static void write(Path file) {
        try {
            Files.writeString(file, "coverage-data");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Records commands and returns queued exit codes (0 when the queue is empty). */
    static class ScriptedExecutor implements CommandExecutor {

        final List<String> commands = new ArrayList<>();
        final List<Map<String, String>> envs = new ArrayList<>();
        final Deque<Integer> exitCodes = new ArrayDeque<>();
        Consumer<String> sideEffect = cmd -> { };
        PhaseExecutionException error;

        @Override
        public int execute(String command, Path workDir, Map<String, String> env, Path logFile, Duration timeout) {
            commands.add(command);
            envs.add(env);
            if (error != null) {
                throw error;
            }
            sideEffect.accept(command);
            return exitCodes.isEmpty() ? 0 : exitCodes.poll();
        }
    }
}
