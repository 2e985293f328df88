package com.testfleet.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static ServiceSpec spec(String name) {
        return new ServiceSpec(name, "img", null, null, null, null, null);
    }

    @Nested
    @DisplayName("ServiceSpec")
    class ServiceSpecTests {

        @Test
        @DisplayName("null collections and policies get defaults")
        void defaults() {
            var spec = spec("pg");

            assertEquals(List.of(), spec.command());
            assertEquals(List.of(), spec.ports());
            assertEquals(Map.of(), spec.env());
            assertEquals(RestartPolicy.NEVER, spec.restartPolicy());
            assertEquals(ProbeType.NONE, spec.readiness().type());
        }

        @Test
        @DisplayName("bindingFor finds the host binding of a container port")
        void bindingFor() {
            var spec = new ServiceSpec("orientdb", "orientdb:2.2.30", List.of(),
                    List.of(new PortBinding("127.0.0.1", 2480, 2480), new PortBinding("127.0.0.1", 12424, 2424)),
                    Map.of(), RestartPolicy.NEVER, null);

            assertEquals(12424, spec.bindingFor(2424).orElseThrow().hostPort());
            assertTrue(spec.bindingFor(80).isEmpty());
        }
    }

    @Nested
    @DisplayName("PortBinding")
    class PortBindingTests {

        @Test
        @DisplayName("wildcard bind is reached over loopback")
        void connectHost() {
            assertEquals("127.0.0.1", new PortBinding("0.0.0.0", 1, 1).connectHost());
            assertEquals("127.0.0.1", new PortBinding("", 1, 1).connectHost());
            assertEquals("10.0.0.5", new PortBinding("10.0.0.5", 1, 1).connectHost());
        }

        @Test
        @DisplayName("wildcard binds clash with any address on the same host port")
        void clashes() {
            var loopback = new PortBinding("127.0.0.1", 3306, 3306);

            assertTrue(new PortBinding("0.0.0.0", 3306, 3306).clashesWith(loopback));
            assertTrue(loopback.clashesWith(new PortBinding("::", 3306, 3307)));
            assertTrue(loopback.clashesWith(new PortBinding("127.0.0.1", 3306, 5432)));
            assertFalse(loopback.clashesWith(new PortBinding("127.0.0.2", 3306, 3306)));
            assertFalse(new PortBinding("0.0.0.0", 3307, 3306).clashesWith(loopback));
        }
    }

    @Nested
    @DisplayName("ServiceInstance")
    class ServiceInstanceTests {

        @Test
        @DisplayName("STARTING -> READY -> STOPPED")
        void happyPath() {
            var instance = new ServiceInstance(spec("pg"), "c1");
            assertEquals(ServiceState.STARTING, instance.state());

            instance.markReady();
            assertEquals(ServiceState.READY, instance.state());

            assertTrue(instance.markStopped());
            assertEquals(ServiceState.STOPPED, instance.state());
        }

        @Test
        @DisplayName("stopping twice reports the second call as a no-op")
        void stopIsIdempotent() {
            var instance = new ServiceInstance(spec("pg"), "c1");

            assertTrue(instance.markStopped());
            assertFalse(instance.markStopped());
        }

        @Test
        @DisplayName("a failed instance cannot become ready")
        void failedIsFinalUntilStopped() {
            var instance = new ServiceInstance(spec("pg"), "c1");
            instance.markFailed("readiness timed out");

            assertEquals("readiness timed out", instance.failureCause());
            assertThrows(IllegalStateException.class, instance::markReady);
            assertTrue(instance.markStopped());
        }
    }

    @Nested
    @DisplayName("BuildIdentity")
    class BuildIdentityTests {

        @Test
        @DisplayName("build number follows the configured source")
        void buildNumber() {
            var identity = new BuildIdentity(1342, "a1b2c3d");

            assertEquals("a1b2c3d", identity.buildNumber(BuildNumberSource.REVISION));
            assertEquals("1342", identity.buildNumber(BuildNumberSource.COMMIT_COUNT));
            assertEquals("a1b2c3d (#1342)", identity.toString());
        }

        @Test
        @DisplayName("build number source parses config spellings")
        void parseSource() {
            assertEquals(BuildNumberSource.REVISION, BuildNumberSource.parse(null));
            assertEquals(BuildNumberSource.REVISION, BuildNumberSource.parse("revision"));
            assertEquals(BuildNumberSource.COMMIT_COUNT, BuildNumberSource.parse("commit-count"));
            assertThrows(IllegalArgumentException.class, () -> BuildNumberSource.parse("tag"));
        }
    }

    @Nested
    @DisplayName("PipelineRun")
    class PipelineRunTests {

        @Test
        @DisplayName("terminal state cannot be left and stamps finishedAt")
        void terminalState() {
            var run = new PipelineRun("run-1", Instant.now());
            run.transitionTo(PipelineState.RESOLVING_IDENTITY);
            assertNull(run.finishedAt());

            run.transitionTo(PipelineState.ABORTED);

            assertNotNull(run.finishedAt());
            assertThrows(IllegalStateException.class, () -> run.transitionTo(PipelineState.FINALIZING));
        }

        @Test
        @DisplayName("counts failed phases and exposes read-only views")
        void phaseResults() {
            var run = new PipelineRun("run-1", Instant.now());
            var unit = PhaseSpec.of("unit", List.of("pytest"));
            var lint = PhaseSpec.of("lint", List.of("pylint"));
            run.addPhaseResult(new PhaseResult(unit, PhaseStatus.FAILURE, 1, "pytest", "exited with code 1",
                    null, Path.of("unit.log"), null));
            run.addPhaseResult(PhaseResult.skipped(lint, "blocking phase unit failed"));

            assertEquals(1, run.failedPhaseCount());
            assertThrows(UnsupportedOperationException.class, () -> run.phaseResults().clear());
            assertFalse(run.finalization().attempted());
        }
    }
}
