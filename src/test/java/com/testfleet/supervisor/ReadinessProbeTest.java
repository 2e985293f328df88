package com.testfleet.supervisor;

import com.testfleet.core.model.PortBinding;
import com.testfleet.core.model.ReadinessSpec;
import com.testfleet.core.model.RestartPolicy;
import com.testfleet.core.model.ServiceInstance;
import com.testfleet.core.model.ServiceSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReadinessProbeTest {

    private static ServiceInstance tcpInstance(int hostPort) {
        var spec = new ServiceSpec("orientdb", "orientdb:2.2.30", List.of(),
                List.of(new PortBinding("127.0.0.1", hostPort, 2424)), Map.of(), RestartPolicy.NEVER,
                ReadinessSpec.tcp(2424, Duration.ofMillis(10), 3));
        return new ServiceInstance(spec, "c1");
    }

    private static ServiceInstance execInstance() {
        var spec = new ServiceSpec("postgres", "postgres:10.5", List.of(),
                List.of(new PortBinding("127.0.0.1", 5432, 5432)), Map.of(), RestartPolicy.NEVER,
                ReadinessSpec.exec(List.of("pg_isready"), Duration.ofMillis(10), 3));
        return new ServiceInstance(spec, "c2");
    }

    @Nested
    @DisplayName("TcpReadinessProbe")
    class Tcp {

        @Test
        @DisplayName("ready when the published port accepts connections")
        void acceptsConnection() throws IOException {
            try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
                var probe = new TcpReadinessProbe(Duration.ofSeconds(1));

                assertTrue(probe.check(tcpInstance(server.getLocalPort())));
            }
        }

        @Test
        @DisplayName("ready when the server sends a greeting")
        void greeting() throws Exception {
            try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
                var acceptor = new Thread(() -> {
                    try (var conn = server.accept()) {
                        conn.getOutputStream().write(new byte[] {0, 36});
                        conn.getOutputStream().flush();
                        Thread.sleep(500);
                    } catch (IOException | InterruptedException ignored) {
                        // test server
                    }
                });
                acceptor.start();
                var probe = new TcpReadinessProbe(Duration.ofSeconds(1), Duration.ofSeconds(2));

                assertTrue(probe.check(tcpInstance(server.getLocalPort())));
                acceptor.join();
            }
        }

        @Test
        @DisplayName("not ready when the port accepts and drops the connection, as a proxy with no backend does")
        void acceptedThenClosed() throws Exception {
            try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
                var acceptor = new Thread(() -> {
                    try {
                        server.accept().close();
                    } catch (IOException ignored) {
                        // test server
                    }
                });
                acceptor.start();
                var probe = new TcpReadinessProbe(Duration.ofSeconds(1), Duration.ofSeconds(2));

                assertFalse(probe.check(tcpInstance(server.getLocalPort())));
                acceptor.join();
            }
        }

        @Test
        @DisplayName("not ready when nothing listens")
        void refused() throws IOException {
            int freePort;
            try (var server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
                freePort = server.getLocalPort();
            }
            var probe = new TcpReadinessProbe(Duration.ofMillis(200));

            assertFalse(probe.check(tcpInstance(freePort)));
        }
    }

    @Nested
    @DisplayName("ExecReadinessProbe")
    class Exec {

        @Test
        @DisplayName("exit code 0 means ready")
        void zeroExit() {
            var provider = mock(ServiceProvider.class);
            when(provider.exec(eq("c2"), eq(List.of("pg_isready")), any())).thenReturn(0);

            assertTrue(new ExecReadinessProbe(provider, Duration.ofSeconds(1)).check(execInstance()));
        }

        @Test
        @DisplayName("non-zero exit or provider error means not ready yet")
        void notReady() {
            var provider = mock(ServiceProvider.class);
            when(provider.exec(anyString(), anyList(), any())).thenReturn(2).thenThrow(new IllegalStateException("conflict"));
            var probe = new ExecReadinessProbe(provider, Duration.ofSeconds(1));

            assertFalse(probe.check(execInstance()));
            assertFalse(probe.check(execInstance()));
        }
    }

    @Test
    @DisplayName("probe type selects the implementation")
    void selection() {
        ReadinessProbe tcp = i -> false;
        ReadinessProbe exec = i -> false;
        var probes = new ReadinessProbes(tcp, exec);
        var none = new ServiceSpec("x", "x", null, null, null, null, ReadinessSpec.none());

        assertSame(tcp, probes.forSpec(tcpInstance(1).spec()));
        assertSame(exec, probes.forSpec(execInstance().spec()));
        assertTrue(probes.forSpec(none).check(new ServiceInstance(none, "c3")));
    }
}
