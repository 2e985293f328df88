package com.testfleet.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Readiness policy for one backend: what to check, how often, and how many times.
 *
 * @param type        probe kind
 * @param port        container port probed by a TCP check
 * @param command     handshake command for an EXEC check
 * @param interval    delay between attempts
 * @param maxAttempts attempts before the instance is declared failed
 */
public record ReadinessSpec(
    ProbeType type,
    int port,
    List<String> command,
    Duration interval,
    int maxAttempts
) {
    public ReadinessSpec {
        command = command != null ? List.copyOf(command) : List.of();
    }

    public static ReadinessSpec tcp(int port, Duration interval, int maxAttempts) {
        return new ReadinessSpec(ProbeType.TCP, port, List.of(), interval, maxAttempts);
    }

    public static ReadinessSpec exec(List<String> command, Duration interval, int maxAttempts) {
        return new ReadinessSpec(ProbeType.EXEC, 0, command, interval, maxAttempts);
    }

    public static ReadinessSpec none() {
        return new ReadinessSpec(ProbeType.NONE, 0, List.of(), Duration.ZERO, 1);
    }
}
