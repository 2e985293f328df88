package com.testfleet.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of running one phase. Never mutated after creation.
 *
 * @param phase            the phase that ran
 * @param status           success, failure or skipped
 * @param exitCode         exit code of the last command run, -1 if none completed
 * @param failedCommand    the command that failed (null on success)
 * @param failureReason    human readable reason (null on success)
 * @param coverageArtifact coverage file captured for finalization
 * @param logRef           log file holding the phase output (null when skipped)
 * @param duration         wall-clock time spent
 */
public record PhaseResult(
    PhaseSpec phase,
    PhaseStatus status,
    int exitCode,
    String failedCommand,
    String failureReason,
    Optional<Path> coverageArtifact,
    Path logRef,
    Duration duration
) {
    public PhaseResult {
        coverageArtifact = coverageArtifact != null ? coverageArtifact : Optional.empty();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static PhaseResult skipped(PhaseSpec phase, String reason) {
        return new PhaseResult(phase, PhaseStatus.SKIPPED, -1, null, reason,
                Optional.empty(), null, Duration.ZERO);
    }

    public boolean succeeded() {
        return status == PhaseStatus.SUCCESS;
    }
}
