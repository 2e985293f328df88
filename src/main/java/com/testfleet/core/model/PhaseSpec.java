package com.testfleet.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One named stage of test or lint execution.
 *
 * @param name             phase name, also used for the log file
 * @param commands         shell commands run in order
 * @param filterExpression test selection handed to the commands untouched
 * @param producesCoverage whether a coverage artifact must exist after success
 * @param coverageArtifact artifact path, relative to the working directory
 * @param blocking         skip the remaining phases when this one fails
 * @param timeout          wall-clock limit for each command
 */
public record PhaseSpec(
    String name,
    List<String> commands,
    Optional<String> filterExpression,
    boolean producesCoverage,
    Path coverageArtifact,
    boolean blocking,
    Duration timeout
) {
    public PhaseSpec {
        commands = List.copyOf(commands);
        filterExpression = filterExpression != null ? filterExpression : Optional.empty();
        coverageArtifact = coverageArtifact != null ? coverageArtifact : Path.of(".coverage");
        timeout = timeout != null ? timeout : Duration.ofHours(1);
    }

    public static PhaseSpec of(String name, List<String> commands) {
        return new PhaseSpec(name, commands, Optional.empty(), false, null, false, null);
    }
}
