package com.testfleet.phase;

import com.testfleet.core.model.PhaseResult;
import com.testfleet.core.model.PhaseSpec;
import com.testfleet.core.model.PhaseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one phase: its commands in order, against the services already running.
 *
 * <p>Flow: open log file -> expand placeholders -> run commands until one fails ->
 * check coverage artifact -> build {@link PhaseResult}.
 *
 * <p>Failures never escape as exceptions; they become a FAILURE result so that the
 * orchestrator can keep going with the next phase.
 */
public class PhaseRunner {

    private static final Logger log = LoggerFactory.getLogger(PhaseRunner.class);

    static final String FILTER_ENV = "TESTFLEET_FILTER";
    static final String PHASE_ENV = "TESTFLEET_PHASE";

    private final CommandExecutor executor;
    private final Path workDir;
    private final Path logDir;
    private final int jobs;

    public PhaseRunner(CommandExecutor executor, Path workDir, Path logDir, int jobs) {
        this.executor = executor;
        this.workDir = workDir;
        this.logDir = logDir;
        this.jobs = jobs;
    }

    /**
     * Runs a phase and records its outcome.
     *
     * @param runId run the phase belongs to; the log lands in {@code <logDir>/<runId>/<phase>.log}
     * @param phase the phase to run
     * @param env   the complete environment for the phase commands
     * @return the phase result, SUCCESS or FAILURE
     */
    public PhaseResult run(String runId, PhaseSpec phase, Map<String, String> env) {
        Instant startedAt = Instant.now();
        Path logFile;
        try {
            logFile = openLog(runId, phase);
        } catch (IOException e) {
            log.error("Cannot create log for phase {}", phase.name(), e);
            return failure(phase, -1, null, "cannot create phase log: " + e.getMessage(), null, startedAt);
        }

        var phaseEnv = new LinkedHashMap<>(env);
        phaseEnv.put(PHASE_ENV, phase.name());
        phase.filterExpression().ifPresent(f -> phaseEnv.put(FILTER_ENV, f));
        String filter = phase.filterExpression().orElse(null);

        log.info("Phase {} starting ({} commands{})", phase.name(), phase.commands().size(),
                filter != null ? ", filter " + filter : "");

        int exitCode = -1;
        for (String template : phase.commands()) {
            String command = CommandTemplate.expand(template, filter, jobs);
            try {
                exitCode = executor.execute(command, workDir, phaseEnv, logFile, phase.timeout());
            } catch (PhaseExecutionException e) {
                log.warn("Phase {} could not run '{}': {}", phase.name(), command, e.getMessage());
                return failure(phase, -1, command, e.getMessage(), logFile, startedAt);
            }
            if (exitCode != 0) {
                String reason = exitCode == CommandExecutor.TIMED_OUT
                        ? "timed out after " + phase.timeout()
                        : "exited with code " + exitCode;
                log.warn("Phase {} failed: '{}' {}", phase.name(), command, reason);
                return failure(phase, exitCode, command, reason, logFile, startedAt);
            }
        }

        Optional<Path> coverage = Optional.empty();
        if (phase.producesCoverage()) {
            try {
                coverage = Optional.of(requireCoverage(phase, startedAt));
            } catch (CoverageMissingException e) {
                log.warn(e.getMessage());
                return failure(phase, exitCode, null, e.getMessage(), logFile, startedAt);
            }
        }

        var duration = Duration.between(startedAt, Instant.now());
        log.info("Phase {} passed in {}ms (log: {})", phase.name(), duration.toMillis(), logFile);
        return new PhaseResult(phase, PhaseStatus.SUCCESS, exitCode, null, null, coverage, logFile, duration);
    }

    /**
     * Returns the coverage artifact if it exists and was written during this phase.
     * A leftover from an earlier phase does not count.
     */
    Path requireCoverage(PhaseSpec phase, Instant startedAt) {
        Path artifact = workDir.resolve(phase.coverageArtifact());
        try {
            if (Files.exists(artifact)) {
                Instant modified = Files.getLastModifiedTime(artifact).toInstant();
                // filesystem timestamps may only have second precision
                if (!modified.isBefore(startedAt.truncatedTo(ChronoUnit.SECONDS))) {
                    return artifact;
                }
                log.debug("Coverage artifact {} is stale (modified {})", artifact, modified);
            }
        } catch (IOException e) {
            log.debug("Cannot read coverage artifact {}: {}", artifact, e.getMessage());
        }
        throw new CoverageMissingException(phase.name(), artifact);
    }

    private Path openLog(String runId, PhaseSpec phase) throws IOException {
        Path dir = logDir.resolve(runId);
        Files.createDirectories(dir);
        Path logFile = dir.resolve(phase.name() + ".log");
        Files.writeString(logFile, "# phase " + phase.name() + " started " + Instant.now()
                + System.lineSeparator(), StandardCharsets.UTF_8);
        return logFile;
    }

    private static PhaseResult failure(PhaseSpec phase, int exitCode, String command, String reason,
                                       Path logFile, Instant startedAt) {
        return new PhaseResult(phase, PhaseStatus.FAILURE, exitCode, command, reason,
                Optional.empty(), logFile, Duration.between(startedAt, Instant.now()));
    }
}
