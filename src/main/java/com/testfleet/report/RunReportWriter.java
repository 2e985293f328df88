package com.testfleet.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testfleet.core.model.PhaseResult;
import com.testfleet.core.model.PipelineRun;
import com.testfleet.core.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Writes {@code run-summary.json} next to the phase logs of a run.
 */
public class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    static final String FILE_NAME = "run-summary.json";

    private final Path logDir;
    private final ObjectMapper objectMapper;

    public RunReportWriter(Path logDir) {
        this.logDir = logDir;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Writes the summary. A failure to write is logged and reported as empty;
     * the run outcome does not depend on it.
     */
    public Optional<Path> write(PipelineRun run) {
        Path target = logDir.resolve(run.runId()).resolve(FILE_NAME);
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), toJson(run));
            log.info("Run summary written to {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Could not write run summary to {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }

    ObjectNode toJson(PipelineRun run) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("runId", run.runId());
        root.putPOJO("startedAt", run.startedAt());
        root.putPOJO("finishedAt", run.finishedAt());
        root.put("state", run.state().name());
        root.put("overallStatus", run.overallStatus().name());
        if (run.identity() != null) {
            ObjectNode identity = root.putObject("identity");
            identity.put("commitCount", run.identity().commitCount());
            identity.put("shortRevision", run.identity().shortRevision());
        }
        if (run.abortReason() != null) {
            root.put("abortReason", run.abortReason());
        }

        ArrayNode services = root.putArray("services");
        for (ServiceInstance instance : run.services()) {
            ObjectNode node = services.addObject();
            node.put("name", instance.name());
            node.put("image", instance.spec().image());
            node.put("state", instance.state().name());
            if (instance.failureCause() != null) {
                node.put("failureCause", instance.failureCause());
            }
        }

        ArrayNode phases = root.putArray("phases");
        for (PhaseResult result : run.phaseResults()) {
            ObjectNode node = phases.addObject();
            node.put("name", result.phase().name());
            node.put("status", result.status().name());
            node.put("exitCode", result.exitCode());
            node.put("durationMs", result.duration().toMillis());
            if (result.failedCommand() != null) {
                node.put("failedCommand", result.failedCommand());
            }
            if (result.failureReason() != null) {
                node.put("failureReason", result.failureReason());
            }
            result.coverageArtifact().ifPresent(p -> node.put("coverageArtifact", p.toString()));
            if (result.logRef() != null) {
                node.put("log", result.logRef().toString());
            }
        }

        var finalization = run.finalization();
        ObjectNode fin = root.putObject("finalization");
        fin.put("attempted", finalization.attempted());
        fin.put("acknowledged", finalization.acknowledged());
        fin.put("attempts", finalization.attempts());
        fin.put("httpStatus", finalization.httpStatus());
        fin.put("message", finalization.message());
        return root;
    }
}
