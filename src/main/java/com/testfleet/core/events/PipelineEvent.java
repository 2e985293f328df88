package com.testfleet.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pipeline run, consumed by the CLI progress view.
 *
 * @param eventType event type (e.g. "run.started", "service.ready", "phase.completed")
 * @param runId     the run this event belongs to
 * @param subject   service or phase name the event relates to (null for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String subject,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static PipelineEvent of(String eventType, String runId, String subject,
                                   Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, subject, payload, Instant.now());
    }
}
