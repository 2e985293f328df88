package com.testfleet.report;

/**
 * Successful answer of the reporting webhook.
 */
public record FinalizationAck(int httpStatus, String body, int attempts) {
}
