package com.testfleet.core.model;

/**
 * Correlation key tying one pipeline run to its reported results.
 *
 * @param commitCount   number of commits reachable from HEAD
 * @param shortRevision abbreviated hash of HEAD
 */
public record BuildIdentity(
    long commitCount,
    String shortRevision
) {

    public String buildNumber(BuildNumberSource source) {
        return source == BuildNumberSource.COMMIT_COUNT
                ? String.valueOf(commitCount)
                : shortRevision;
    }

    @Override
    public String toString() {
        return shortRevision + " (#" + commitCount + ")";
    }
}
