package com.testfleet.core.model;

import java.util.Locale;

/**
 * Which part of the {@link BuildIdentity} is reported as the build number.
 */
public enum BuildNumberSource {
    REVISION,
    COMMIT_COUNT;

    /** Accepts {@code revision}, {@code commit-count} or {@code commit_count}, any case. */
    public static BuildNumberSource parse(String value) {
        if (value == null || value.isBlank()) {
            return REVISION;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
