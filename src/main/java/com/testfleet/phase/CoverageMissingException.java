package com.testfleet.phase;

import java.nio.file.Path;

/**
 * A coverage-producing phase exited cleanly but left no fresh coverage artifact.
 */
public class CoverageMissingException extends PhaseExecutionException {

    private final Path expected;

    public CoverageMissingException(String phaseName, Path expected) {
        super(phaseName, "Phase " + phaseName + " succeeded but produced no coverage artifact at " + expected);
        this.expected = expected;
    }

    public Path expected() {
        return expected;
    }
}
