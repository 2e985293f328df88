package com.testfleet.phase;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runs one phase command as an external process.
 */
public interface CommandExecutor {

    /** Exit code reported when a command is killed for exceeding its timeout. */
    int TIMED_OUT = -1;

    /**
     * Runs {@code command} with exactly {@code env} as its environment, appending
     * stdout and stderr to {@code logFile}.
     *
     * @return the process exit code, or {@link #TIMED_OUT}
     * @throws PhaseExecutionException if the process cannot be started
     */
    int execute(String command, Path workDir, Map<String, String> env, Path logFile, Duration timeout);
}
