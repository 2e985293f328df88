package com.testfleet.phase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through a POSIX shell ({@code sh -c}), so phase definitions can
 * use pipes, globbing and command substitution.
 */
public class ShellCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandExecutor.class);

    private final String shell;

    public ShellCommandExecutor(String shell) {
        this.shell = shell;
    }

    @Override
    public int execute(String command, Path workDir, Map<String, String> env, Path logFile, Duration timeout) {
        appendLine(logFile, "$ " + command);
        log.debug("Running: {} (in {})", command, workDir);

        var builder = new ProcessBuilder(shell, "-c", command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        builder.environment().clear();
        builder.environment().putAll(env);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            appendLine(logFile, "! could not start: " + e.getMessage());
            throw new PhaseExecutionException(null, "Could not start '" + command + "': " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Command exceeded {} and was killed: {}", timeout, command);
                killTree(process);
                process.waitFor(10, TimeUnit.SECONDS);
                appendLine(logFile, "! killed after " + timeout);
                return TIMED_OUT;
            }
            int exit = process.exitValue();
            appendLine(logFile, "# exit " + exit);
            return exit;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killTree(process);
            throw new PhaseExecutionException(null, "Interrupted while running '" + command + "'", e);
        }
    }

    // The shell's children (pytest, xargs workers) outlive it otherwise and keep writing to the
    // log and the coverage file while the next phase runs.
    static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void appendLine(Path logFile, String line) {
        try {
            Files.writeString(logFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not write to phase log {}: {}", logFile, e.getMessage());
        }
    }
}
