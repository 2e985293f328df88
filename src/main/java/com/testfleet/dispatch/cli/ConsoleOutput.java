package com.testfleet.dispatch.cli;

import com.testfleet.core.events.PipelineEvent;
import com.testfleet.core.model.PhaseResult;
import com.testfleet.core.model.PipelineRun;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the testfleet CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TESTFLEET v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TESTFLEET]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started", "run.completed" -> "@|fg(cyan) [RUN]|@";
            case "service.starting", "service.stopped" -> "@|fg(magenta) [SERVICE]|@";
            case "service.ready" -> "@|fg(green) [SERVICE]|@";
            case "service.failed" -> "@|fg(red),bold [SERVICE]|@";
            case "phase.started" -> "@|fg(blue) [PHASE]|@";
            case "phase.completed" -> "@|bold,fg(blue) [PHASE]|@";
            case "run.finalized" -> "@|fg(green),bold [REPORT]|@";
            case "run.finalization_failed" -> "@|fg(red),bold [REPORT]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.subject() != null ? event.subject() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + event.eventType().substring(event.eventType().indexOf('.') + 1)
                        + (event.payload().isEmpty() ? "" : " " + event.payload())));
    }

    public static void phaseResult(PhaseResult result) {
        String status = switch (result.status()) {
            case SUCCESS -> "@|fg(green) PASS|@";
            case FAILURE -> "@|fg(red) FAIL|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
        };
        var line = new StringBuilder("  " + status + " " + result.phase().name());
        if (result.duration().toMillis() > 0) {
            line.append(" (").append(formatDuration(result.duration().toMillis())).append(")");
        }
        if (result.failureReason() != null) {
            line.append(" ").append(result.failureReason());
        }
        if (result.failedCommand() != null) {
            line.append(": ").append(result.failedCommand());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
        if (result.logRef() != null && !result.succeeded()) {
            System.out.println("       log: " + result.logRef());
        }
    }

    public static void summary(PipelineRun run) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + run.runId() + "|@"));
        if (run.identity() != null) {
            System.out.println("  Build: " + run.identity());
        }
        for (var result : run.phaseResults()) {
            phaseResult(result);
        }
        var fin = run.finalization();
        if (!fin.attempted()) {
            System.out.println("  Report: not sent (" + fin.message() + ")");
        } else if (fin.acknowledged()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Report: @|fg(green) acknowledged|@ (HTTP " + fin.httpStatus() + ", "
                            + fin.attempts() + " attempt" + (fin.attempts() != 1 ? "s" : "") + ")"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Report: @|fg(red) failed|@ " + fin.message()));
        }
        if (run.abortReason() != null) {
            System.out.println("  Aborted: " + run.abortReason());
        }
        String color = switch (run.overallStatus()) {
            case SUCCESS -> "fg(green)";
            case PARTIAL_FAILURE -> "fg(red)";
            default -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Status: @|bold," + color + " " + run.overallStatus() + "|@ (state " + run.state() + ")"));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
