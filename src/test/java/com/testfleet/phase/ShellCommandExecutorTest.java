package com.testfleet.phase;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ShellCommandExecutorTest {

    @TempDir
    Path workDir;

    private final ShellCommandExecutor executor = new ShellCommandExecutor("/bin/sh");

    private Map<String, String> env() {
        return Map.of("PATH", System.getenv().getOrDefault("PATH", "/usr/bin:/bin"), "GREETING", "hello");
    }

    @Test
    void capturesOutputAndExitCode() throws Exception {
        Path log = workDir.resolve("phase.log");

        int exit = executor.execute("echo \"$GREETING\"; echo oops >&2; exit 3", workDir, env(), log,
                Duration.ofSeconds(10));

        assertEquals(3, exit);
        String output = Files.readString(log);
        assertTrue(output.contains("hello"));
        assertTrue(output.contains("oops"));
        assertTrue(output.contains("# exit 3"));
    }

    @Test
    void environmentIsExplicit() throws Exception {
        Path log = workDir.resolve("env.log");

        executor.execute("echo \"user=[$USER]\"", workDir, env(), log, Duration.ofSeconds(10));

        assertTrue(Files.readString(log).contains("user=[]"));
    }

    @Test
    void runsInWorkingDirectory() throws Exception {
        Path log = workDir.resolve("pwd.log");

        int exit = executor.execute("touch marker", workDir, env(), log, Duration.ofSeconds(10));

        assertEquals(0, exit);
        assertTrue(Files.exists(workDir.resolve("marker")));
    }

    @Test
    void killsCommandOnTimeout() {
        Path log = workDir.resolve("slow.log");

        int exit = executor.execute("sleep 5", workDir, env(), log, Duration.ofMillis(200));

        assertEquals(CommandExecutor.TIMED_OUT, exit);
    }

    @Test
    void timeoutKillsBackgroundChildrenToo() throws Exception {
        Path log = workDir.resolve("tree.log");

        int exit = executor.execute("(sleep 1; touch late-write) & sleep 5", workDir, env(), log,
                Duration.ofMillis(200));
        Thread.sleep(1_500);

        assertEquals(CommandExecutor.TIMED_OUT, exit);
        assertFalse(Files.exists(workDir.resolve("late-write")), "child of the shell survived the timeout");
    }

    @Test
    void missingShellIsAnExecutionError() {
        var broken = new ShellCommandExecutor("/no/such/shell");

        assertThrows(PhaseExecutionException.class,
                () -> broken.execute("true", workDir, env(), workDir.resolve("x.log"), Duration.ofSeconds(1)));
    }
}
