package com.testfleet.core.identity;

import com.testfleet.core.model.BuildIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives the {@link BuildIdentity} of the checkout under test.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessBuilder}
 * rather than depending on JGit. The first successful resolution is memoised,
 * so every caller in the same process sees the same identity.
 */
public class BuildIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(BuildIdentityResolver.class);

    private static final Pattern SHORT_HASH = Pattern.compile("^[0-9a-f]{4,40}$");

    private final Path workDir;
    private volatile BuildIdentity resolved;

    public BuildIdentityResolver(Path workDir) {
        this.workDir = workDir;
    }

    /**
     * Resolves commit count and short revision of HEAD.
     *
     * @throws IdentityException if git is unavailable, the checkout is shallow,
     *                           or there is no commit history
     */
    public synchronized BuildIdentity resolve() {
        if (resolved != null) {
            return resolved;
        }

        var shallow = runGitOutput("rev-parse", "--is-shallow-repository");
        if (shallow.exitCode() != 0) {
            throw new IdentityException("Not a git working tree: " + workDir.toAbsolutePath()
                    + " (" + shallow.output() + ")");
        }
        if ("true".equals(shallow.output())) {
            throw new IdentityException("Checkout at " + workDir.toAbsolutePath()
                    + " is shallow; commit count would be truncated");
        }

        var count = runGitOutput("rev-list", "--count", "HEAD");
        if (count.exitCode() != 0) {
            throw new IdentityException("Working tree has no commit history (" + count.output() + ")");
        }
        long commitCount;
        try {
            commitCount = Long.parseLong(count.output());
        } catch (NumberFormatException e) {
            throw new IdentityException("Unexpected output from git rev-list: '" + count.output() + "'", e);
        }
        if (commitCount <= 0) {
            throw new IdentityException("Working tree has no commit history");
        }

        var revision = runGitOutput("rev-parse", "--short", "HEAD");
        if (revision.exitCode() != 0 || !SHORT_HASH.matcher(revision.output()).matches()) {
            throw new IdentityException("Could not resolve short revision of HEAD: '" + revision.output() + "'");
        }

        resolved = new BuildIdentity(commitCount, revision.output());
        log.info("Resolved build identity {} in {}", resolved, workDir.toAbsolutePath());
        return resolved;
    }

    /** Version string of the git binary, e.g. {@code git version 2.43.0}. */
    public String gitVersion() {
        var version = runGitOutput("--version");
        if (version.exitCode() != 0) {
            throw new IdentityException("git --version failed: " + version.output());
        }
        return version.output();
    }

    /**
     * Output of one git invocation.
     *
     * @param exitCode process exit code
     * @param output   trimmed stdout, or stderr when the command failed
     */
    record GitOutput(int exitCode, String output) {}

    /**
     * Runs a git command in the working directory and captures its output.
     *
     * @param args git arguments (e.g. "rev-parse", "--short", "HEAD")
     */
    GitOutput runGitOutput(String... args) {
        var command = new ArrayList<String>(List.of("git"));
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();

            String stdout;
            String stderr;
            try (var out = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
                 var err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                stdout = out.lines().collect(Collectors.joining("\n")).trim();
                stderr = err.lines().collect(Collectors.joining("\n")).trim();
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("git exited with code {}: {}", exitCode, stderr);
                return new GitOutput(exitCode, stderr);
            }
            return new GitOutput(exitCode, stdout);
        } catch (IOException e) {
            throw new IdentityException("git could not be started in " + workDir.toAbsolutePath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityException("Interrupted while running git", e);
        }
    }
}
