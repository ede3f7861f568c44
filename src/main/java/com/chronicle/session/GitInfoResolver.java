package com.chronicle.session;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the current branch and commit by running {@code git} in the project directory.
 * Any failure yields {@link GitInfo#none()}.
 */
public class GitInfoResolver {

    private static final Logger logger = LoggerFactory.getLogger(GitInfoResolver.class);

    private final boolean enabled;
    private final long timeoutMs;

    public GitInfoResolver(boolean enabled, long timeoutMs) {
        this.enabled = enabled;
        this.timeoutMs = Math.max(100, timeoutMs);
    }

    public GitInfo resolve(Path directory) {
        if (!enabled || directory == null || !Files.isDirectory(directory)) {
            return GitInfo.none();
        }
        Optional<String> branch = git(directory, "rev-parse", "--abbrev-ref", "HEAD");
        if (branch.isEmpty()) {
            return GitInfo.none();
        }
        Optional<String> commit = git(directory, "rev-parse", "--short=12", "HEAD");
        return new GitInfo(branch.get(), commit.orElse(null));
    }

    private Optional<String> git(Path directory, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(directory.toFile())
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            logger.debug("git unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        try {
            process.getOutputStream().close();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                logger.debug("git {} timed out after {} ms", args[0], timeoutMs);
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                return Optional.empty();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
            return output.isEmpty() ? Optional.empty() : Optional.of(output);
        } catch (IOException e) {
            process.destroyForcibly();
            logger.debug("git {} failed: {}", args[0], e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
