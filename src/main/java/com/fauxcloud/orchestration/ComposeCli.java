package com.fauxcloud.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code docker compose} against a descriptor file.
 *
 * <p>Shells out via {@link ProcessBuilder}; docker-java has no compose support.
 */
public class ComposeCli {

    private static final Logger log = LoggerFactory.getLogger(ComposeCli.class);

    private final String dockerCommand;
    private final int timeoutSeconds;

    public ComposeCli(String dockerCommand, int timeoutSeconds) {
        this.dockerCommand = dockerCommand;
        this.timeoutSeconds = timeoutSeconds;
    }

    public ProcessResult up(Path composeFile, String project) {
        return run(composeFile, project, "up", "-d");
    }

    public ProcessResult down(Path composeFile, String project, boolean removeVolumes) {
        return removeVolumes
                ? run(composeFile, project, "down", "-v", "--remove-orphans")
                : run(composeFile, project, "down");
    }

    /**
     * Ids of the project's containers, one per line.
     */
    public ProcessResult containerIds(Path composeFile, String project) {
        return run(composeFile, project, "ps", "-q");
    }

    ProcessResult run(Path composeFile, String project, String... args) {
        var command = new ArrayList<String>(List.of(dockerCommand, "compose", "-f", composeFile.toString(), "-p", project));
        command.addAll(List.of(args));
        log.debug("Running {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(composeFile.getParent().toFile())
                    .start();
        } catch (IOException e) {
            return new ProcessResult(-1, "", "Failed to launch " + dockerCommand + ": " + e.getMessage());
        }

        // Drain both streams concurrently so a full pipe cannot block the child
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new ProcessResult(-1, stdout.getNow(""),
                        "docker compose %s timed out after %ds".formatted(args[0], timeoutSeconds));
            }
            return new ProcessResult(process.exitValue(), stdout.join(), stderr.join());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ProcessResult(-1, "", "Interrupted while running docker compose " + args[0]);
        }
    }

    private static String read(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
