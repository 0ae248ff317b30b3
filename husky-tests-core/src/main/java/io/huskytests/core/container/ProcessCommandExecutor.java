package io.huskytests.core.container;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs commands as child processes via {@link ProcessBuilder}.
 */
public final class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    @Override
    public CommandResult execute(ContainerCommand command) {
        ProcessBuilder pb = new ProcessBuilder(command.argv())
                .directory(command.workingDirectory().toFile());
        log.debug("Starting {}", command);

        long start = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ContainerCommandException(command.commandLine(), "Unable to start command", e);
        }

        // Drain stderr on a separate thread so a chatty child cannot block on a full pipe
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            String stdout = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            Duration runTime = Duration.ofNanos(System.nanoTime() - start);
            return new CommandResult(exitCode, stdout, stderr.join(), runTime);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ContainerCommandException(command.commandLine(), "Interrupted while waiting for command", e);
        } catch (UncheckedIOException | CompletionException e) {
            process.destroyForcibly();
            throw new ContainerCommandException(command.commandLine(), "Unable to read command output", e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
