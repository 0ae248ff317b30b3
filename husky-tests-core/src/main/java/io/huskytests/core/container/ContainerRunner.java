package io.huskytests.core.container;

import io.huskytests.core.config.ContainerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives the container runtime: builds the test image, runs the test container
 * with a mounted result directory, and locates the result file it leaves behind.
 *
 * <p>Runs against one result directory must be serialized by the caller.
 */
public final class ContainerRunner {

    private static final Logger log = LoggerFactory.getLogger(ContainerRunner.class);

    static final String FILTER_CLAUSE = "FullyQualifiedName=";

    private final ContainerSettings settings;
    private final CommandExecutor executor;

    public ContainerRunner(ContainerSettings settings, CommandExecutor executor) {
        this.settings = settings;
        this.executor = executor;
    }

    public ContainerSettings settings() {
        return settings;
    }

    /**
     * Creates the host-side result directory under {@code assemblyDir}, or reuses it.
     */
    public Path prepareResultDirectory(Path assemblyDir) {
        Path resultDir = assemblyDir.resolve(settings.hostResultFolder()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(resultDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create result directory " + resultDir, e);
        }
        return resultDir;
    }

    public ContainerCommand buildImageCommand(Path contextDir) {
        return ContainerCommand.builder(settings.runtime())
                .arg("build")
                .option("-t", settings.imageName())
                .arg(".")
                .workingDirectory(contextDir)
                .build();
    }

    /**
     * Builds the test image from {@code contextDir}.
     *
     * @throws ContainerCommandException when the build exits non-zero
     */
    public void buildImage(Path contextDir) {
        log.info("Building test image '{}' from {}", settings.imageName(), contextDir);
        execute(buildImageCommand(contextDir), true);
    }

    public ContainerCommand runTestsCommand(Path assemblyDir, String assemblyName, Path hostResultDir,
                                            Collection<String> testNames) {
        String containerDir = settings.containerResultDirectory();
        return ContainerCommand.builder(settings.runtime())
                .arg("run")
                .arg("--rm")
                .option("--name", settings.containerName())
                .option("--network", settings.networkName())
                .quotedOption("-v", hostResultDir + ":" + containerDir)
                .arg(settings.imageName())
                .arg(assemblyName)
                .quotedOption("--filter", filterExpression(testNames))
                .arg("--")
                .arg(settings.resultPathOption() + "=" + containerDir)
                .workingDirectory(assemblyDir)
                .build();
    }

    /**
     * Runs the selected tests inside the test container and waits for it to exit.
     * A non-zero exit is expected when tests fail, so it is logged rather than raised.
     */
    public CommandResult runTests(Path assemblyDir, String assemblyName, Path hostResultDir,
                                  Collection<String> testNames) {
        log.info("Running {} test(s) of {} in container '{}'", testNames.size(), assemblyName, settings.containerName());
        return execute(runTestsCommand(assemblyDir, assemblyName, hostResultDir, testNames), false);
    }

    /**
     * Finds the result file written by the container.
     *
     * @throws ResultArtifactException when the directory holds no file
     */
    public Path locateResultArtifact(Path hostResultDir) {
        List<Path> files;
        try (Stream<Path> entries = Files.list(hostResultDir)) {
            files = entries.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException e) {
            throw new ResultArtifactException("Unable to list result directory " + hostResultDir, e);
        }
        if (files.isEmpty()) {
            throw new ResultArtifactException("No result file was written to " + hostResultDir);
        }
        if (files.size() == 1) {
            return files.get(0);
        }
        Path newest = files.stream().max(Comparator.comparing(ContainerRunner::lastModified)).orElseThrow();
        log.warn("Found {} result files in {}; using the most recent: {}", files.size(), hostResultDir, newest.getFileName());
        return newest;
    }

    /**
     * {@code FullyQualifiedName=a|FullyQualifiedName=b|...}
     */
    public static String filterExpression(Collection<String> testNames) {
        return testNames.stream()
                .map(name -> FILTER_CLAUSE + name)
                .collect(Collectors.joining("|"));
    }

    private CommandResult execute(ContainerCommand command, boolean validateSuccess) {
        CommandResult result = executor.execute(command);
        log.debug("Ran {} in {}ms with result:\n{}", command.commandLine(), result.runTime().toMillis(), result.stdout());

        if (!result.isSuccess()) {
            if (validateSuccess) {
                log.error("Command failed with exit code {}: {}", result.exitCode(), command.commandLine());
                throw new ContainerCommandException(command.commandLine(), result);
            }
            log.warn("Command returned non-zero exit code {}: {}\n{}", result.exitCode(), command.commandLine(), result.stderr());
        }
        return result;
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            throw new ResultArtifactException("Unable to read modification time of " + file, e);
        }
    }
}
