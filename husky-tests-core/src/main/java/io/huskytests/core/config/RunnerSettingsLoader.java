package io.huskytests.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads {@code husky.*} keys into {@link RunnerSettings} and {@link ContainerSettings}.
 *
 * <p>Missing keys keep the builder defaults; unknown keys are ignored.
 * <pre>
 *   husky.designMode=false
 *   husky.discoveryMethod=CURRENT
 *   husky.useNativeFilter=false
 *   husky.assemblySelectLimit=2000
 *   husky.testOutputXmlFolder=TestResults
 *   husky.dumpXmlTestResults=false
 *   husky.container.runtime=docker
 *   husky.container.imageName=husky-test-image
 *   ...
 * </pre>
 */
public final class RunnerSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(RunnerSettingsLoader.class);

    public static final String PREFIX = "husky.";
    private static final String CONTAINER_PREFIX = PREFIX + "container.";

    private final Properties properties;

    public RunnerSettingsLoader(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads {@code file} when it exists, then lets system properties override it.
     */
    public static RunnerSettingsLoader fromFileAndSystem(Path file) {
        Properties merged = new Properties();
        if (file != null && Files.isRegularFile(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                merged.load(reader);
                log.debug("Loaded runner settings from {}", file);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read runner settings from " + file, e);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) {
                merged.setProperty(key, System.getProperty(key));
            }
        }
        return new RunnerSettingsLoader(merged);
    }

    public RunnerSettings runnerSettings() {
        RunnerSettings.Builder builder = RunnerSettings.builder();
        String v;
        if ((v = value("designMode")) != null) builder.designMode(parseBoolean("designMode", v));
        if ((v = value("discoveryMethod")) != null) builder.discoveryMethod(parseDiscoveryMethod(v));
        if ((v = value("useNativeFilter")) != null) builder.useNativeFilter(parseBoolean("useNativeFilter", v));
        if ((v = value("assemblySelectLimit")) != null) builder.assemblySelectLimit(parseInt("assemblySelectLimit", v));
        if ((v = value("testOutputXmlFolder")) != null) builder.testOutputXmlFolder(v);
        if ((v = value("dumpXmlTestResults")) != null) builder.dumpXmlTestResults(parseBoolean("dumpXmlTestResults", v));
        RunnerSettings settings = builder.build();
        log.debug("Runner settings: {}", settings);
        return settings;
    }

    public ContainerSettings containerSettings() {
        ContainerSettings.Builder builder = ContainerSettings.builder();
        String v;
        if ((v = containerValue("runtime")) != null) builder.runtime(v);
        if ((v = containerValue("imageName")) != null) builder.imageName(v);
        if ((v = containerValue("containerName")) != null) builder.containerName(v);
        if ((v = containerValue("networkName")) != null) builder.networkName(v);
        if ((v = containerValue("hostResultFolder")) != null) builder.hostResultFolder(v);
        if ((v = containerValue("containerResultDirectory")) != null) builder.containerResultDirectory(v);
        if ((v = containerValue("resultPathOption")) != null) builder.resultPathOption(v);
        return builder.build();
    }

    private String value(String key) {
        String raw = properties.getProperty(PREFIX + key);
        return raw == null ? null : raw.trim();
    }

    private String containerValue(String key) {
        String raw = properties.getProperty(CONTAINER_PREFIX + key);
        return raw == null ? null : raw.trim();
    }

    private static boolean parseBoolean(String key, String raw) {
        if ("true".equalsIgnoreCase(raw)) return true;
        if ("false".equalsIgnoreCase(raw)) return false;
        throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + raw);
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + raw, e);
        }
    }

    private static DiscoveryMethod parseDiscoveryMethod(String raw) {
        try {
            return DiscoveryMethod.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + "discoveryMethod: " + raw, e);
        }
    }
}
