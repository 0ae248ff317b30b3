package io.huskytests.core.engine;

import io.huskytests.core.filter.TestFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Buffers diagnostic entries as XML fragments and writes them to
 * {@code D_<assemblyName>.dump} on request.
 */
public final class XmlDiagnosticDump implements DiagnosticDump {

    private static final Logger log = LoggerFactory.getLogger(XmlDiagnosticDump.class);

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public synchronized void startExecution(TestFilter filter, String phase) {
        appendFilter("Execution", filter, phase);
    }

    @Override
    public synchronized void addString(String text) {
        buffer.append(text);
    }

    @Override
    public synchronized void dumpExternalFilter(TestFilter filter, String phase) {
        appendFilter("ExternalFilter", filter, phase);
    }

    public synchronized String contents() {
        return buffer.toString();
    }

    /**
     * @return the written file
     */
    public synchronized Path writeTo(Path folder, String assemblyName) {
        Path target = folder.resolve("D_" + assemblyName + ".dump");
        try {
            Files.createDirectories(folder);
            Files.writeString(target, buffer, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write diagnostic dump to " + target, e);
        }
        log.debug("Diagnostic dump written to {}", target);
        return target;
    }

    private void appendFilter(String element, TestFilter filter, String phase) {
        buffer.append('<').append(element).append(" phase=\"").append(escape(phase)).append("\">")
                .append(escape(filter.toString()))
                .append("</").append(element).append(">\n");
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
