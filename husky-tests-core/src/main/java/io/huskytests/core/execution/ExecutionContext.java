package io.huskytests.core.execution;

import io.huskytests.core.config.RunnerSettings;
import io.huskytests.core.engine.DiagnosticDump;
import io.huskytests.core.engine.TestEngineAdapter;
import io.huskytests.core.filter.ExternalTestFilter;
import io.huskytests.core.model.TestResultRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Collaborators a strategy needs for one run. Owned by the caller; strategies
 * only read it.
 *
 * @param runLog              host-facing message log
 * @param engineAdapter       the in-process test engine
 * @param testOutputXmlFolder where result XML is written; relative paths resolve against the assembly directory
 * @param settings            runner settings
 * @param dump                diagnostic sink, or {@code null} when diagnostics are off
 * @param externalFilter      filter supplied by the calling runner, or {@code null}
 * @param recorder            the host's result-recording API
 */
public record ExecutionContext(
        Logger runLog,
        TestEngineAdapter engineAdapter,
        Path testOutputXmlFolder,
        RunnerSettings settings,
        DiagnosticDump dump,
        ExternalTestFilter externalFilter,
        TestResultRecorder recorder
) {

    public static final String RUN_LOG_NAME = "husky.run";

    public ExecutionContext {
        if (engineAdapter == null || settings == null || recorder == null) {
            throw new IllegalArgumentException("engineAdapter, settings and recorder are required");
        }
        if (runLog == null) {
            runLog = LoggerFactory.getLogger(RUN_LOG_NAME);
        }
        if (testOutputXmlFolder == null) {
            testOutputXmlFolder = Path.of(settings.testOutputXmlFolder());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasExternalFilter() {
        return externalFilter != null && !externalFilter.isEmpty();
    }

    /**
     * Output folder for the given assembly.
     */
    public Path resolveOutputFolder(Path assemblyPath) {
        if (testOutputXmlFolder.isAbsolute()) {
            return testOutputXmlFolder;
        }
        Path assemblyDir = assemblyPath.toAbsolutePath().getParent();
        return assemblyDir == null ? testOutputXmlFolder.toAbsolutePath() : assemblyDir.resolve(testOutputXmlFolder);
    }

    public static final class Builder {
        private Logger runLog;
        private TestEngineAdapter engineAdapter;
        private Path testOutputXmlFolder;
        private RunnerSettings settings = RunnerSettings.builder().build();
        private DiagnosticDump dump;
        private ExternalTestFilter externalFilter;
        private TestResultRecorder recorder;

        public Builder runLog(Logger v) { this.runLog = v; return this; }
        public Builder engineAdapter(TestEngineAdapter v) { this.engineAdapter = v; return this; }
        public Builder testOutputXmlFolder(Path v) { this.testOutputXmlFolder = v; return this; }
        public Builder settings(RunnerSettings v) { this.settings = v; return this; }
        public Builder dump(DiagnosticDump v) { this.dump = v; return this; }
        public Builder externalFilter(ExternalTestFilter v) { this.externalFilter = v; return this; }
        public Builder recorder(TestResultRecorder v) { this.recorder = v; return this; }

        public ExecutionContext build() {
            return new ExecutionContext(runLog, engineAdapter, testOutputXmlFolder, settings, dump, externalFilter, recorder);
        }
    }
}
