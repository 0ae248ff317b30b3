package io.huskytests.core.engine;

import io.huskytests.core.filter.TestFilter;

import java.nio.file.Path;

/**
 * Handle on the underlying test engine for in-process runs.
 */
public interface TestEngineAdapter {

    /**
     * Runs the tests selected by {@code filter}, reporting each finished test to
     * {@code listener}. Blocks until the run completes or is cancelled.
     */
    EngineRunResult run(TestEventListener listener, TestFilter filter);

    /**
     * Writes the structured XML result file for a completed run into {@code outputFolder}.
     */
    void generateTestOutput(EngineRunResult result, Path assemblyPath, Path outputFolder);

    /**
     * @return true once the caller has asked for the in-flight run to stop
     */
    boolean isCancellationRequested();
}
