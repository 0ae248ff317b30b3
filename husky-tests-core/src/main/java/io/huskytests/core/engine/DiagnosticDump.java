package io.huskytests.core.engine;

import io.huskytests.core.filter.TestFilter;

/**
 * Sink for diagnostic traces of what a run was asked to do.
 */
public interface DiagnosticDump {

    void startExecution(TestFilter filter, String phase);

    void addString(String text);

    void dumpExternalFilter(TestFilter filter, String phase);
}
