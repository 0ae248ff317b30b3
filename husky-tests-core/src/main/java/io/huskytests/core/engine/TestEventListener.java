package io.huskytests.core.engine;

import io.huskytests.core.model.TestCaseOutcome;

/**
 * Receives test events from the engine while a run is in flight.
 * Events may arrive on engine threads.
 */
public interface TestEventListener {

    void testFinished(TestCaseOutcome outcome);

    default void testOutput(String fullName, String text) {
    }
}
