package io.huskytests.core.engine;

import io.huskytests.core.model.TestCaseOutcome;
import io.huskytests.core.model.TestResultConverter;
import io.huskytests.core.model.TestResultRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards each finished test straight to the host's result recorder.
 *
 * <p>Forwarding is serialized, so results reach the recorder in the order the
 * engine delivered them. Events arriving after {@link #close()} are dropped.
 */
public final class ResultForwardingListener implements TestEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultForwardingListener.class);

    private final TestResultConverter converter;
    private final TestResultRecorder recorder;
    private boolean closed;
    private int forwarded;

    public ResultForwardingListener(TestResultConverter converter, TestResultRecorder recorder) {
        this.converter = converter;
        this.recorder = recorder;
    }

    @Override
    public synchronized void testFinished(TestCaseOutcome outcome) {
        if (closed) {
            log.debug("Dropping late result for {}", outcome.fullName());
            return;
        }
        recorder.recordResult(converter.convert(outcome));
        forwarded++;
    }

    @Override
    public void testOutput(String fullName, String text) {
        log.debug("[{}] {}", fullName, text);
    }

    public synchronized int forwardedCount() {
        return forwarded;
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            log.debug("Listener closed after forwarding {} result(s)", forwarded);
        }
    }
}
