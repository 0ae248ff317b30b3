package io.huskytests.core.container;

import java.time.Duration;

/**
 * Outcome of a finished child process.
 */
public record CommandResult(int exitCode, String stdout, String stderr, Duration runTime) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
