package io.huskytests.core.container;

/**
 * Thrown when the result file of a containerized run is missing or unreadable.
 */
public class ResultArtifactException extends RuntimeException {

    public ResultArtifactException(String message) {
        super(message);
    }

    public ResultArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
