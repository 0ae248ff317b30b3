package io.huskytests.core.engine;

/**
 * What an in-process engine run produced.
 *
 * @param status    whether the run finished or was cancelled mid-flight
 * @param resultXml the engine's result document; empty for a cancelled run
 */
public record EngineRunResult(Status status, String resultXml) {

    public enum Status { COMPLETED, CANCELLED }

    public static EngineRunResult completed(String resultXml) {
        return new EngineRunResult(Status.COMPLETED, resultXml == null ? "" : resultXml);
    }

    public static EngineRunResult cancelled() {
        return new EngineRunResult(Status.CANCELLED, "");
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
