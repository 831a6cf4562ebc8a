package com.sessionhub.ingestion.model;

/**
 * One line of a task's attempt log.
 */
public record AcquisitionAttempt(String strategyName, Outcome outcome, String message) {

    public enum Outcome {
        SUCCEEDED,
        /** Strategy ran but produced no bytes. */
        EMPTY,
        /** Strategy did not apply to the entry. */
        SKIPPED,
        FAILED
    }

    public static AcquisitionAttempt succeeded(String strategyName, String message) {
        return new AcquisitionAttempt(strategyName, Outcome.SUCCEEDED, message);
    }

    public static AcquisitionAttempt failed(String strategyName, String message) {
        return new AcquisitionAttempt(strategyName, Outcome.FAILED, message);
    }
}
