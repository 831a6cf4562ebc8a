package com.sessionhub.ingestion.service;

public class AcquisitionStrategyException extends RuntimeException {
    /**
     * Creates an exception describing a single acquisition strategy that could not produce the asset.
     */
    public AcquisitionStrategyException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public AcquisitionStrategyException(String m, Throwable c) { super(m, c); }
}
