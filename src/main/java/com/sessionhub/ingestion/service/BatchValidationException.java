package com.sessionhub.ingestion.service;

public class BatchValidationException extends RuntimeException {
    /**
     * Creates an exception describing an upload rejected before any row is processed.
     */
    public BatchValidationException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public BatchValidationException(String m, Throwable c) { super(m, c); }
}
