package com.sessionhub.ingestion.service;

public class RecordPersistenceException extends RuntimeException {
    /**
     * Creates an exception describing a content record or batch job that could not be written.
     */
    public RecordPersistenceException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public RecordPersistenceException(String m, Throwable c) { super(m, c); }
}
