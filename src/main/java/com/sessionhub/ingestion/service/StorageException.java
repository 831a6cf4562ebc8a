package com.sessionhub.ingestion.service;

public class StorageException extends RuntimeException {
    /**
     * Creates an exception describing a failed upload or access URL generation.
     */
    public StorageException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public StorageException(String m, Throwable c) { super(m, c); }
}
