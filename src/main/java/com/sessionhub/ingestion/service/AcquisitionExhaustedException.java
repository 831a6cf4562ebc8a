package com.sessionhub.ingestion.service;

import com.sessionhub.ingestion.model.AcquisitionAttempt;

import java.util.List;

/**
 * Raised when every acquisition strategy failed for an entry. Carries one attempt per strategy.
 */
public class AcquisitionExhaustedException extends RuntimeException {

    private final List<AcquisitionAttempt> attempts;

    public AcquisitionExhaustedException(String m, List<AcquisitionAttempt> attempts, Throwable c) {
        super(m, c);
        this.attempts = List.copyOf(attempts);
    }

    public List<AcquisitionAttempt> getAttempts() {
        return attempts;
    }
}
