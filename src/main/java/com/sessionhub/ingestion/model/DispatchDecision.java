package com.sessionhub.ingestion.model;

/**
 * What the scheduler did with one acquisition request.
 */
public enum DispatchDecision {
    /** Registered and handed to the local acquisition executor. */
    DISPATCHED,
    /** Published to the acquisition queue. */
    QUEUED,
    /** Same key already pending or in progress; the request was dropped. */
    DEFERRED
}
