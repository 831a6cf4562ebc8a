package com.sessionhub.ingestion.model;

/**
 * Result of a successful upload: a durable location plus a URL clients can read it from.
 */
public record StoredObject(String location, String accessUrl) {
}
