package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum ResolutionState {
    UNRESOLVED,
    RESOLVED,
    TOO_LARGE,
    FAILED;

    /**
     * Case-insensitive lookup; unknown or blank values read as null so the state is inferred from the fields.
     */
    @JsonCreator
    public static ResolutionState fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ResolutionState state : values()) {
            if (state.name().equalsIgnoreCase(value.trim())) {
                return state;
            }
        }
        return null;
    }
}
