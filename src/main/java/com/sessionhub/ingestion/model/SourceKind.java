package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceKind {

    STRUCTURED_STORE("drive"),
    EXTERNAL_VIDEO("youtube");

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SourceKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SourceKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return null;
    }
}
