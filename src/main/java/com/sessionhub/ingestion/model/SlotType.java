package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four fixed asset categories a content record may carry. The wire name is the
 * {@code presentation_type} value stored inside {@code fileUrls}.
 */
public enum SlotType {

    PRIMARY_DECK("presentation_slides", "Presentation Slides", "presentation"),
    RECAP_DECK("recap_slides", "Recap Slides", "presentation"),
    FOLDER_LINK("drive_folder", "Drive Folder", "folder"),
    VIDEO_LINK("youtube_video", "YouTube Video", "video");

    private final String wireName;
    private final String defaultDisplayName;
    private final String contentType;

    SlotType(String wireName, String defaultDisplayName, String contentType) {
        this.wireName = wireName;
        this.defaultDisplayName = defaultDisplayName;
        this.contentType = contentType;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDefaultDisplayName() {
        return defaultDisplayName;
    }

    public String getContentType() {
        return contentType;
    }

    public boolean isDeck() {
        return this == PRIMARY_DECK || this == RECAP_DECK;
    }

    @JsonCreator
    public static SlotType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (SlotType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
