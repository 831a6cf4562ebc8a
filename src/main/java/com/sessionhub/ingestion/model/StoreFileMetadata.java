package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * File metadata as reported by the structured store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreFileMetadata(String id, String name, String mimeType, Long size) {

    public boolean isNativeFormat() {
        return mimeType != null && mimeType.startsWith(MimeTypes.NATIVE_PREFIX);
    }
}
