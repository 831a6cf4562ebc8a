package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One typed external asset reference of a content record. Serialized into the
 * {@code fileUrls} JSON column using the legacy field names.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetEntry {

    @JsonProperty("presentation_type")
    private SlotType slotType;

    @JsonProperty("contentType")
    private String contentType;

    @JsonProperty("name")
    private String displayName;

    @JsonProperty("source")
    private SourceKind sourceKind;

    @JsonProperty("drive_url")
    private String externalReference;

    @JsonProperty("driveId")
    private String externalId;

    @JsonProperty("gcs_path")
    private String resolvedLocation;

    @JsonProperty("url")
    private String accessUrl;

    @JsonProperty("type")
    private String mimeType;

    @JsonProperty("size")
    private Long byteSize;

    @JsonProperty("thumbnailLink")
    private String thumbnailLink;

    @JsonProperty("exportUrl")
    private String exportUrl;

    @JsonProperty("tooLargeToExport")
    private Boolean tooLargeToExport;

    @JsonProperty("resolutionState")
    private ResolutionState resolutionState;

    @JsonProperty("acquisitionError")
    private String acquisitionError;

    // Provider fields; the deduplicator strips iconLink and folds webViewLink into drive_url.
    @JsonProperty("iconLink")
    private String iconLink;

    @JsonProperty("webViewLink")
    private String webViewLink;

    @JsonIgnore
    public boolean isResolved() {
        return resolvedLocation != null && resolutionState == ResolutionState.RESOLVED;
    }

    @JsonIgnore
    public boolean isFlaggedTooLarge() {
        return resolutionState == ResolutionState.TOO_LARGE || Boolean.TRUE.equals(tooLargeToExport);
    }

    /**
     * True for a deck entry that still has to be fetched into storage. FAILED entries are
     * not picked up again automatically.
     */
    @JsonIgnore
    public boolean needsAcquisition() {
        if (slotType == null || !slotType.isDeck() || resolvedLocation != null
                || resolutionState == ResolutionState.FAILED) {
            return false;
        }
        return isFlaggedTooLarge() || externalReference != null || externalId != null;
    }

    /**
     * State implied by the populated fields, for entries read back from JSON written
     * before the state was stored explicitly.
     */
    @JsonIgnore
    public ResolutionState inferResolutionState() {
        if (resolutionState != null) {
            return resolutionState;
        }
        if (resolvedLocation != null) {
            return ResolutionState.RESOLVED;
        }
        if (Boolean.TRUE.equals(tooLargeToExport)) {
            return ResolutionState.TOO_LARGE;
        }
        return ResolutionState.UNRESOLVED;
    }
}
