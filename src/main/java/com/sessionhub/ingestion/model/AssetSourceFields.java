package com.sessionhub.ingestion.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Raw asset fields of a row, before any entry is built from them.
 */
@Getter
@Builder
public class AssetSourceFields {
    private String presentationSlidesUrl;
    private String recapSlidesUrl;
    private String driveLink;
    private String videoYoutubeUrl;
    /** Known id of the primary deck file, when the row supplies it. */
    private String primaryDeckFileId;
    private String videoTitle;
}
