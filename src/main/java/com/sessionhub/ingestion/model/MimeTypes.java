package com.sessionhub.ingestion.model;

public final class MimeTypes {

    public static final String PPTX = "application/vnd.openxmlformats-officedocument.presentationml.presentation";
    public static final String NATIVE_PRESENTATION = "application/vnd.google-apps.presentation";
    public static final String NATIVE_FOLDER = "application/vnd.google-apps.folder";
    public static final String NATIVE_PREFIX = "application/vnd.google-apps.";
    public static final String EXTERNAL_VIDEO = "video/youtube";
    public static final String OCTET_STREAM = "application/octet-stream";

    private MimeTypes() {
    }

    public static String defaultFor(SlotType slotType) {
        switch (slotType) {
            case PRIMARY_DECK:
            case RECAP_DECK:
                return PPTX;
            case FOLDER_LINK:
                return NATIVE_FOLDER;
            case VIDEO_LINK:
                return EXTERNAL_VIDEO;
            default:
                return OCTET_STREAM;
        }
    }

    public static String extensionFor(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        switch (mimeType) {
            case PPTX:
                return ".pptx";
            case "application/pdf":
                return ".pdf";
            case "video/mp4":
                return ".mp4";
            default:
                return "";
        }
    }
}
