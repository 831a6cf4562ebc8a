package com.sessionhub.ingestion.service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls embedded external ids out of reference URLs. Pure and thread-safe; never throws.
 */
public final class IdentifierExtractor {

    public enum PatternFamily {
        /** {@code /d/<id>} as used by files, slides, docs and sheets. */
        DOCUMENT(Pattern.compile("/d/([^/?#&]+)")),
        /** {@code /folders/<id>}. */
        FOLDER(Pattern.compile("/folders/([^/?#&]+)")),
        /** {@code watch?v=<id>}. */
        WATCH(Pattern.compile("watch\\?(?:[^#]*&)?v=([^&#]+)")),
        /** {@code youtu.be/<id>}. */
        SHORT_LINK(Pattern.compile("youtu\\.be/([^/?#&]+)"));

        private final Pattern pattern;

        PatternFamily(Pattern pattern) {
            this.pattern = pattern;
        }
    }

    private static final Pattern OPEN_ID = Pattern.compile("[?&]id=([^&#]+)");
    private static final Pattern EMBED = Pattern.compile("/(?:embed|v)/([^/?#&]+)");
    private static final Pattern BARE_ID = Pattern.compile("[A-Za-z0-9_-]{25,44}");

    private static final List<PatternFamily> STRUCTURED_STORE_FAMILIES =
            List.of(PatternFamily.DOCUMENT, PatternFamily.FOLDER);
    private static final List<PatternFamily> VIDEO_FAMILIES =
            List.of(PatternFamily.WATCH, PatternFamily.SHORT_LINK);

    private IdentifierExtractor() {
    }

    /**
     * Returns the id captured by the given family, or null when the URL does not match.
     */
    public static String extract(String url, PatternFamily family) {
        if (url == null || url.isBlank() || family == null) {
            return null;
        }
        return firstGroup(family.pattern, url.trim());
    }

    /**
     * Id of a structured store file or folder, from document, folder or {@code open?id=} links.
     * A bare id string is returned as is.
     */
    public static String extractStructuredStoreId(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String candidate = url.trim();
        if (BARE_ID.matcher(candidate).matches()) {
            return candidate;
        }
        for (PatternFamily family : STRUCTURED_STORE_FAMILIES) {
            String id = extract(candidate, family);
            if (id != null) {
                return id;
            }
        }
        return firstGroup(OPEN_ID, candidate);
    }

    /**
     * Id of an external video, from watch, short link or embed URLs.
     */
    public static String extractVideoId(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        for (PatternFamily family : VIDEO_FAMILIES) {
            String id = extract(url, family);
            if (id != null) {
                return id;
            }
        }
        return firstGroup(EMBED, url.trim());
    }

    private static String firstGroup(Pattern pattern, String input) {
        Matcher matcher = pattern.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        String id = trimTrailing(matcher.group(1));
        return id.isEmpty() ? null : id;
    }

    private static String trimTrailing(String id) {
        int cut = id.length();
        int hash = id.indexOf('#');
        if (hash >= 0) {
            cut = Math.min(cut, hash);
        }
        int query = id.indexOf('?');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        return id.substring(0, cut);
    }
}
