package com.sessionhub.ingestion.model;

import java.util.List;
import java.util.Map;

/**
 * Header row plus data rows of an uploaded sheet. Rows map header name to raw cell text.
 */
public record ParsedTable(List<String> headers, List<Map<String, String>> rows) {

    public boolean hasColumn(String name) {
        return headers.contains(name);
    }

    public int size() {
        return rows.size();
    }
}
