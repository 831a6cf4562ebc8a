package com.sessionhub.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A failure isolated to one row of a bulk upload. {@code row} is the zero-based data row
 * index, or -1 for a job-level error.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RowError {
    private int row;
    private String message;
    private Map<String, Object> details;
}
