package com.riskradar.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;

/**
 * POST /api/v1/analyze-events request body. Null priority means normal.
 */
public record AnalyzeEventsRequest(
        @NotEmpty(message = "EMPTY_BATCH")
        List<@NotNull(message = "INVALID_REQUEST") @Valid EventPayload> events,

        @Pattern(regexp = "low|normal|high|critical", message = "INVALID_PRIORITY")
        String priority
) {

    public static final String DEFAULT_PRIORITY = "normal";

    public String priorityOrDefault() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }
}
