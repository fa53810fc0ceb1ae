package com.riskradar.stage;

import com.riskradar.domain.ProcessedEvent;

import java.util.List;

public record EventAnalysisRequest(List<ProcessedEvent> events, String priority) {

    public EventAnalysisRequest {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
