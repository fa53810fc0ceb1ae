package com.riskradar.api.dto;

import com.riskradar.api.validation.EvmAddress;
import com.riskradar.domain.EventType;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.SuspicionLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One normalized event in POST /api/v1/analyze-events. Missing suspicion level, factors and arguments take
 * the {@link ProcessedEvent} defaults.
 */
public record EventPayload(
        @NotBlank(message = "MISSING_TRANSACTION_HASH")
        String transactionHash,

        @PositiveOrZero
        long blockNumber,

        @PositiveOrZero
        int logIndex,

        @EvmAddress
        String contractAddress,

        EventType eventType,
        Map<String, Object> parsedArgs,
        SuspicionLevel suspicionLevel,
        List<String> riskFactors,
        Instant timestamp
) {

    public ProcessedEvent toEvent() {
        return new ProcessedEvent(transactionHash.trim(), blockNumber, logIndex,
                contractAddress == null ? null : contractAddress.trim(), eventType, parsedArgs, suspicionLevel,
                riskFactors, timestamp);
    }
}
