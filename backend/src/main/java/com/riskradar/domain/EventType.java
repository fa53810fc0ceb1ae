package com.riskradar.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized event kinds. Wire names follow the ABI event names (Transfer, Approval, ...).
 */
public enum EventType {
    TRANSFER("Transfer"),
    APPROVAL("Approval"),
    SWAP("Swap"),
    FLASH_LOAN("FlashLoan"),
    PERMIT("Permit"),
    UNKNOWN("Unknown");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Lenient parse: accepts the wire name or the constant name in any case; anything else is UNKNOWN.
     */
    @JsonCreator
    public static EventType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.strip().replace("_", "");
        for (EventType type : values()) {
            if (type.wireName.equalsIgnoreCase(normalized) || type.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
