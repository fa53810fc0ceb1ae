package com.riskradar.delegation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Remote pipeline stages a worker can serve.
 */
public enum WorkerRole {
    EVENT_ANALYZER("event_analyzer"),
    RISK_ASSESSOR("risk_assessor");

    private final String key;

    WorkerRole(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static WorkerRole fromKey(String value) {
        for (WorkerRole role : values()) {
            if (role.key.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown worker role: " + value);
    }
}
