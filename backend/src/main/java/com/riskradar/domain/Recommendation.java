package com.riskradar.domain;

public enum Recommendation {
    MONITOR,
    INVESTIGATE,
    IMMEDIATE_INVESTIGATION,
    CRITICAL_INVESTIGATION
}
