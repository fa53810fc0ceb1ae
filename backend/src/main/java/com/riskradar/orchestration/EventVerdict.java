package com.riskradar.orchestration;

import com.riskradar.domain.RiskAssessment;
import com.riskradar.domain.SuspicionLevel;

/**
 * Per-event part of a batch verdict.
 */
public record EventVerdict(String transactionHash, int logIndex, SuspicionLevel suspicionLevel, RiskAssessment assessment) {
}
