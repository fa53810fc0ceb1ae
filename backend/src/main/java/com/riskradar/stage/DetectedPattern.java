package com.riskradar.stage;

/**
 * A pattern found on one processed event.
 *
 * @param patternType one of {@link PatternDetector}'s pattern names
 */
public record DetectedPattern(String patternType, String transactionHash, double confidence, String description) {
}
