package com.riskradar.risk;

import com.riskradar.domain.RiskCategory;
import lombok.Getter;

/**
 * One factor analyzer failed or produced an unusable result. Isolated by the engine: the category
 * contributes a degraded result and the event is still assessed.
 */
@Getter
public class AnalyzerException extends RuntimeException {

    private final RiskCategory category;

    public AnalyzerException(RiskCategory category, String message) {
        super(message);
        this.category = category;
    }

    public AnalyzerException(RiskCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
