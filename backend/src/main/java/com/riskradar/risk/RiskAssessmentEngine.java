package com.riskradar.risk;

import com.riskradar.cache.ScoreCache;
import com.riskradar.common.Scores;
import com.riskradar.domain.FactorResult;
import com.riskradar.domain.ProcessedEvent;
import com.riskradar.domain.Recommendation;
import com.riskradar.domain.RiskAssessment;
import com.riskradar.domain.RiskCategory;
import com.riskradar.risk.analyzer.FactorAnalyzer;
import com.riskradar.risk.config.RiskProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Combines the factor analyzers into one assessment per event.
 * <ul>
 *   <li>score: weighted sum over the analyzers that ran, divided by the sum of their weights</li>
 *   <li>confidence: mean confidence of the analyzers that ran</li>
 *   <li>primary category: highest score; ties resolved in {@link RiskCategory} declaration order</li>
 *   <li>recommendation: MONITOR below the minimum confidence, otherwise by score threshold</li>
 * </ul>
 * Never throws for a non-null event: an analyzer failure contributes 0.3/0.3 tagged {@code <category>_analysis_error}.
 */
@Slf4j
public class RiskAssessmentEngine {

    static final double DEGRADED_SCORE = 0.3;
    static final double DEGRADED_CONFIDENCE = 0.3;

    private final List<FactorAnalyzer> analyzers;
    private final ScoreCache cache;
    private final RiskProperties properties;
    private final Clock clock;

    public RiskAssessmentEngine(List<FactorAnalyzer> analyzers, ScoreCache cache, RiskProperties properties, Clock clock) {
        List<FactorAnalyzer> ordered = new ArrayList<>(analyzers);
        ordered.sort(Comparator.comparing(FactorAnalyzer::category));
        this.analyzers = List.copyOf(ordered);
        this.cache = cache;
        this.properties = properties;
        this.clock = clock;
    }

    public RiskAssessment assess(ProcessedEvent event) {
        Objects.requireNonNull(event, "event");
        Map<RiskCategory, FactorResult> components = new EnumMap<>(RiskCategory.class);
        for (FactorAnalyzer analyzer : analyzers) {
            if (appliesSafely(analyzer, event)) {
                components.put(analyzer.category(), runIsolated(analyzer, event));
            }
        }
        if (components.isEmpty()) {
            return new RiskAssessment(event.transactionHash(), event.logIndex(), 0.0, 0.0, RiskCategory.FINANCIAL,
                    List.of(), Recommendation.MONITOR, Map.of(), clock.instant());
        }

        double weightedSum = 0.0;
        double weightTotal = 0.0;
        double confidenceSum = 0.0;
        RiskCategory primary = null;
        double primaryScore = -1.0;
        Set<String> factors = new LinkedHashSet<>();
        for (Map.Entry<RiskCategory, FactorResult> e : components.entrySet()) {
            double weight = properties.weightOf(e.getKey());
            FactorResult r = e.getValue();
            weightedSum += r.score() * weight;
            weightTotal += weight;
            confidenceSum += r.confidence();
            if (r.score() > primaryScore) {
                primaryScore = r.score();
                primary = e.getKey();
            }
            factors.addAll(r.factors());
        }
        double score = weightTotal > 0.0
                ? weightedSum / weightTotal
                : components.values().stream().mapToDouble(FactorResult::score).average().orElse(0.0);
        score = Scores.clamp(score);
        double confidence = Scores.clamp(confidenceSum / components.size());
        Recommendation recommendation = recommend(score, confidence);

        log.debug("Assessed {}: score={} confidence={} primary={} recommendation={}",
                event.shortHash(), score, confidence, primary, recommendation);
        return new RiskAssessment(event.transactionHash(), event.logIndex(), score, confidence, primary,
                new ArrayList<>(factors), recommendation, new LinkedHashMap<>(components), clock.instant());
    }

    /**
     * Threshold rule. Low confidence dominates: the result is MONITOR whatever the score.
     */
    public Recommendation recommend(double score, double confidence) {
        if (confidence < properties.getMinConfidence()) {
            return Recommendation.MONITOR;
        }
        if (score >= properties.getCriticalRiskThreshold()) {
            return Recommendation.CRITICAL_INVESTIGATION;
        }
        if (score >= properties.getHighRiskThreshold()) {
            return Recommendation.IMMEDIATE_INVESTIGATION;
        }
        if (score >= properties.getInvestigateThreshold()) {
            return Recommendation.INVESTIGATE;
        }
        return Recommendation.MONITOR;
    }

    public boolean isCritical(double score) {
        return score >= properties.getCriticalRiskThreshold();
    }

    public boolean isHighRisk(double score) {
        return score >= properties.getHighRiskThreshold();
    }

    public List<RiskCategory> categories() {
        return analyzers.stream().map(FactorAnalyzer::category).toList();
    }

    private boolean appliesSafely(FactorAnalyzer analyzer, ProcessedEvent event) {
        try {
            return analyzer.appliesTo(event);
        } catch (RuntimeException e) {
            // Still run it: assess() will degrade if the event is unusable.
            return true;
        }
    }

    private FactorResult runIsolated(FactorAnalyzer analyzer, ProcessedEvent event) {
        RiskCategory category = analyzer.category();
        try {
            return validated(category, analyzer.assess(event, cache));
        } catch (RuntimeException e) {
            AnalyzerException failure = e instanceof AnalyzerException ae
                    ? ae
                    : new AnalyzerException(category, category.key() + " analysis failed", e);
            log.warn("{} for {}: {}", failure.getMessage(), event.shortHash(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return new FactorResult(DEGRADED_SCORE, DEGRADED_CONFIDENCE,
                    List.of(category.key() + "_analysis_error"),
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private static FactorResult validated(RiskCategory category, FactorResult result) {
        if (result == null) {
            throw new AnalyzerException(category, category.key() + " analyzer returned no result");
        }
        if (!Double.isFinite(result.score()) || !Double.isFinite(result.confidence())) {
            throw new AnalyzerException(category, category.key() + " analyzer returned a non-finite value");
        }
        if (Scores.isUnitInterval(result.score()) && Scores.isUnitInterval(result.confidence())) {
            return result;
        }
        return new FactorResult(Scores.clamp(result.score()), Scores.clamp(result.confidence()),
                result.factors(), result.details());
    }
}
