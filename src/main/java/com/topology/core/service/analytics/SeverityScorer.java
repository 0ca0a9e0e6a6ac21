package com.topology.core.service.analytics;

import com.topology.core.service.config.AnalyticsConfig;
import com.topology.core.service.model.Severity;

/**
 * Deterministic risk score for a structural finding.
 *
 * score = round(100 * (wN * nodeFraction + wL * linkFraction + wC * percentile)),
 * each input in [0, 1]. The severity follows from the configured thresholds.
 */
public class SeverityScorer {

    private final AnalyticsConfig.Scoring scoring;

    public SeverityScorer(AnalyticsConfig.Scoring scoring) {
        this.scoring = scoring;
    }

    /**
     * @param nodeFraction share of other devices cut off by the failure
     * @param linkFraction share of links lost with the failure
     * @param percentile   centrality percentile of the element
     */
    public int score(double nodeFraction, double linkFraction, double percentile) {
        double weighted = scoring.getAffectedNodesWeight() * clamp(nodeFraction)
                + scoring.getAffectedLinksWeight() * clamp(linkFraction)
                + scoring.getCentralityWeight() * clamp(percentile);
        return (int) Math.round(100.0 * weighted);
    }

    public Severity severity(int score) {
        if (score >= scoring.getCriticalThreshold()) return Severity.CRITICAL;
        if (score >= scoring.getHighThreshold()) return Severity.HIGH;
        return Severity.MEDIUM;
    }

    /**
     * Share of {@code values} strictly below {@code value}, over the other
     * values. A single value ranks at the top.
     */
    public static double percentile(double value, double[] values) {
        if (values.length <= 1) {
            return 1.0;
        }
        int below = 0;
        for (double other : values) {
            if (other < value) below++;
        }
        return below / (double) (values.length - 1);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
