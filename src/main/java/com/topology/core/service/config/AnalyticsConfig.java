package com.topology.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for graph analytics and vulnerability scoring.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "topology.analytics")
public class AnalyticsConfig {

    /**
     * A node whose removal multiplies the diameter by more than this factor
     * is reported as a single point of failure even if the graph stays connected.
     */
    private double diameterIncreaseFactor = 1.5;

    /**
     * Minimum share of shortest paths crossing a link to report it as a bottleneck.
     */
    private double bottleneckPathShare = 0.4;

    /**
     * Node-removal diameter analysis is skipped above this graph size.
     */
    private int removalAnalysisMaxNodes = 500;

    /**
     * Structural findings are not raised for graphs smaller than this.
     */
    private int minNodesForFindings = 3;

    private Scoring scoring = new Scoring();

    @Getter
    @Setter
    public static class Scoring {

        private double affectedNodesWeight = 0.4;

        private double affectedLinksWeight = 0.2;

        private double centralityWeight = 0.4;

        /**
         * Scores at or above this are CRITICAL.
         */
        private int criticalThreshold = 80;

        /**
         * Scores at or above this are HIGH; everything below is MEDIUM.
         */
        private int highThreshold = 60;
    }
}
