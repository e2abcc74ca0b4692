package com.dcruver.vaultdrift.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunable settings of the drift engine. Every threshold and sampling limit lives here.
 */
@Data
@ConfigurationProperties(prefix = "vaultdrift")
public class EngineProperties {

    private String database = "${user.home}/.vaultdrift/vaultdrift.db";

    private Embedding embedding = new Embedding();
    private Clustering clustering = new Clustering();
    private Similarity similarity = new Similarity();
    private Trajectory trajectory = new Trajectory();
    private Detectors detectors = new Detectors();
    private Metrics metrics = new Metrics();

    @Data
    public static class Embedding {
        /** ollama or hashing */
        private String provider = "ollama";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration retryWait = Duration.ofMillis(500);
        private double semanticWeight = 0.9;
        private double temporalWeight = 0.1;
        private int clockSkewToleranceDays = 1;
        /** Width of the offline hashing provider */
        private int hashingDimension = 384;
    }

    @Data
    public static class Clustering {
        private int minClusterSize = 5;
        private int minSamples = 3;
        private int labelTerms = 4;
        private int labelCandidates = 8;
        private int labelMaxFeatures = 100;
        private double labelDiversity = 0.5;
        private int labelBodyChars = 200;
    }

    @Data
    public static class Similarity {
        private double unlinkedPairThreshold = 0.65;
        /** 0 means every note is a candidate */
        private int unlinkedPairCandidateLimit = 0;
    }

    @Data
    public static class Trajectory {
        private int velocityWindow = 3;
        private double accelerationThreshold = 0.1;
        private double convergenceThreshold = 0.15;
        private int minSharedSessions = 3;
        private double reversalHighSimilarity = 0.8;
        private double reversalLowSimilarity = 0.3;
        private double reversalDivergingAlignment = -0.5;
        private double reversalConvergingAlignment = 0.5;
        private double stronglyCorrelatedAbove = 0.7;
        private double decoupledBelow = 0.3;
        private double opposingBelow = -0.5;
        private double directionEpsilon = 1e-9;
        private double cyclingThreshold = 0.7;
        private double migrationOverlap = 0.3;
    }

    @Data
    public static class Detectors {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxConsecutiveFailures = 3;
        private double conceptDriftThreshold = 0.2;
        private int maxSuggestions = 5;
    }

    @Data
    public static class Metrics {
        private int maxPairwiseNotes = 1000;
    }
}
