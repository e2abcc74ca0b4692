package com.dcruver.vaultdrift.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * Shape of a session's embedding cloud.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingMetrics {
    private LocalDate sessionDate;
    private int noteCount;
    /** Notes used for the pairwise statistics; below noteCount when the sample limit applied */
    private int sampledNotes;
    private int dimension;
    private double meanSimilarity;
    private double stdSimilarity;
    /** TwoNN estimate */
    private double intrinsicDimension;
    private int clusterCount;
    private int noiseCount;
    private double noisePercent;
    private Double silhouette;
    private Double clusterEntropy;
    private Map<Integer, String> clusterLabels;
}
