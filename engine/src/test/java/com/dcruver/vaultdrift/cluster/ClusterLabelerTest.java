package com.dcruver.vaultdrift.cluster;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusterLabelerTest {

    private ClusterLabeler labeler;

    @BeforeEach
    void setUp() {
        labeler = new ClusterLabeler(2, 8, 100, 0.5);
    }

    @Test
    void testFormatLabel() {
        assertEquals("Notes about rust", ClusterLabeler.formatLabel("rust"));
        assertEquals("Notes about rust and tokio", ClusterLabeler.formatLabel("rust, tokio"));
        assertEquals("Notes about rust, tokio, and async", ClusterLabeler.formatLabel("rust, tokio, async"));
        assertEquals("Cluster 3", ClusterLabeler.formatLabel("Cluster 3"));
        assertEquals("", ClusterLabeler.formatLabel(null));
    }

    @Test
    void testStopWordsAndShortTokensAreDropped() {
        Map<String, Integer> counts = labeler.countTerms("The garden and a garden shed");

        assertEquals(2, counts.get("garden"));
        assertEquals(1, counts.get("garden shed"));
        assertNull(counts.get("the"));
        assertNull(counts.get("a"));
    }

    @Test
    void testDistinctTermsPerCluster() {
        Map<Integer, String> labels = labeler.label(Map.of(
            0, List.of("compost garden soil", "garden compost beds"),
            1, List.of("espresso grinder beans", "espresso crema")));

        assertTrue(labels.get(0).contains("garden") || labels.get(0).contains("compost"), labels.get(0));
        assertTrue(labels.get(1).contains("espresso"), labels.get(1));
        assertFalse(labels.get(1).contains("garden"));
    }

    @Test
    void testClusterWithoutTermsFallsBackToId() {
        Map<Integer, String> labels = labeler.label(Map.of(
            0, List.of("the and of"),
            1, List.of("espresso crema")));

        assertEquals("Cluster 0", labels.get(0));
        assertTrue(labeler.label(Map.of()).isEmpty());
    }

    @Test
    void testMaximalMarginalRelevancePrefersDiverseTerms() {
        Map<String, Double> scores = Map.of(
            "machine learning", 0.9,
            "machine", 0.6,
            "learning rate", 0.5);

        List<String> picked = labeler.maximalMarginalRelevance(
            List.of("machine learning", "machine", "learning rate"), scores);

        assertEquals(List.of("machine learning", "learning rate"), picked);
    }

    @Test
    void testWordOverlap() {
        assertEquals(1.0 / 3.0, ClusterLabeler.wordOverlap("machine learning", "learning rate"), 1e-12);
        assertEquals(0.0, ClusterLabeler.wordOverlap("garden", "espresso"));
    }
}
