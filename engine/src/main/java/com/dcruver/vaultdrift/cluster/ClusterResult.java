package com.dcruver.vaultdrift.cluster;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cluster assignment of every note in a session. Noise is explicit: {@link #NOISE}.
 */
public final class ClusterResult {

    public static final int NOISE = Hdbscan.NOISE;

    private final Map<String, Integer> assignments;
    private final Map<Integer, Cluster> clusters;
    private final boolean degenerate;

    public ClusterResult(Map<String, Integer> assignments, Map<Integer, Cluster> clusters, boolean degenerate) {
        this.assignments = Collections.unmodifiableMap(new TreeMap<>(assignments));
        this.clusters = Collections.unmodifiableMap(new TreeMap<>(clusters));
        this.degenerate = degenerate;
    }

    public static ClusterResult allNoise(Collection<String> noteIds, boolean degenerate) {
        Map<String, Integer> assignments = new TreeMap<>();
        noteIds.forEach(id -> assignments.put(id, NOISE));
        return new ClusterResult(assignments, Map.of(), degenerate);
    }

    public int clusterOf(String noteId) {
        return assignments.getOrDefault(noteId, NOISE);
    }

    public Optional<Cluster> cluster(int clusterId) {
        return Optional.ofNullable(clusters.get(clusterId));
    }

    public Optional<Cluster> clusterFor(String noteId) {
        return cluster(clusterOf(noteId));
    }

    public Map<Integer, Cluster> clusters() {
        return clusters;
    }

    public Map<String, Integer> assignments() {
        return assignments;
    }

    public List<String> noise() {
        return assignments.entrySet().stream()
            .filter(e -> e.getValue() == NOISE)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    public int clusterCount() {
        return clusters.size();
    }

    /**
     * True when the corpus was too small to cluster and everything was marked noise.
     */
    public boolean isDegenerate() {
        return degenerate;
    }
}
