package com.dcruver.vaultdrift.cluster;

import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.Deadline;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.nlp.VectorMath;
import com.dcruver.vaultdrift.store.SessionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups a session's embeddings into density clusters and names them.
 */
@Component
@Slf4j
public class ClusterEngine {

    private final int minClusterSize;
    private final int minSamples;
    private final int labelBodyChars;
    private final ClusterLabeler labeler;

    @Autowired
    public ClusterEngine(EngineProperties properties, ClusterLabeler labeler) {
        this(properties.getClustering().getMinClusterSize(),
            properties.getClustering().getMinSamples(),
            properties.getClustering().getLabelBodyChars(),
            labeler);
    }

    public ClusterEngine(int minClusterSize, int minSamples, int labelBodyChars, ClusterLabeler labeler) {
        this.minClusterSize = minClusterSize;
        this.minSamples = minSamples;
        this.labelBodyChars = labelBodyChars;
        this.labeler = labeler;
    }

    public int getMinClusterSize() {
        return minClusterSize;
    }

    /**
     * Cluster the embeddings. Fewer than twice the minimum cluster size notes come back as all noise,
     * flagged degenerate.
     *
     * @param notes note metadata used for labels; notes missing here are labeled by id
     */
    public ClusterResult cluster(Map<String, Embedding> embeddings, Map<String, Note> notes, Deadline deadline) {
        List<String> ids = new ArrayList<>(new TreeMap<>(embeddings).keySet());
        if (ids.size() < 2 * minClusterSize) {
            log.warn("Degenerate clustering: {} notes is below twice the minimum cluster size {}, all notes are noise",
                ids.size(), minClusterSize);
            return ClusterResult.allNoise(ids, true);
        }

        double[][] points = new double[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            points[i] = embeddings.get(ids.get(i)).values();
        }
        int[] labels = new Hdbscan(minClusterSize, minSamples).fit(points, deadline);

        Map<String, Integer> assignments = new TreeMap<>();
        Map<Integer, List<String>> members = new TreeMap<>();
        for (int i = 0; i < ids.size(); i++) {
            assignments.put(ids.get(i), labels[i]);
            if (labels[i] != ClusterResult.NOISE) {
                members.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(ids.get(i));
            }
        }

        Map<Integer, List<String>> texts = new TreeMap<>();
        members.forEach((clusterId, memberIds) -> texts.put(clusterId, memberIds.stream()
            .map(id -> notes.containsKey(id) ? notes.get(id).labelText(labelBodyChars) : id)
            .collect(Collectors.toList())));
        Map<Integer, String> keywordLabels = labeler.label(texts);

        Map<Integer, Cluster> clusters = new TreeMap<>();
        members.forEach((clusterId, memberIds) -> clusters.put(clusterId,
            new Cluster(clusterId, List.copyOf(memberIds), keywordLabels.get(clusterId),
                centroid(memberIds, embeddings))));

        log.info("Clustered {} notes into {} clusters ({} noise)",
            ids.size(), clusters.size(), ids.size() - assignments.values().stream().filter(l -> l >= 0).count());
        return new ClusterResult(assignments, clusters, false);
    }

    /**
     * Rebuild the stored clustering of a session from its records.
     */
    public ClusterResult fromRecords(Map<String, SessionRecord> records) {
        Map<String, Integer> assignments = new TreeMap<>();
        Map<Integer, List<String>> members = new TreeMap<>();
        Map<Integer, String> keywordLabels = new TreeMap<>();
        Map<String, Embedding> embeddings = new TreeMap<>();
        records.values().forEach(r -> {
            embeddings.put(r.getNoteId(), r.getEmbedding());
            if (r.isNoise()) {
                assignments.put(r.getNoteId(), ClusterResult.NOISE);
            } else {
                assignments.put(r.getNoteId(), r.getClusterId());
                members.computeIfAbsent(r.getClusterId(), k -> new ArrayList<>()).add(r.getNoteId());
                keywordLabels.putIfAbsent(r.getClusterId(), r.getClusterLabel());
            }
        });
        Map<Integer, Cluster> clusters = new TreeMap<>();
        members.forEach((clusterId, memberIds) -> {
            memberIds.sort(Comparator.naturalOrder());
            clusters.put(clusterId, new Cluster(clusterId, List.copyOf(memberIds),
                keywordLabels.get(clusterId), centroid(memberIds, embeddings)));
        });
        boolean degenerate = records.size() < 2 * minClusterSize;
        return new ClusterResult(assignments, clusters, degenerate);
    }

    /**
     * Members closest to the centroid, nearest first.
     */
    public List<String> representatives(Cluster cluster, Map<String, Embedding> embeddings, int k) {
        double[] centroid = cluster.getCentroid();
        return cluster.getMemberIds().stream()
            .filter(embeddings::containsKey)
            .sorted(Comparator.<String>comparingDouble(
                    id -> VectorMath.euclidean(embeddings.get(id).values(), centroid))
                .thenComparing(Comparator.naturalOrder()))
            .limit(k)
            .collect(Collectors.toList());
    }

    private static double[] centroid(List<String> memberIds, Map<String, Embedding> embeddings) {
        return VectorMath.mean(memberIds.stream()
            .map(id -> embeddings.get(id).values())
            .collect(Collectors.toList()));
    }
}
