package com.dcruver.vaultdrift.metrics;

import com.dcruver.vaultdrift.cluster.Cluster;
import com.dcruver.vaultdrift.cluster.ClusterResult;
import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.CacheCorruptionException;
import com.dcruver.vaultdrift.nlp.VectorMath;
import com.dcruver.vaultdrift.session.SessionHandle;
import com.dcruver.vaultdrift.store.SchemaManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes aggregate statistics of a session's embeddings and caches them per session.
 *
 * Pairwise statistics run over at most {@code vaultdrift.metrics.max-pairwise-notes} notes; above that a
 * sample seeded by the session date is used and recorded in the result.
 */
@Component
@Slf4j
public class EmbeddingMetricsComputer {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final int maxPairwiseNotes;

    public EmbeddingMetricsComputer(DataSource dataSource, SchemaManager schemaManager, ObjectMapper objectMapper,
                                    EngineProperties properties) {
        schemaManager.init();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
        this.maxPairwiseNotes = properties.getMetrics().getMaxPairwiseNotes();
    }

    /**
     * Cached metrics for the session, computed on first request or when forced.
     */
    public EmbeddingMetrics compute(SessionHandle session, boolean force) {
        if (!force) {
            Optional<EmbeddingMetrics> cached = loadCached(session);
            if (cached.isPresent()) {
                log.debug("Using cached metrics for session {}", session.sessionDate());
                return cached.get();
            }
        }
        EmbeddingMetrics metrics = calculate(session);
        store(metrics);
        return metrics;
    }

    EmbeddingMetrics calculate(SessionHandle session) {
        List<String> ids = session.noteIds();
        List<String> sample = ids;
        if (maxPairwiseNotes > 0 && ids.size() > maxPairwiseNotes) {
            sample = new ArrayList<>(session.sample(ids, maxPairwiseNotes, "metrics"));
            sample.sort(Comparator.naturalOrder());
            log.info("Pairwise metrics for session {} use {} of {} notes", session.sessionDate(), sample.size(), ids.size());
        }

        ClusterResult clusters = session.clusters();
        Map<Integer, String> labels = new TreeMap<>();
        clusters.clusters().forEach((id, cluster) -> labels.put(id, cluster.getKeywordLabel()));
        int noise = clusters.noise().size();
        double[] similarity = similarityStats(session, sample);

        return EmbeddingMetrics.builder()
            .sessionDate(session.sessionDate())
            .noteCount(ids.size())
            .sampledNotes(sample.size())
            .dimension(ids.isEmpty() ? 0 : session.embedding(ids.get(0)).orElseThrow().dimension())
            .meanSimilarity(similarity[0])
            .stdSimilarity(similarity[1])
            .intrinsicDimension(twoNearestNeighbours(vectors(session, sample)))
            .clusterCount(clusters.clusterCount())
            .noiseCount(noise)
            .noisePercent(ids.isEmpty() ? 0.0 : round(100.0 * noise / ids.size(), 1))
            .silhouette(silhouette(session, sample, clusters))
            .clusterEntropy(entropy(clusters))
            .clusterLabels(labels)
            .build();
    }

    // mean and population standard deviation of pairwise similarity, through the run cache
    private static double[] similarityStats(SessionHandle session, List<String> ids) {
        double sum = 0.0;
        double sumSquares = 0.0;
        long pairs = 0;
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                double s = session.similarity(ids.get(i), ids.get(j));
                sum += s;
                sumSquares += s * s;
                pairs++;
            }
        }
        if (pairs == 0) {
            return new double[] {0.0, 0.0};
        }
        double mean = sum / pairs;
        return new double[] {mean, Math.sqrt(Math.max(0.0, sumSquares / pairs - mean * mean))};
    }

    /**
     * TwoNN maximum-likelihood estimate: n / sum(ln(r2 / r1)) over points with distinct neighbours.
     */
    static double twoNearestNeighbours(List<double[]> points) {
        int used = 0;
        double logSum = 0.0;
        for (int i = 0; i < points.size(); i++) {
            double r1 = Double.POSITIVE_INFINITY;
            double r2 = Double.POSITIVE_INFINITY;
            for (int j = 0; j < points.size(); j++) {
                if (i == j) {
                    continue;
                }
                double d = VectorMath.euclidean(points.get(i), points.get(j));
                if (d < r1) {
                    r2 = r1;
                    r1 = d;
                } else if (d < r2) {
                    r2 = d;
                }
            }
            if (r1 > 0.0 && Double.isFinite(r2)) {
                logSum += Math.log(r2 / r1);
                used++;
            }
        }
        return logSum > 0.0 ? used / logSum : 0.0;
    }

    private static Double silhouette(SessionHandle session, List<String> sample, ClusterResult clusters) {
        if (clusters.clusterCount() < 2) {
            return null;
        }
        Map<Integer, List<double[]>> byCluster = new TreeMap<>();
        List<String> clustered = new ArrayList<>();
        for (String id : sample) {
            int clusterId = clusters.clusterOf(id);
            if (clusterId != ClusterResult.NOISE) {
                byCluster.computeIfAbsent(clusterId, k -> new ArrayList<>())
                    .add(session.embedding(id).orElseThrow().values());
                clustered.add(id);
            }
        }
        if (byCluster.size() < 2) {
            return null;
        }
        double total = 0.0;
        for (String id : clustered) {
            double[] point = session.embedding(id).orElseThrow().values();
            int own = clusters.clusterOf(id);
            List<double[]> mates = byCluster.get(own);
            if (mates.size() < 2) {
                continue;
            }
            double a = meanDistance(point, mates) * mates.size() / (mates.size() - 1);
            double b = Double.POSITIVE_INFINITY;
            for (Map.Entry<Integer, List<double[]>> other : byCluster.entrySet()) {
                if (other.getKey() != own) {
                    b = Math.min(b, meanDistance(point, other.getValue()));
                }
            }
            double denominator = Math.max(a, b);
            total += denominator == 0.0 ? 0.0 : (b - a) / denominator;
        }
        return round(total / clustered.size(), 3);
    }

    // Shannon entropy in bits of the cluster size distribution
    private static Double entropy(ClusterResult clusters) {
        if (clusters.clusterCount() == 0) {
            return null;
        }
        int total = clusters.clusters().values().stream().mapToInt(Cluster::size).sum();
        double entropy = 0.0;
        for (Cluster cluster : clusters.clusters().values()) {
            double p = (double) cluster.size() / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return round(entropy, 2);
    }

    private static double meanDistance(double[] point, List<double[]> others) {
        double sum = 0.0;
        for (double[] other : others) {
            sum += VectorMath.euclidean(point, other);
        }
        return sum / others.size();
    }

    private static List<double[]> vectors(SessionHandle session, List<String> ids) {
        List<double[]> vectors = new ArrayList<>(ids.size());
        ids.forEach(id -> vectors.add(session.embedding(id).orElseThrow().values()));
        return vectors;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    private Optional<EmbeddingMetrics> loadCached(SessionHandle session) {
        List<String> rows = jdbcTemplate.query(
            "SELECT metrics_json FROM embedding_metrics WHERE session_date = ?",
            (rs, rowNum) -> rs.getString("metrics_json"),
            session.sessionDate().toString()
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(rows.get(0), EmbeddingMetrics.class));
        } catch (JsonProcessingException e) {
            throw new CacheCorruptionException("Unreadable cached metrics for session " + session.sessionDate(), e);
        }
    }

    private void store(EmbeddingMetrics metrics) {
        try {
            jdbcTemplate.update(
                "INSERT OR REPLACE INTO embedding_metrics (session_date, metrics_json, computed_at) VALUES (?, ?, ?)",
                metrics.getSessionDate().toString(),
                objectMapper.writeValueAsString(metrics),
                Instant.now().getEpochSecond()
            );
            log.info("Cached metrics for session {}", metrics.getSessionDate());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metrics for " + metrics.getSessionDate(), e);
        }
    }
}
