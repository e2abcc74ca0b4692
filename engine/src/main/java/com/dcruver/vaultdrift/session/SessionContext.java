package com.dcruver.vaultdrift.session;

import com.dcruver.vaultdrift.cluster.ClusterEngine;
import com.dcruver.vaultdrift.cluster.ClusterResult;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.nlp.VectorMath;
import com.dcruver.vaultdrift.store.SessionRecord;
import com.dcruver.vaultdrift.store.SessionSnapshot;
import com.dcruver.vaultdrift.trajectory.TrajectoryAnalyzer;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Similarity and graph queries over one stored session, for the length of one run.
 *
 * Owns the run's similarity cache; closing the context drops it. A context is bound to a single date and
 * is never reused for another.
 */
@Slf4j
public class SessionContext implements SessionHandle, AutoCloseable {

    private final SessionSnapshot snapshot;
    private final Map<String, Note> notes;
    private final Map<String, double[]> unitVectors = new LinkedHashMap<>();
    private final List<LocalDate> history;
    private final ClusterEngine clusterEngine;
    private final TrajectoryAnalyzer trajectoryAnalyzer;
    private final SimilarityCache similarityCache = new SimilarityCache();
    private final DeterministicSampler sampler;
    private final double unlinkedPairThreshold;
    private final int unlinkedPairCandidateLimit;

    private volatile NoteGraph graph;
    private volatile ClusterResult clusters;
    private volatile boolean closed;

    SessionContext(SessionSnapshot snapshot, Map<String, Note> notes, List<LocalDate> history,
                   ClusterEngine clusterEngine, TrajectoryAnalyzer trajectoryAnalyzer,
                   double unlinkedPairThreshold, int unlinkedPairCandidateLimit) {
        this.snapshot = snapshot;
        this.notes = notes;
        this.history = List.copyOf(history);
        this.clusterEngine = clusterEngine;
        this.trajectoryAnalyzer = trajectoryAnalyzer;
        this.sampler = new DeterministicSampler(snapshot.getSessionDate());
        this.unlinkedPairThreshold = unlinkedPairThreshold;
        this.unlinkedPairCandidateLimit = unlinkedPairCandidateLimit;
        snapshot.getRecords().forEach((id, record) -> {
            double[] unit = VectorMath.normalize(record.getEmbedding().values());
            unitVectors.put(id, unit == null ? new double[record.getEmbedding().dimension()] : unit);
        });
    }

    @Override
    public LocalDate sessionDate() {
        return snapshot.getSessionDate();
    }

    @Override
    public long seed() {
        return sampler.getSeed();
    }

    @Override
    public List<String> noteIds() {
        return new ArrayList<>(snapshot.noteIds());
    }

    @Override
    public List<Note> notes() {
        return snapshot.noteIds().stream().map(notes::get).collect(Collectors.toList());
    }

    @Override
    public Optional<Note> note(String noteId) {
        return Optional.ofNullable(notes.get(noteId));
    }

    @Override
    public Optional<Embedding> embedding(String noteId) {
        return snapshot.record(noteId).map(SessionRecord::getEmbedding);
    }

    @Override
    public double similarity(String a, String b) {
        ensureOpen();
        double[] va = unitVectors.get(a);
        double[] vb = unitVectors.get(b);
        if (va == null || vb == null) {
            return 0.0;
        }
        return similarityCache.get(sessionDate(), a, b, () -> clip(VectorMath.dot(va, vb)));
    }

    @Override
    public double[][] batchSimilarity(List<String> rows, List<String> columns) {
        ensureOpen();
        double[][] result = new double[rows.size()][columns.size()];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < columns.size(); j++) {
                result[i][j] = similarity(rows.get(i), columns.get(j));
            }
        }
        return result;
    }

    @Override
    public List<ScoredNote> neighbours(String noteId, int k) {
        ensureOpen();
        if (!unitVectors.containsKey(noteId) || k <= 0) {
            return List.of();
        }
        List<String> others = unitVectors.keySet().stream()
            .filter(id -> !id.equals(noteId))
            .collect(Collectors.toList());
        double[] scores = batchSimilarity(List.of(noteId), others)[0];
        List<ScoredNote> scored = new ArrayList<>(others.size());
        for (int i = 0; i < others.size(); i++) {
            scored.add(new ScoredNote(others.get(i), scores[i]));
        }
        scored.sort(Comparator.comparingDouble(ScoredNote::getScore).reversed()
            .thenComparing(ScoredNote::getNoteId));
        return scored.size() > k ? new ArrayList<>(scored.subList(0, k)) : scored;
    }

    @Override
    public List<NotePair> unlinkedPairs(int k) {
        ensureOpen();
        List<String> candidates = noteIds();
        if (unlinkedPairCandidateLimit > 0 && candidates.size() > unlinkedPairCandidateLimit) {
            log.info("Sampling {} of {} notes as unlinked-pair candidates (candidate limit)",
                unlinkedPairCandidateLimit, candidates.size());
            candidates = sample(candidates, unlinkedPairCandidateLimit, "unlinked-pairs");
            candidates.sort(Comparator.naturalOrder());
        }

        NoteGraph links = graph();
        List<NotePair> pairs = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                String a = candidates.get(i);
                String b = candidates.get(j);
                if (links.isLinked(a, b)) {
                    continue;
                }
                double score = similarity(a, b);
                if (score > unlinkedPairThreshold) {
                    pairs.add(new NotePair(a, b, score));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(NotePair::getSimilarity).reversed()
            .thenComparing(NotePair::getFirst)
            .thenComparing(NotePair::getSecond));
        return pairs.size() > k ? new ArrayList<>(pairs.subList(0, k)) : pairs;
    }

    @Override
    public NoteGraph graph() {
        ensureOpen();
        NoteGraph result = graph;
        if (result == null) {
            synchronized (this) {
                if (graph == null) {
                    Map<String, LocalDateTime> modified = new LinkedHashMap<>();
                    snapshot.getRecords().forEach((id, record) -> modified.put(id, record.getModified()));
                    graph = new NoteGraph(snapshot.noteIds(), snapshot.getLinks(), modified);
                }
                result = graph;
            }
        }
        return result;
    }

    @Override
    public ClusterResult clusters() {
        ensureOpen();
        ClusterResult result = clusters;
        if (result == null) {
            synchronized (this) {
                if (clusters == null) {
                    clusters = clusterEngine.fromRecords(snapshot.getRecords());
                }
                result = clusters;
            }
        }
        return result;
    }

    @Override
    public List<String> representatives(int clusterId, int k) {
        Map<String, Embedding> embeddings = new LinkedHashMap<>();
        snapshot.getRecords().forEach((id, record) -> embeddings.put(id, record.getEmbedding()));
        return clusters().cluster(clusterId)
            .map(c -> clusterEngine.representatives(c, embeddings, k))
            .orElse(List.of());
    }

    @Override
    public List<LocalDate> history() {
        return history;
    }

    @Override
    public TrajectoryAnalyzer trajectories() {
        return trajectoryAnalyzer;
    }

    @Override
    public <T> List<T> sample(List<T> items, int k, String salt) {
        return sampler.sample(items, k, salt);
    }

    public SimilarityCache similarityCache() {
        return similarityCache;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Closing session context {} ({} cached pairs, {} hits, {} misses)",
                sessionDate(), similarityCache.size(), similarityCache.hits(), similarityCache.misses());
            similarityCache.clear();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session context for " + sessionDate() + " is closed");
        }
    }

    private static double clip(double similarity) {
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
