package com.dcruver.vaultdrift.trajectory;

import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.Link;
import com.dcruver.vaultdrift.nlp.VectorMath;
import com.dcruver.vaultdrift.session.NoteGraph;
import com.dcruver.vaultdrift.store.SessionRecord;
import com.dcruver.vaultdrift.store.SessionSnapshot;
import com.dcruver.vaultdrift.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Drift, velocity and pairwise movement of notes across stored sessions.
 *
 * Every method is a pure function of the stored sessions it is given. Sessions without the note are
 * skipped, so trajectories may have gaps. Too little history is reported as an empty result or
 * {@link ReversalKind#INSUFFICIENT_DATA} / {@link CorrelationKind#INSUFFICIENT_DATA}, never as an error.
 */
@Component
@Slf4j
public class TrajectoryAnalyzer {

    private final SessionStore sessionStore;
    private final EngineProperties.Trajectory settings;

    public TrajectoryAnalyzer(SessionStore sessionStore, EngineProperties properties) {
        this.sessionStore = sessionStore;
        this.settings = properties.getTrajectory();
    }

    public NoteTrajectory trajectory(String noteId, List<LocalDate> sessions) {
        List<TrajectoryPoint> points = sessionStore.readRecords(noteId, sessions).entrySet().stream()
            .map(e -> new TrajectoryPoint(e.getKey(), e.getValue()))
            .collect(Collectors.toList());
        return new NoteTrajectory(noteId, points);
    }

    // ===== Single note =====

    /**
     * 1 - cos(first, last). Zero for a single snapshot, empty without any.
     */
    public OptionalDouble drift(String noteId, List<LocalDate> sessions) {
        return drift(trajectory(noteId, sessions));
    }

    public OptionalDouble drift(NoteTrajectory trajectory) {
        if (trajectory.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (trajectory.size() == 1) {
            return OptionalDouble.of(0.0);
        }
        return OptionalDouble.of(driftBetween(trajectory.vector(0), trajectory.vector(trajectory.size() - 1)));
    }

    /**
     * Unit vector from the first to the last snapshot in the semantic space; empty when the content did
     * not move. Temporal features shift by the same amount for every note between two sessions, so they
     * carry no direction.
     */
    public Optional<double[]> driftDirection(NoteTrajectory trajectory) {
        if (trajectory.size() < 2) {
            return Optional.empty();
        }
        double[] delta = semanticDelta(trajectory.embedding(0), trajectory.embedding(trajectory.size() - 1));
        return Optional.ofNullable(VectorMath.normalize(delta))
            .filter(v -> VectorMath.norm(delta) > settings.getDirectionEpsilon());
    }

    /**
     * Cosine between the note's semantic drift direction and a given semantic direction; 0 when either is undefined.
     */
    public double driftAlignment(NoteTrajectory trajectory, double[] direction) {
        double[] unit = VectorMath.normalize(direction);
        return driftDirection(trajectory)
            .map(d -> unit == null ? 0.0 : VectorMath.dot(d, unit))
            .orElse(0.0);
    }

    /**
     * Drift inside each sliding window of {@code window} consecutive snapshots.
     */
    public List<Double> windowedDriftRates(NoteTrajectory trajectory, int window) {
        List<Double> rates = new ArrayList<>();
        if (window < 2 || trajectory.size() < window) {
            return rates;
        }
        for (int i = 0; i + window <= trajectory.size(); i++) {
            rates.add(driftBetween(trajectory.vector(i), trajectory.vector(i + window - 1)));
        }
        return rates;
    }

    public List<Double> windowedDriftRates(String noteId, List<LocalDate> sessions) {
        return windowedDriftRates(trajectory(noteId, sessions), settings.getVelocityWindow());
    }

    /**
     * Drift rate of the most recent window.
     */
    public OptionalDouble velocity(NoteTrajectory trajectory) {
        List<Double> rates = windowedDriftRates(trajectory, settings.getVelocityWindow());
        return rates.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(rates.get(rates.size() - 1));
    }

    public OptionalDouble velocity(String noteId, List<LocalDate> sessions) {
        return velocity(trajectory(noteId, sessions));
    }

    /**
     * Latest window rate minus the earliest; needs at least two windows.
     */
    public OptionalDouble acceleration(NoteTrajectory trajectory) {
        List<Double> rates = windowedDriftRates(trajectory, settings.getVelocityWindow());
        if (rates.size() < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(rates.get(rates.size() - 1) - rates.get(0));
    }

    public OptionalDouble acceleration(String noteId, List<LocalDate> sessions) {
        return acceleration(trajectory(noteId, sessions));
    }

    public boolean isAccelerating(NoteTrajectory trajectory) {
        OptionalDouble acceleration = acceleration(trajectory);
        return acceleration.isPresent() && acceleration.getAsDouble() > settings.getAccelerationThreshold();
    }

    /**
     * Similarity to the current snapshot, averaged over the early and the late half of the history.
     * Needs four snapshots; returns {0, 0} otherwise.
     */
    public double[] earlyLateSplit(NoteTrajectory trajectory) {
        int n = trajectory.size();
        if (n < 4) {
            return new double[] {0.0, 0.0};
        }
        double[] current = trajectory.vector(n - 1);
        int midpoint = n / 2;
        double early = 0.0;
        for (int i = 0; i < midpoint; i++) {
            early += VectorMath.cosine(trajectory.vector(i), current);
        }
        double late = 0.0;
        for (int i = midpoint; i < n - 1; i++) {
            late += VectorMath.cosine(trajectory.vector(i), current);
        }
        int lateCount = n - 1 - midpoint;
        return new double[] {early / midpoint, lateCount == 0 ? 0.0 : late / lateCount};
    }

    /**
     * True when similarity to the first snapshot crosses back above the cycling threshold at least
     * {@code minCycles} times.
     */
    public boolean isCycling(NoteTrajectory trajectory, int minCycles) {
        if (trajectory.size() < 2 * minCycles + 1) {
            return false;
        }
        double[] first = trajectory.vector(0);
        double threshold = settings.getCyclingThreshold();
        boolean high = VectorMath.cosine(first, trajectory.vector(1)) > threshold;
        int cycles = 0;
        for (int i = 2; i < trajectory.size(); i++) {
            boolean nowHigh = VectorMath.cosine(first, trajectory.vector(i)) > threshold;
            if (nowHigh && !high) {
                cycles++;
            }
            high = nowHigh;
        }
        return cycles >= minCycles;
    }

    // ===== Pairs =====

    /**
     * Similarity of two notes in each session holding both, oldest first.
     */
    public List<Double> similarityTrajectory(NoteTrajectory a, NoteTrajectory b) {
        List<Double> similarities = new ArrayList<>();
        for (LocalDate date : sharedSessions(a, b)) {
            similarities.add(VectorMath.cosine(embeddingAt(a, date).values(), embeddingAt(b, date).values()));
        }
        return similarities;
    }

    public List<Double> similarityTrajectory(String noteA, String noteB, List<LocalDate> sessions) {
        return similarityTrajectory(trajectory(noteA, sessions), trajectory(noteB, sessions));
    }

    public boolean isConverging(NoteTrajectory a, NoteTrajectory b) {
        return halfDifference(similarityTrajectory(a, b)) > settings.getConvergenceThreshold();
    }

    public boolean isDiverging(NoteTrajectory a, NoteTrajectory b) {
        return -halfDifference(similarityTrajectory(a, b)) > settings.getConvergenceThreshold();
    }

    /**
     * Classify whether a pair's current closeness is at odds with where the two notes are heading.
     */
    public TrajectoryReversal trajectoryReversal(String noteA, String noteB, List<LocalDate> sessions) {
        return trajectoryReversal(trajectory(noteA, sessions), trajectory(noteB, sessions));
    }

    public TrajectoryReversal trajectoryReversal(NoteTrajectory a, NoteTrajectory b) {
        List<LocalDate> shared = sharedSessions(a, b);
        if (shared.size() < 2) {
            return new TrajectoryReversal(a.getNoteId(), b.getNoteId(), ReversalKind.INSUFFICIENT_DATA, 0.0, 0.0);
        }
        LocalDate first = shared.get(0);
        LocalDate last = shared.get(shared.size() - 1);
        double current = clip(VectorMath.cosine(embeddingAt(a, last).values(), embeddingAt(b, last).values()));
        // closeness on the full embedding, heading on the semantic part only
        double alignment = alignment(
            semanticDelta(embeddingAt(a, first), embeddingAt(a, last)),
            semanticDelta(embeddingAt(b, first), embeddingAt(b, last)));
        return new TrajectoryReversal(a.getNoteId(), b.getNoteId(), classifyReversal(current, alignment),
            current, alignment);
    }

    public ReversalKind classifyReversal(double currentSimilarity, double alignment) {
        if (currentSimilarity >= settings.getReversalHighSimilarity()
            && alignment <= settings.getReversalDivergingAlignment()) {
            return ReversalKind.CLOSE_DIVERGING;
        }
        if (currentSimilarity <= settings.getReversalLowSimilarity()
            && alignment >= settings.getReversalConvergingAlignment()) {
            return ReversalKind.DISTANT_CONVERGING;
        }
        return ReversalKind.NONE;
    }

    /**
     * Whether the pair's movement in one dimension goes with, against or independently of its movement
     * in another.
     */
    public MovementCorrelation correlatedMovement(String noteA, String noteB, Dimension first, Dimension second,
                                                  List<LocalDate> sessions) {
        NoteTrajectory a = trajectory(noteA, sessions);
        NoteTrajectory b = trajectory(noteB, sessions);
        List<LocalDate> shared = sharedSessions(a, b);
        if (shared.size() < settings.getMinSharedSessions()) {
            return new MovementCorrelation(first, second, 0.0, Math.max(0, shared.size() - 1),
                CorrelationKind.INSUFFICIENT_DATA);
        }
        Map<LocalDate, NoteGraph> graphs = new HashMap<>();
        if (needsGraph(first) || needsGraph(second)) {
            for (LocalDate date : shared) {
                graphs.put(date, pairGraph(noteA, noteB, sessionStore.readLinks(date)));
            }
        }
        double[] seriesX = new double[shared.size()];
        double[] seriesY = new double[shared.size()];
        for (int i = 0; i < shared.size(); i++) {
            LocalDate date = shared.get(i);
            SessionRecord ra = a.at(date).orElseThrow().getRecord();
            SessionRecord rb = b.at(date).orElseThrow().getRecord();
            seriesX[i] = measure(first, ra, rb, date, graphs.get(date));
            seriesY[i] = measure(second, ra, rb, date, graphs.get(date));
        }
        return correlate(first, second, directionSigns(seriesX), directionSigns(seriesY));
    }

    /**
     * Correlate two per-step sign sequences (+1 towards, -1 away, 0 still).
     */
    public MovementCorrelation correlate(Dimension first, Dimension second, double[] signsX, double[] signsY) {
        if (signsX.length != signsY.length) {
            throw new IllegalArgumentException("Sign sequences differ in length: " + signsX.length + " vs " + signsY.length);
        }
        if (signsX.length < 2) {
            return new MovementCorrelation(first, second, 0.0, signsX.length, CorrelationKind.INSUFFICIENT_DATA);
        }
        double r = VectorMath.pearson(signsX, signsY);
        return new MovementCorrelation(first, second, r, signsX.length, classifyCorrelation(r));
    }

    public CorrelationKind classifyCorrelation(double r) {
        if (Math.abs(r) < settings.getDecoupledBelow()) {
            return CorrelationKind.DECOUPLED;
        }
        if (r < settings.getOpposingBelow()) {
            return CorrelationKind.OPPOSING;
        }
        if (r > settings.getStronglyCorrelatedAbove()) {
            return CorrelationKind.STRONGLY_CORRELATED;
        }
        return r > 0 ? CorrelationKind.CORRELATED : CorrelationKind.ANTI_CORRELATED;
    }

    /**
     * Sign of each step of a series; steps smaller than the direction epsilon count as 0.
     */
    public double[] directionSigns(double[] series) {
        if (series.length < 2) {
            return new double[0];
        }
        double[] signs = new double[series.length - 1];
        for (int i = 1; i < series.length; i++) {
            double delta = series[i] - series[i - 1];
            signs[i - 1] = Math.abs(delta) <= settings.getDirectionEpsilon() ? 0.0 : Math.signum(delta);
        }
        return signs;
    }

    // ===== Clusters =====

    /**
     * Match clusters of two sessions by Jaccard overlap of their members.
     */
    public ClusterMigration clusterMigrations(LocalDate from, LocalDate to) {
        SessionSnapshot before = sessionStore.readSession(from);
        SessionSnapshot after = sessionStore.readSession(to);
        Map<Integer, Set<String>> oldClusters = members(before);
        Map<Integer, Set<String>> newClusters = members(after);

        Map<Integer, Integer> matches = new TreeMap<>();
        for (Map.Entry<Integer, Set<String>> old : oldClusters.entrySet()) {
            int best = -1;
            double bestOverlap = 0.0;
            for (Map.Entry<Integer, Set<String>> candidate : newClusters.entrySet()) {
                double overlap = jaccard(old.getValue(), candidate.getValue());
                if (overlap > bestOverlap) {
                    bestOverlap = overlap;
                    best = candidate.getKey();
                }
            }
            if (best >= 0 && bestOverlap >= settings.getMigrationOverlap()) {
                matches.put(old.getKey(), best);
            }
        }

        Set<Integer> matched = new HashSet<>(matches.values());
        List<Integer> births = newClusters.keySet().stream().filter(id -> !matched.contains(id))
            .collect(Collectors.toList());
        List<Integer> deaths = oldClusters.keySet().stream().filter(id -> !matches.containsKey(id))
            .collect(Collectors.toList());

        List<String> migrated = new ArrayList<>();
        for (String noteId : new TreeSet<>(before.noteIds())) {
            Optional<SessionRecord> later = after.record(noteId);
            if (later.isEmpty()) {
                continue;
            }
            Integer oldCluster = before.getRecords().get(noteId).getClusterId();
            Integer newCluster = later.get().getClusterId();
            if (oldCluster == null && newCluster == null) {
                continue;
            }
            Integer expected = oldCluster == null ? null : matches.get(oldCluster);
            if (expected == null || !expected.equals(newCluster)) {
                migrated.add(noteId);
            }
        }
        log.debug("Cluster migration {} -> {}: {} matched, {} born, {} died, {} notes moved",
            from, to, matches.size(), births.size(), deaths.size(), migrated.size());
        return new ClusterMigration(from, to, matches, births, deaths, migrated);
    }

    // ===== Helpers =====

    private double measure(Dimension dimension, SessionRecord a, SessionRecord b, LocalDate date, NoteGraph graph) {
        switch (dimension) {
            case SEMANTIC:
                return VectorMath.cosine(a.getEmbedding().semantic(), b.getEmbedding().semantic());
            case TEMPORAL:
                return VectorMath.cosine(a.getEmbedding().temporal(), b.getEmbedding().temporal());
            case GRAPH:
                int distance = graph.undirectedDistance(a.getNoteId(), b.getNoteId());
                return distance == NoteGraph.UNREACHABLE ? 0.0 : 1.0 / (1.0 + distance);
            case STRUCTURAL:
                int degreeA = graph.degree(a.getNoteId());
                int degreeB = graph.degree(b.getNoteId());
                return 1.0 - (double) Math.abs(degreeA - degreeB) / Math.max(1, Math.max(degreeA, degreeB));
            case STALENESS:
                long staleA = ChronoUnit.DAYS.between(a.getModified().toLocalDate(), date);
                long staleB = ChronoUnit.DAYS.between(b.getModified().toLocalDate(), date);
                return 1.0 / (1.0 + Math.abs(staleA - staleB) / 30.0);
            default:
                throw new IllegalArgumentException("Unknown dimension " + dimension);
        }
    }

    private static boolean needsGraph(Dimension dimension) {
        return dimension == Dimension.GRAPH || dimension == Dimension.STRUCTURAL;
    }

    private static NoteGraph pairGraph(String noteA, String noteB, List<Link> links) {
        Set<String> nodes = new TreeSet<>();
        nodes.add(noteA);
        nodes.add(noteB);
        links.forEach(l -> {
            nodes.add(l.getSourceId());
            nodes.add(l.getTargetId());
        });
        return new NoteGraph(nodes, links, Map.of());
    }

    private static List<LocalDate> sharedSessions(NoteTrajectory a, NoteTrajectory b) {
        Set<LocalDate> other = b.getPoints().stream().map(TrajectoryPoint::getSessionDate).collect(Collectors.toSet());
        return a.getPoints().stream()
            .map(TrajectoryPoint::getSessionDate)
            .filter(other::contains)
            .collect(Collectors.toList());
    }

    private static Embedding embeddingAt(NoteTrajectory trajectory, LocalDate date) {
        return trajectory.at(date).orElseThrow().getRecord().getEmbedding();
    }

    private static double[] semanticDelta(Embedding first, Embedding last) {
        return VectorMath.subtract(last.semantic(), first.semantic());
    }

    private double alignment(double[] driftA, double[] driftB) {
        if (VectorMath.norm(driftA) <= settings.getDirectionEpsilon()
            || VectorMath.norm(driftB) <= settings.getDirectionEpsilon()) {
            return 0.0;
        }
        return VectorMath.cosine(driftA, driftB);
    }

    // late half mean minus early half mean; 0 below the minimum shared history
    private double halfDifference(List<Double> similarities) {
        if (similarities.size() < settings.getMinSharedSessions()) {
            return 0.0;
        }
        int midpoint = similarities.size() / 2;
        double early = similarities.subList(0, midpoint).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double late = similarities.subList(midpoint, similarities.size()).stream()
            .mapToDouble(Double::doubleValue).average().orElse(0.0);
        return late - early;
    }

    private static double driftBetween(double[] first, double[] last) {
        if (Arrays.equals(first, last)) {
            return 0.0;
        }
        return 1.0 - VectorMath.cosine(first, last);
    }

    private static double clip(double similarity) {
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    private static Map<Integer, Set<String>> members(SessionSnapshot snapshot) {
        Map<Integer, Set<String>> clusters = new TreeMap<>();
        snapshot.getRecords().values().stream()
            .filter(r -> !r.isNoise())
            .forEach(r -> clusters.computeIfAbsent(r.getClusterId(), k -> new TreeSet<>()).add(r.getNoteId()));
        return clusters;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }
}
