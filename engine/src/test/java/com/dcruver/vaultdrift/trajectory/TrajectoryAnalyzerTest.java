package com.dcruver.vaultdrift.trajectory;

import com.dcruver.vaultdrift.VaultFixtures;
import com.dcruver.vaultdrift.domain.Link;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.nlp.TemporalCompositor;
import com.dcruver.vaultdrift.nlp.VectorMath;
import com.dcruver.vaultdrift.store.SchemaManager;
import com.dcruver.vaultdrift.store.SessionRecord;
import com.dcruver.vaultdrift.store.SessionStore;
import com.dcruver.vaultdrift.store.WriteMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.dcruver.vaultdrift.VaultFixtures.clusteredRecord;
import static com.dcruver.vaultdrift.VaultFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

class TrajectoryAnalyzerTest {

    private static final LocalDate S1 = LocalDate.of(2025, 1, 1);
    private static final LocalDate S2 = LocalDate.of(2025, 2, 1);
    private static final LocalDate S3 = LocalDate.of(2025, 3, 1);
    private static final LocalDate S4 = LocalDate.of(2025, 4, 1);
    private static final List<LocalDate> ALL = List.of(S1, S2, S3, S4);

    @TempDir
    Path tempDir;

    private SessionStore store;
    private TrajectoryAnalyzer analyzer;
    private final TemporalCompositor compositor = new TemporalCompositor(0.9, 0.1, 1);

    @BeforeEach
    void setUp() {
        DataSource dataSource = VaultFixtures.dataSource(tempDir);
        store = new SessionStore(dataSource, new SchemaManager(dataSource));
        analyzer = new TrajectoryAnalyzer(store, VaultFixtures.properties());
    }

    private void write(LocalDate date, List<Link> links, SessionRecord... records) {
        store.writeSession(date, "hash-" + date, List.of(records), links, WriteMode.REJECT_EXISTING);
    }

    // ===== Single note =====

    @Test
    void testUnchangedNoteHasZeroDrift() {
        write(S1, List.of(), record("a", 0.3, 0.4, 0.5));
        write(S2, List.of(), record("a", 0.3, 0.4, 0.5));
        write(S3, List.of(), record("a", 0.3, 0.4, 0.5));

        assertEquals(0.0, analyzer.drift("a", List.of(S1, S2, S3)).getAsDouble());
        assertTrue(analyzer.driftDirection(analyzer.trajectory("a", List.of(S1, S2, S3))).isEmpty());
    }

    @Test
    void testDriftWithShortHistory() {
        write(S1, List.of(), record("a", 1.0, 0.0));

        assertEquals(OptionalDouble.of(0.0), analyzer.drift("a", ALL));
        assertTrue(analyzer.drift("unknown", ALL).isEmpty());
        assertTrue(analyzer.velocity("a", ALL).isEmpty());
        assertTrue(analyzer.acceleration("a", ALL).isEmpty());
    }

    @Test
    void testDriftBetweenFirstAndLastSnapshot() {
        write(S1, List.of(), record("a", 1.0, 0.0));
        write(S2, List.of(), record("b", 1.0, 0.0));
        write(S3, List.of(), record("a", 0.0, 1.0));

        // S2 lacks the note and is skipped
        NoteTrajectory trajectory = analyzer.trajectory("a", ALL);
        assertEquals(2, trajectory.size());
        assertEquals(1.0, analyzer.drift(trajectory).getAsDouble(), 1e-12);
        double[] direction = analyzer.driftDirection(trajectory).orElseThrow();
        assertEquals(-Math.sqrt(0.5), direction[0], 1e-12);
        assertEquals(Math.sqrt(0.5), direction[1], 1e-12);
        assertEquals(1.0, analyzer.driftAlignment(trajectory, new double[] {-2.0, 2.0}), 1e-12);
    }

    @Test
    void testLateMovementAccelerates() {
        write(S1, List.of(), record("a", 1.0, 0.0));
        write(S2, List.of(), record("a", 1.0, 0.0));
        write(S3, List.of(), record("a", 1.0, 0.0));
        write(S4, List.of(), record("a", 0.0, 1.0));

        assertEquals(List.of(0.0, 1.0), analyzer.windowedDriftRates("a", ALL));
        assertEquals(1.0, analyzer.velocity("a", ALL).getAsDouble(), 1e-12);
        assertEquals(1.0, analyzer.acceleration("a", ALL).getAsDouble(), 1e-12);
        assertTrue(analyzer.isAccelerating(analyzer.trajectory("a", ALL)));
    }

    // ===== Pairs =====

    @Test
    void testCloseNotesDriftingApart() {
        write(S1, List.of(), record("a", 1.0, 0.1, 0.0), record("b", 1.0, -0.1, 0.0));
        write(S2, List.of(), record("a", 1.0, 0.3, 0.0), record("b", 1.0, -0.3, 0.0));

        TrajectoryReversal reversal = analyzer.trajectoryReversal("a", "b", ALL);

        assertEquals(ReversalKind.CLOSE_DIVERGING, reversal.getKind());
        assertEquals(0.91 / 1.09, reversal.getCurrentSimilarity(), 1e-9);
        assertEquals(-1.0, reversal.getAlignment(), 1e-9);
    }

    @Test
    void testDistantNotesDriftingTogether() {
        write(S1, List.of(), record("a", 1.0, 0.0, 0.0), record("b", 0.0, 1.0, 0.0));
        write(S2, List.of(), record("a", 1.0, 0.0, 0.5), record("b", 0.0, 1.0, 0.5));

        TrajectoryReversal reversal = analyzer.trajectoryReversal("a", "b", ALL);

        assertEquals(ReversalKind.DISTANT_CONVERGING, reversal.getKind());
        assertEquals(0.2, reversal.getCurrentSimilarity(), 1e-9);
    }

    @Test
    void testReversalNeedsTwoSharedSessions() {
        write(S1, List.of(), record("a", 1.0, 0.0), record("b", 0.0, 1.0));
        write(S2, List.of(), record("a", 1.0, 0.0));

        assertEquals(ReversalKind.INSUFFICIENT_DATA, analyzer.trajectoryReversal("a", "b", ALL).getKind());
    }

    @Test
    void testClassifyReversalThresholds() {
        assertEquals(ReversalKind.CLOSE_DIVERGING, analyzer.classifyReversal(0.85, -0.7));
        assertEquals(ReversalKind.DISTANT_CONVERGING, analyzer.classifyReversal(0.2, 0.6));
        assertEquals(ReversalKind.NONE, analyzer.classifyReversal(0.85, 0.7));
        assertEquals(ReversalKind.NONE, analyzer.classifyReversal(0.5, -0.9));
    }

    @Test
    void testConvergingPair() {
        write(S1, List.of(), record("a", 1.0, 0.0), record("b", 0.1, 1.0));
        write(S2, List.of(), record("a", 1.0, 0.0), record("b", 0.2, 1.0));
        write(S3, List.of(), record("a", 1.0, 0.0), record("b", 1.0, 0.3));
        write(S4, List.of(), record("a", 1.0, 0.0), record("b", 1.0, 0.1));

        NoteTrajectory a = analyzer.trajectory("a", ALL);
        NoteTrajectory b = analyzer.trajectory("b", ALL);

        assertEquals(4, analyzer.similarityTrajectory(a, b).size());
        assertTrue(analyzer.isConverging(a, b));
        assertFalse(analyzer.isDiverging(a, b));
        assertFalse(analyzer.isConverging(b, analyzer.trajectory("unknown", ALL)));
    }

    @Test
    void testSemanticAndGraphMovingTogether() {
        // b swings towards a and away again, and the link between them comes and goes with it
        write(S1, List.of(), record("a", 1.0, 0.0), record("b", 0.0, 1.0));
        write(S2, List.of(Link.of("a", "b")), record("a", 1.0, 0.0), record("b", 1.0, 1.0));
        write(S3, List.of(), record("a", 1.0, 0.0), record("b", 0.0, 1.0));
        write(S4, List.of(Link.of("b", "a")), record("a", 1.0, 0.0), record("b", 1.0, 1.0));

        MovementCorrelation correlation = analyzer.correlatedMovement("a", "b", Dimension.SEMANTIC,
            Dimension.GRAPH, ALL);

        assertEquals(3, correlation.getSteps());
        assertEquals(1.0, correlation.getCoefficient(), 1e-9);
        assertEquals(CorrelationKind.STRONGLY_CORRELATED, correlation.getKind());
    }

    @Test
    void testCorrelationNeedsSharedHistory() {
        write(S1, List.of(), record("a", 1.0, 0.0), record("b", 0.0, 1.0));
        write(S2, List.of(), record("a", 1.0, 0.0), record("b", 1.0, 1.0));

        MovementCorrelation correlation = analyzer.correlatedMovement("a", "b", Dimension.SEMANTIC,
            Dimension.STALENESS, ALL);

        assertEquals(CorrelationKind.INSUFFICIENT_DATA, correlation.getKind());
    }

    @Test
    void testIndependentMovementIsDecoupled() {
        double[] semantic = {1, -1, 1, -1, 1, -1};
        double[] graph = {1, 1, -1, -1, 1, 1};

        MovementCorrelation correlation = analyzer.correlate(Dimension.SEMANTIC, Dimension.GRAPH, semantic, graph);

        assertEquals(0.0, correlation.getCoefficient(), 1e-12);
        assertEquals(CorrelationKind.DECOUPLED, correlation.getKind());
        assertEquals(6, correlation.getSteps());
    }

    @Test
    void testCorrelateEdgeCases() {
        assertThrows(IllegalArgumentException.class,
            () -> analyzer.correlate(Dimension.SEMANTIC, Dimension.GRAPH, new double[] {1, -1}, new double[] {1}));
        assertEquals(CorrelationKind.INSUFFICIENT_DATA,
            analyzer.correlate(Dimension.SEMANTIC, Dimension.GRAPH, new double[] {1}, new double[] {1}).getKind());
        // no variance counts as no relationship
        assertEquals(CorrelationKind.DECOUPLED,
            analyzer.correlate(Dimension.SEMANTIC, Dimension.GRAPH, new double[] {1, 1, 1}, new double[] {1, -1, 1})
                .getKind());
    }

    @Test
    void testClassifyCorrelationBands() {
        assertEquals(CorrelationKind.STRONGLY_CORRELATED, analyzer.classifyCorrelation(0.9));
        assertEquals(CorrelationKind.CORRELATED, analyzer.classifyCorrelation(0.5));
        assertEquals(CorrelationKind.DECOUPLED, analyzer.classifyCorrelation(0.1));
        assertEquals(CorrelationKind.ANTI_CORRELATED, analyzer.classifyCorrelation(-0.4));
        assertEquals(CorrelationKind.OPPOSING, analyzer.classifyCorrelation(-0.8));
    }

    @Test
    void testDirectionSigns() {
        assertArrayEquals(new double[] {1.0, 0.0, -1.0},
            analyzer.directionSigns(new double[] {0.1, 0.5, 0.5, 0.2}));
        assertEquals(0, analyzer.directionSigns(new double[] {0.4}).length);
    }

    // ===== Clusters =====

    @Test
    void testClusterMigrations() {
        write(S1, List.of(),
            clusteredRecord("a", 0, 1.0, 0.0), clusteredRecord("b", 0, 1.0, 0.1), clusteredRecord("c", 0, 1.0, 0.2),
            clusteredRecord("d", 1, 0.0, 1.0), clusteredRecord("e", 1, 0.1, 1.0), record("f", 0.5, 0.5));
        write(S2, List.of(),
            clusteredRecord("a", 0, 1.0, 0.0), clusteredRecord("b", 0, 1.0, 0.1), clusteredRecord("c", 1, 0.2, 1.0),
            clusteredRecord("d", 1, 0.0, 1.0), clusteredRecord("e", 1, 0.1, 1.0), clusteredRecord("f", 2, 0.5, 0.5));

        ClusterMigration migration = analyzer.clusterMigrations(S1, S2);

        assertEquals(Map.of(0, 0, 1, 1), migration.getMatches());
        assertEquals(List.of(2), migration.getBirths());
        assertTrue(migration.getDeaths().isEmpty());
        assertEquals(List.of("c", "f"), migration.getMigratedNotes());
    }

    @Test
    void testCyclingNote() {
        List<LocalDate> dates = new ArrayList<>();
        double[][] path = {{1, 0}, {0, 1}, {1, 0}, {0, 1}, {1, 0}};
        for (int i = 0; i < path.length; i++) {
            LocalDate date = S1.plusDays(i);
            write(date, List.of(), record("a", path[i]));
            dates.add(date);
        }

        NoteTrajectory trajectory = analyzer.trajectory("a", dates);

        assertTrue(analyzer.isCycling(trajectory, 2));
        assertFalse(analyzer.isCycling(trajectory, 3));
    }

    // ===== Composed embeddings =====

    private SessionRecord composed(String noteId, LocalDate session, double... semantic) {
        return SessionRecord.builder()
            .noteId(noteId)
            .contentHash(Note.hash(noteId))
            .modified(VaultFixtures.CREATED)
            .embedding(compositor.compose(VectorMath.normalize(semantic), VaultFixtures.CREATED, session))
            .build();
    }

    private void writeUnchangedPair() {
        for (LocalDate date : ALL) {
            write(date, List.of(), composed("a", date, 1, 0, 0, 0), composed("b", date, 0, 1, 0, 0));
        }
    }

    @Test
    void testUnchangedContentOnlyAges() {
        writeUnchangedPair();
        NoteTrajectory trajectory = analyzer.trajectory("a", ALL);

        // the temporal features still move the full embedding a little
        double drift = analyzer.drift(trajectory).getAsDouble();
        assertTrue(drift > 0.0);
        assertTrue(drift < 0.05);
        assertTrue(analyzer.driftDirection(trajectory).isEmpty());
        assertEquals(0.0, analyzer.driftAlignment(trajectory, new double[] {1, 0, 0, 0}));
    }

    @Test
    void testUnchangedDistantPairIsNotConverging() {
        writeUnchangedPair();

        TrajectoryReversal reversal = analyzer.trajectoryReversal("a", "b", ALL);

        assertEquals(ReversalKind.NONE, reversal.getKind());
        assertEquals(0.0, reversal.getAlignment());
        assertTrue(reversal.getCurrentSimilarity() < 0.3);
        assertFalse(analyzer.isConverging(analyzer.trajectory("a", ALL), analyzer.trajectory("b", ALL)));
    }

    @Test
    void testUnchangedPairMovementIsDecoupled() {
        writeUnchangedPair();

        MovementCorrelation correlation = analyzer.correlatedMovement("a", "b", Dimension.SEMANTIC,
            Dimension.TEMPORAL, ALL);

        assertEquals(3, correlation.getSteps());
        assertEquals(0.0, correlation.getCoefficient());
        assertEquals(CorrelationKind.DECOUPLED, correlation.getKind());
    }

    @Test
    void testCloseNotesHeadingApartAfterFiveSessions() {
        LocalDate s5 = LocalDate.of(2025, 5, 1);
        for (LocalDate date : ALL) {
            write(date, List.of(), composed("a", date, 1, 0, 1), composed("b", date, 1, 0, 1));
        }
        write(s5, List.of(), composed("a", s5, 1, 0.37, 0.8), composed("b", s5, 1, -0.37, 0.8));
        List<LocalDate> sessions = List.of(S1, S2, S3, S4, s5);

        TrajectoryReversal reversal = analyzer.trajectoryReversal("a", "b", sessions);

        assertEquals(0.85, reversal.getCurrentSimilarity(), 0.01);
        assertEquals(-0.7, reversal.getAlignment(), 0.01);
        assertEquals(ReversalKind.CLOSE_DIVERGING, reversal.getKind());
    }
}
