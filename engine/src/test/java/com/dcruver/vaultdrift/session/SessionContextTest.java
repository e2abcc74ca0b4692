package com.dcruver.vaultdrift.session;

import com.dcruver.vaultdrift.cluster.ClusterEngine;
import com.dcruver.vaultdrift.cluster.ClusterLabeler;
import com.dcruver.vaultdrift.domain.Link;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.store.SessionRecord;
import com.dcruver.vaultdrift.store.SessionSnapshot;
import com.dcruver.vaultdrift.trajectory.TrajectoryAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.dcruver.vaultdrift.VaultFixtures.clusteredRecord;
import static com.dcruver.vaultdrift.VaultFixtures.note;
import static com.dcruver.vaultdrift.VaultFixtures.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class SessionContextTest {

    private static final LocalDate SESSION = LocalDate.of(2025, 3, 1);

    private SessionContext context;

    @BeforeEach
    void setUp() {
        Map<String, SessionRecord> records = new LinkedHashMap<>();
        records.put("a", clusteredRecord("a", 0, 1.0, 0.0));
        records.put("b", clusteredRecord("b", 0, 0.8, 0.6));
        records.put("c", record("c", 0.0, 1.0));
        records.put("d", record("d", -1.0, 0.0));
        records.put("e", record("e", 0.6, 0.8));
        Map<String, Note> notes = new LinkedHashMap<>();
        records.keySet().forEach(id -> notes.put(id, note(id, "Note " + id)));

        SessionSnapshot snapshot = new SessionSnapshot(SESSION, "hash", records, List.of(Link.of("a", "b")));
        ClusterEngine clusterEngine = new ClusterEngine(3, 2, 200, new ClusterLabeler(4, 8, 100, 0.5));
        context = new SessionContext(snapshot, notes, List.of(LocalDate.of(2025, 2, 1), SESSION), clusterEngine,
            mock(TrajectoryAnalyzer.class), 0.5, 0);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void testSimilarityIsSymmetricAndClipped() {
        assertEquals(0.8, context.similarity("a", "b"), 1e-9);
        assertEquals(context.similarity("a", "b"), context.similarity("b", "a"));
        // opposite vectors clip to 0
        assertEquals(0.0, context.similarity("a", "d"));
        assertEquals(1.0, context.similarity("c", "c"), 1e-9);

        assertEquals(3, context.similarityCache().size());
        assertTrue(context.similarityCache().hits() >= 1);
    }

    @Test
    void testMissingNoteHasZeroSimilarity() {
        assertEquals(0.0, context.similarity("a", "gone"));
        assertEquals(0.0, context.similarity("gone", "gone"));
        assertEquals(0, context.similarityCache().size());
    }

    @Test
    void testBatchSimilarityFillsRunCache() {
        double[][] matrix = context.batchSimilarity(List.of("a", "b"), List.of("c", "e"));

        assertEquals(0.0, matrix[0][0], 1e-9);
        assertEquals(0.6, matrix[0][1], 1e-9);
        assertEquals(0.6, matrix[1][0], 1e-9);
        assertEquals(0.96, matrix[1][1], 1e-9);
        assertTrue(context.similarityCache().peek(SESSION, "e", "b").isPresent());
        assertTrue(context.similarityCache().peek(LocalDate.of(2025, 2, 1), "e", "b").isEmpty());
    }

    @Test
    void testNeighboursNearestFirst() {
        List<ScoredNote> neighbours = context.neighbours("a", 3);

        assertEquals(List.of("b", "e", "c"), neighbours.stream().map(ScoredNote::getNoteId).collect(Collectors.toList()));
        assertTrue(context.neighbours("gone", 3).isEmpty());
        assertTrue(context.neighbours("a", 0).isEmpty());
    }

    @Test
    void testUnlinkedPairsCoverEveryNote() {
        List<NotePair> pairs = context.unlinkedPairs(10);

        // a-b is linked and left out, every other pair above 0.5 shows up
        assertEquals(4, pairs.size());
        assertEquals("b", pairs.get(0).getFirst());
        assertEquals("e", pairs.get(0).getSecond());
        assertEquals(0.96, pairs.get(0).getSimilarity(), 1e-9);
        assertEquals(Set.of("b|e", "c|e", "a|e", "b|c"),
            pairs.stream().map(p -> p.getFirst() + "|" + p.getSecond()).collect(Collectors.toSet()));
        assertEquals(1, context.unlinkedPairs(1).size());
    }

    @Test
    void testGraphAndClustersFromSnapshot() {
        assertEquals(List.of("c", "d", "e"), context.graph().orphans(0).stream().sorted().collect(Collectors.toList()));
        assertEquals(1, context.clusters().clusterCount());
        assertEquals(List.of("a", "b"), context.clusters().cluster(0).orElseThrow().getMemberIds());
        assertEquals(1, context.representatives(0, 1).size());
        assertTrue(context.representatives(7, 1).isEmpty());
    }

    @Test
    void testSamplingRepeatsForTheDate() {
        List<String> ids = context.noteIds();

        assertEquals(20250301L, context.seed());
        assertEquals(context.sample(ids, 3, "salt"), context.sample(ids, 3, "salt"));
        assertEquals(3, context.sample(ids, 3, "salt").size());
        assertEquals(5, context.sample(ids, 10, "salt").size());
        assertTrue(context.sample(ids, 0, "salt").isEmpty());
    }

    @Test
    void testClosedContextRejectsQueries() {
        context.similarity("a", "b");
        context.close();

        assertEquals(0, context.similarityCache().size());
        assertThrows(IllegalStateException.class, () -> context.similarity("a", "b"));
        assertThrows(IllegalStateException.class, () -> context.graph());
    }
}
