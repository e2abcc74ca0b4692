package com.dcruver.vaultdrift.session;

import com.dcruver.vaultdrift.cluster.ClusterResult;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.trajectory.TrajectoryAnalyzer;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one stored session, handed to detectors and vault functions.
 * Answers are deterministic for the session date.
 */
public interface SessionHandle {

    LocalDate sessionDate();

    /** Seed for any randomness, derived from the date */
    long seed();

    List<String> noteIds();

    List<Note> notes();

    Optional<Note> note(String noteId);

    Optional<Embedding> embedding(String noteId);

    /**
     * Cosine similarity clipped to [0, 1]. Symmetric; 0 when either note is not in the session.
     */
    double similarity(String a, String b);

    /**
     * Similarity of every note in {@code rows} to every note in {@code columns}.
     */
    double[][] batchSimilarity(List<String> rows, List<String> columns);

    List<ScoredNote> neighbours(String noteId, int k);

    /**
     * Most similar pairs of notes without a link between them.
     */
    List<NotePair> unlinkedPairs(int k);

    NoteGraph graph();

    ClusterResult clusters();

    List<String> representatives(int clusterId, int k);

    /**
     * Stored session dates up to and including this one, oldest first.
     */
    List<LocalDate> history();

    TrajectoryAnalyzer trajectories();

    <T> List<T> sample(List<T> items, int k, String salt);
}
