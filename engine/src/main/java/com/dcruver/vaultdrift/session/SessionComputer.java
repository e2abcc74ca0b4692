package com.dcruver.vaultdrift.session;

import com.dcruver.vaultdrift.cluster.ClusterEngine;
import com.dcruver.vaultdrift.cluster.ClusterResult;
import com.dcruver.vaultdrift.domain.Deadline;
import com.dcruver.vaultdrift.domain.Embedding;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException;
import com.dcruver.vaultdrift.domain.InvalidNoteTimestampException;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.domain.NoteCorpus;
import com.dcruver.vaultdrift.nlp.SemanticCache;
import com.dcruver.vaultdrift.nlp.TemporalCompositor;
import com.dcruver.vaultdrift.store.NoteRepository;
import com.dcruver.vaultdrift.store.SessionRecord;
import com.dcruver.vaultdrift.store.SessionStore;
import com.dcruver.vaultdrift.store.WriteMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes and stores the session for a date: semantic vectors through the cache, temporal features for
 * the date, clusters, then one atomic write.
 *
 * Notes whose vector cannot be produced are reported and left out; the rest of the session still gets
 * written. A passed deadline aborts the whole session and nothing is stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionComputer {

    private final SemanticCache semanticCache;
    private final TemporalCompositor temporalCompositor;
    private final ClusterEngine clusterEngine;
    private final SessionStore sessionStore;
    private final NoteRepository noteRepository;

    public SessionComputation computeSession(LocalDate sessionDate, WriteMode mode, Deadline deadline) {
        return computeSession(sessionDate, noteRepository.loadCorpus(), mode, deadline);
    }

    public SessionComputation computeSession(LocalDate sessionDate, NoteCorpus corpus, WriteMode mode,
                                             Deadline deadline) {
        Instant started = Instant.now();
        long callsBefore = semanticCache.getStats().getProviderCalls();
        log.info("Computing session {} over {} notes", sessionDate, corpus.size());

        Map<String, Embedding> embeddings = new TreeMap<>();
        Map<String, Note> notes = new LinkedHashMap<>();
        Map<String, String> failures = new TreeMap<>();
        for (Note note : corpus.notes()) {
            deadline.check("embedding");
            try {
                double[] semantic = semanticCache.getOrCompute(note.getContentHash(), note.getContent(), deadline);
                embeddings.put(note.getId(), temporalCompositor.compose(semantic, note.getCreated(), sessionDate));
                notes.put(note.getId(), note);
            } catch (EmbeddingUnavailableException | InvalidNoteTimestampException e) {
                log.warn("Leaving note {} out of session {}: {}", note.getId(), sessionDate, e.getMessage());
                failures.put(note.getId(), e.getMessage());
            }
        }

        ClusterResult clusters = clusterEngine.cluster(embeddings, notes, deadline);

        List<SessionRecord> records = new ArrayList<>(embeddings.size());
        embeddings.forEach((noteId, embedding) -> {
            int clusterId = clusters.clusterOf(noteId);
            boolean noise = clusterId == ClusterResult.NOISE;
            records.add(SessionRecord.builder()
                .noteId(noteId)
                .contentHash(notes.get(noteId).getContentHash())
                .modified(notes.get(noteId).getModified())
                .embedding(embedding)
                .clusterId(noise ? null : clusterId)
                .clusterLabel(noise ? null : clusters.cluster(clusterId).map(c -> c.getKeywordLabel()).orElse(null))
                .build());
        });

        // links of notes that failed to embed are not part of this session
        NoteCorpus stored = new NoteCorpus(new ArrayList<>(notes.values()), corpus.links());
        deadline.check("session write");
        sessionStore.writeSession(sessionDate, corpus.stateHash(), records, stored.links(), mode);

        SessionComputation computation = SessionComputation.builder()
            .sessionDate(sessionDate)
            .totalNotes(corpus.size())
            .embeddedNotes(records.size())
            .failures(failures)
            .clusterCount(clusters.clusterCount())
            .noiseCount(clusters.noise().size())
            .degenerateClustering(clusters.isDegenerate())
            .providerCalls(semanticCache.getStats().getProviderCalls() - callsBefore)
            .elapsed(Duration.between(started, Instant.now()))
            .build();
        log.info("Session {} stored: {} of {} notes, {} clusters, {} failures, {} provider calls",
            sessionDate, records.size(), corpus.size(), computation.getClusterCount(), failures.size(),
            computation.getProviderCalls());
        return computation;
    }
}
