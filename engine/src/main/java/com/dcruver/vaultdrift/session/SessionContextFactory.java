package com.dcruver.vaultdrift.session;

import com.dcruver.vaultdrift.cluster.ClusterEngine;
import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.store.NoteRepository;
import com.dcruver.vaultdrift.store.SessionRecord;
import com.dcruver.vaultdrift.store.SessionSnapshot;
import com.dcruver.vaultdrift.store.SessionStore;
import com.dcruver.vaultdrift.trajectory.TrajectoryAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Opens a fresh {@link SessionContext} for each run. Contexts are never shared between runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionContextFactory {

    private final SessionStore sessionStore;
    private final NoteRepository noteRepository;
    private final ClusterEngine clusterEngine;
    private final TrajectoryAnalyzer trajectoryAnalyzer;
    private final EngineProperties properties;

    /**
     * @throws com.dcruver.vaultdrift.domain.SessionNotFoundException if the date has no stored session
     */
    public SessionContext open(LocalDate sessionDate) {
        SessionSnapshot snapshot = sessionStore.readSession(sessionDate);

        Map<String, Note> current = noteRepository.findAllById(snapshot.noteIds()).stream()
            .collect(Collectors.toMap(Note::getId, n -> n));
        Map<String, Note> notes = new LinkedHashMap<>();
        for (SessionRecord record : snapshot.getRecords().values()) {
            // notes deleted since the session keep a placeholder built from the record
            notes.put(record.getNoteId(), current.getOrDefault(record.getNoteId(), Note.builder()
                .id(record.getNoteId())
                .title(record.getNoteId())
                .content("")
                .created(record.getModified())
                .modified(record.getModified())
                .build()));
        }

        List<LocalDate> history = sessionStore.sessionsBetween(LocalDate.of(1, 1, 1), sessionDate);
        log.debug("Opened session context {} with {} notes and {} prior sessions",
            sessionDate, notes.size(), history.size() - 1);
        return new SessionContext(snapshot, notes, history, clusterEngine, trajectoryAnalyzer,
            properties.getSimilarity().getUnlinkedPairThreshold(),
            properties.getSimilarity().getUnlinkedPairCandidateLimit());
    }
}
