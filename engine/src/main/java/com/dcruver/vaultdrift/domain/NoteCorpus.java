package com.dcruver.vaultdrift.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of the notes and links the engine analyzes for one session.
 * Notes are kept in id order so every downstream step sees the same ordering.
 */
public final class NoteCorpus {

    private final Map<String, Note> notes;
    private final List<Link> links;

    public NoteCorpus(List<Note> notes, List<Link> links) {
        Map<String, Note> byId = new LinkedHashMap<>();
        notes.stream()
            .sorted(Comparator.comparing(Note::getId))
            .forEach(n -> byId.put(n.getId(), n));
        this.notes = Collections.unmodifiableMap(byId);
        // Links to notes outside the corpus are dangling and dropped
        this.links = links.stream()
            .filter(l -> byId.containsKey(l.getSourceId()) && byId.containsKey(l.getTargetId()))
            .filter(l -> !l.getSourceId().equals(l.getTargetId()))
            .distinct()
            .sorted(Comparator.comparing(Link::getSourceId).thenComparing(Link::getTargetId))
            .collect(Collectors.toUnmodifiableList());
    }

    public static NoteCorpus empty() {
        return new NoteCorpus(List.of(), List.of());
    }

    public List<Note> notes() {
        return new ArrayList<>(notes.values());
    }

    public Optional<Note> note(String id) {
        return Optional.ofNullable(notes.get(id));
    }

    public Set<String> noteIds() {
        return notes.keySet();
    }

    public List<Link> links() {
        return links;
    }

    public int size() {
        return notes.size();
    }

    /**
     * Fingerprint of the corpus: SHA-256 over sorted id and modified timestamp pairs.
     */
    public String stateHash() {
        StringBuilder sb = new StringBuilder();
        for (Note note : notes.values()) {
            sb.append(note.getId()).append('\u0000')
                .append(note.getModified()).append('\n');
        }
        return Note.hash(sb.toString());
    }
}
