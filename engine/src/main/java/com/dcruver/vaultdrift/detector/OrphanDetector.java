package com.dcruver.vaultdrift.detector;

import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.session.ScoredNote;
import com.dcruver.vaultdrift.session.SessionHandle;

import java.util.ArrayList;
import java.util.List;

/**
 * Points unlinked notes at their closest semantic neighbour.
 */
public class OrphanDetector implements Detector {

    private final int maxSuggestions;

    public OrphanDetector(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    @Override
    public List<Suggestion> suggest(SessionHandle session) {
        List<String> orphans = session.graph().orphans(0);
        List<Suggestion> suggestions = new ArrayList<>();
        for (String orphan : session.sample(orphans, maxSuggestions, "orphans")) {
            List<ScoredNote> nearest = session.neighbours(orphan, 1);
            if (nearest.isEmpty()) {
                continue;
            }
            String neighbour = nearest.get(0).getNoteId();
            suggestions.add(Suggestion.builder()
                .text(String.format("[[%s]] links to nothing and nothing links to it. Does it belong next to [[%s]]?",
                    title(session, orphan), title(session, neighbour)))
                .noteIds(List.of(orphan, neighbour))
                .build());
        }
        return suggestions;
    }

    private static String title(SessionHandle session, String noteId) {
        return session.note(noteId).map(Note::getTitle).orElse(noteId);
    }
}
