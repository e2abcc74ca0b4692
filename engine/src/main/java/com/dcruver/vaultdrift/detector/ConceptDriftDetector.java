package com.dcruver.vaultdrift.detector;

import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.session.SessionHandle;
import com.dcruver.vaultdrift.trajectory.NoteTrajectory;
import com.dcruver.vaultdrift.trajectory.TrajectoryAnalyzer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Flags notes whose meaning moved furthest across the stored history.
 */
public class ConceptDriftDetector implements Detector {

    private final double threshold;
    private final int maxSuggestions;

    public ConceptDriftDetector(double threshold, int maxSuggestions) {
        this.threshold = threshold;
        this.maxSuggestions = maxSuggestions;
    }

    @Override
    public List<Suggestion> suggest(SessionHandle session) {
        List<LocalDate> history = session.history();
        if (history.size() < 2) {
            return List.of();
        }
        TrajectoryAnalyzer analyzer = session.trajectories();
        Map<String, Double> drifted = new TreeMap<>();
        for (String noteId : session.noteIds()) {
            NoteTrajectory trajectory = analyzer.trajectory(noteId, history);
            OptionalDouble drift = analyzer.drift(trajectory);
            if (trajectory.size() >= 2 && drift.isPresent() && drift.getAsDouble() >= threshold) {
                drifted.put(noteId, drift.getAsDouble());
            }
        }

        List<Map.Entry<String, Double>> ranked = new ArrayList<>(drifted.entrySet());
        ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

        List<Suggestion> suggestions = new ArrayList<>();
        for (Map.Entry<String, Double> entry : ranked.subList(0, Math.min(maxSuggestions, ranked.size()))) {
            String title = session.note(entry.getKey()).map(Note::getTitle).orElse(entry.getKey());
            suggestions.add(Suggestion.builder()
                .text(String.format("[[%s]] has drifted %.2f since %s. Is it still about what it started as?",
                    title, entry.getValue(), history.get(0)))
                .noteIds(List.of(entry.getKey()))
                .build());
        }
        return suggestions;
    }
}
