package com.dcruver.vaultdrift.trajectory;

import com.dcruver.vaultdrift.domain.Embedding;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * A note's stored snapshots in session order. Derived on demand, never persisted.
 */
@Value
public class NoteTrajectory {
    String noteId;
    List<TrajectoryPoint> points;

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Optional<TrajectoryPoint> at(LocalDate sessionDate) {
        return points.stream().filter(p -> p.getSessionDate().equals(sessionDate)).findFirst();
    }

    public Embedding embedding(int index) {
        return points.get(index).getRecord().getEmbedding();
    }

    public double[] vector(int index) {
        return embedding(index).values();
    }
}
