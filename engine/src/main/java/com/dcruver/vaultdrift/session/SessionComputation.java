package com.dcruver.vaultdrift.session;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

/**
 * Outcome of computing one session.
 */
@Value
@Builder
public class SessionComputation {
    LocalDate sessionDate;
    int totalNotes;
    int embeddedNotes;
    /** Note id to failure message, for notes left out of the session */
    Map<String, String> failures;
    int clusterCount;
    int noiseCount;
    boolean degenerateClustering;
    long providerCalls;
    Duration elapsed;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
