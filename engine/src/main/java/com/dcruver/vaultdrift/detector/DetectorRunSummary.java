package com.dcruver.vaultdrift.detector;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DetectorRunSummary {
    Map<String, List<Suggestion>> suggestions;
    /** Detector id to failure message for this run */
    Map<String, String> failures;
    /** Detectors skipped because they failed too often */
    List<String> disabled;

    public int suggestionCount() {
        return suggestions.values().stream().mapToInt(List::size).sum();
    }
}
