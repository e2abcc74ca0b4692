package com.dcruver.vaultdrift.reporting;

import com.dcruver.vaultdrift.detector.DetectorRunSummary;
import com.dcruver.vaultdrift.metrics.EmbeddingMetrics;
import com.dcruver.vaultdrift.session.SessionComputation;
import lombok.Builder;
import lombok.Data;

/**
 * Everything worth telling the user about one run.
 */
@Data
@Builder
public class RunReport {
    private SessionComputation computation;
    private DetectorRunSummary detectors;
    private EmbeddingMetrics metrics;
}
