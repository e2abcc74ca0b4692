package com.dcruver.vaultdrift.reporting;

import com.dcruver.vaultdrift.detector.DetectorRunSummary;
import com.dcruver.vaultdrift.detector.Suggestion;
import com.dcruver.vaultdrift.metrics.EmbeddingMetrics;
import com.dcruver.vaultdrift.session.SessionComputation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders run reports as Markdown.
 */
@Component
@Slf4j
public class RunReportFormatter {

    /**
     * Write the report next to earlier ones, one file per session date.
     */
    public Path writeReport(RunReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path reportPath = directory.resolve(String.format("drift-report-%s.md", report.getComputation().getSessionDate()));
        Files.writeString(reportPath, format(report));
        log.info("Generated run report: {}", reportPath);
        return reportPath;
    }

    public String format(RunReport report) {
        StringBuilder sb = new StringBuilder();
        SessionComputation computation = report.getComputation();

        sb.append("# Drift session ").append(computation.getSessionDate()).append("\n\n");

        // Summary
        sb.append("## Summary\n\n");
        sb.append(String.format("- Notes in vault: %d\n", computation.getTotalNotes()));
        sb.append(String.format("- Notes embedded: %d\n", computation.getEmbeddedNotes()));
        sb.append(String.format("- Provider calls: %d\n", computation.getProviderCalls()));
        sb.append(String.format("- Clusters: %d (%d notes as noise)\n", computation.getClusterCount(), computation.getNoiseCount()));
        if (computation.isDegenerateClustering()) {
            sb.append("- Clustering was skipped: too few notes, every note is noise\n");
        }
        if (computation.getElapsed() != null) {
            sb.append(String.format("- Took: %.1f s\n", computation.getElapsed().toMillis() / 1000.0));
        }
        sb.append("\n");

        // Failures
        if (computation.hasFailures()) {
            sb.append("## Notes left out\n\n");
            computation.getFailures().forEach((noteId, reason) ->
                sb.append(String.format("- %s: %s\n", noteId, reason)));
            sb.append("\n");
        }

        // Metrics
        EmbeddingMetrics metrics = report.getMetrics();
        if (metrics != null) {
            sb.append("## Embedding space\n\n");
            sb.append(String.format("- Mean similarity: %.3f (std %.3f)\n", metrics.getMeanSimilarity(), metrics.getStdSimilarity()));
            sb.append(String.format("- Intrinsic dimension: %.1f\n", metrics.getIntrinsicDimension()));
            if (metrics.getSilhouette() != null) {
                sb.append(String.format("- Silhouette: %.3f\n", metrics.getSilhouette()));
            }
            if (metrics.getClusterEntropy() != null) {
                sb.append(String.format("- Cluster entropy: %.2f bits\n", metrics.getClusterEntropy()));
            }
            if (metrics.getSampledNotes() < metrics.getNoteCount()) {
                sb.append(String.format("- Pairwise statistics sampled %d of %d notes\n", metrics.getSampledNotes(), metrics.getNoteCount()));
            }
            sb.append("\n");
        }

        // Detectors
        DetectorRunSummary detectors = report.getDetectors();
        if (detectors != null) {
            sb.append("## Suggestions\n\n");
            for (Map.Entry<String, List<Suggestion>> entry : detectors.getSuggestions().entrySet()) {
                for (Suggestion suggestion : entry.getValue()) {
                    sb.append(String.format("- (%s) %s\n", entry.getKey(), suggestion.getText()));
                }
            }
            if (detectors.suggestionCount() == 0) {
                sb.append("- None this session\n");
            }
            detectors.getFailures().forEach((id, reason) ->
                sb.append(String.format("- Detector %s failed: %s\n", id, reason)));
            if (!detectors.getDisabled().isEmpty()) {
                sb.append(String.format("- Disabled detectors: %s\n", String.join(", ", detectors.getDisabled())));
            }
        }

        return sb.toString();
    }
}
