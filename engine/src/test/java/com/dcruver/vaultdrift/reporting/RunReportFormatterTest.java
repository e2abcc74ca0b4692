package com.dcruver.vaultdrift.reporting;

import com.dcruver.vaultdrift.detector.DetectorRunSummary;
import com.dcruver.vaultdrift.detector.Suggestion;
import com.dcruver.vaultdrift.session.SessionComputation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunReportFormatterTest {

    private RunReportFormatter formatter;
    private RunReport report;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        formatter = new RunReportFormatter();
        SessionComputation computation = SessionComputation.builder()
            .sessionDate(LocalDate.of(2025, 1, 14))
            .totalNotes(10)
            .embeddedNotes(9)
            .failures(Map.of("broken.md", "Provider did not answer"))
            .clusterCount(0)
            .noiseCount(9)
            .degenerateClustering(true)
            .providerCalls(9)
            .elapsed(Duration.ofMillis(1500))
            .build();
        DetectorRunSummary detectors = DetectorRunSummary.builder()
            .suggestions(Map.of("orphans", List.of(Suggestion.builder()
                .text("[[Lonely]] links to nothing")
                .noteIds(List.of("lonely.md"))
                .detectorId("orphans")
                .build())))
            .failures(Map.of("concept_drift", "timed out after 100 ms"))
            .disabled(List.of("concept_drift"))
            .build();
        report = RunReport.builder().computation(computation).detectors(detectors).build();
    }

    @Test
    void testFormatCoversEverySection() {
        String markdown = formatter.format(report);

        assertTrue(markdown.startsWith("# Drift session 2025-01-14"));
        assertTrue(markdown.contains("- Notes embedded: 9"));
        assertTrue(markdown.contains("Clustering was skipped"));
        assertTrue(markdown.contains("- broken.md: Provider did not answer"));
        assertTrue(markdown.contains("- (orphans) [[Lonely]] links to nothing"));
        assertTrue(markdown.contains("- Detector concept_drift failed: timed out after 100 ms"));
        assertTrue(markdown.contains("- Disabled detectors: concept_drift"));
        assertFalse(markdown.contains("## Embedding space"));
    }

    @Test
    void testWriteReportPerSessionDate() throws Exception {
        Path written = formatter.writeReport(report, tempDir.resolve("reports"));

        assertEquals("drift-report-2025-01-14.md", written.getFileName().toString());
        assertEquals(formatter.format(report), Files.readString(written));
    }
}
