package com.dcruver.vaultdrift.app;

import com.dcruver.vaultdrift.cluster.Cluster;
import com.dcruver.vaultdrift.cluster.ClusterResult;
import com.dcruver.vaultdrift.detector.DetectorExecutor;
import com.dcruver.vaultdrift.detector.DetectorRunSummary;
import com.dcruver.vaultdrift.domain.Deadline;
import com.dcruver.vaultdrift.metrics.EmbeddingMetrics;
import com.dcruver.vaultdrift.metrics.EmbeddingMetricsComputer;
import com.dcruver.vaultdrift.nlp.SemanticCache;
import com.dcruver.vaultdrift.reporting.RunReport;
import com.dcruver.vaultdrift.reporting.RunReportFormatter;
import com.dcruver.vaultdrift.session.SessionComputation;
import com.dcruver.vaultdrift.session.SessionComputer;
import com.dcruver.vaultdrift.session.SessionContext;
import com.dcruver.vaultdrift.session.SessionContextFactory;
import com.dcruver.vaultdrift.store.SessionStore;
import com.dcruver.vaultdrift.store.SessionSummary;
import com.dcruver.vaultdrift.store.WriteMode;
import com.dcruver.vaultdrift.trajectory.NoteTrajectory;
import com.dcruver.vaultdrift.trajectory.TrajectoryAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Spring Shell commands for computing and inspecting drift sessions.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class DriftShellCommands {

    private final SessionComputer sessionComputer;
    private final SessionContextFactory contextFactory;
    private final SessionStore sessionStore;
    private final TrajectoryAnalyzer trajectoryAnalyzer;
    private final DetectorExecutor detectorExecutor;
    private final EmbeddingMetricsComputer metricsComputer;
    private final RunReportFormatter reportFormatter;
    private final SemanticCache semanticCache;

    @ShellMethod(key = "compute-session", value = "Embed, cluster and store a session, then run detectors")
    public String computeSession(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Session date (yyyy-MM-dd), today if omitted") String date,
        @ShellOption(defaultValue = "false", help = "Replace an existing session for the date") boolean replace,
        @ShellOption(defaultValue = "0", help = "Give up after this many seconds, 0 for no limit") long timeoutSeconds,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Directory to write the Markdown report to") String reportDir
    ) {
        LocalDate sessionDate = parseDate(date);
        log.info("Computing session {}", sessionDate);

        try {
            Deadline deadline = timeoutSeconds > 0 ? Deadline.after(Duration.ofSeconds(timeoutSeconds)) : Deadline.none();
            SessionComputation computation = sessionComputer.computeSession(
                sessionDate, replace ? WriteMode.REPLACE : WriteMode.REJECT_EXISTING, deadline);

            DetectorRunSummary detectors;
            EmbeddingMetrics metrics;
            try (SessionContext context = contextFactory.open(sessionDate)) {
                detectors = detectorExecutor.runAll(context);
                metrics = metricsComputer.compute(context, true);
            }

            RunReport report = RunReport.builder()
                .computation(computation)
                .detectors(detectors)
                .metrics(metrics)
                .build();

            StringBuilder result = new StringBuilder(reportFormatter.format(report));
            if (reportDir != null) {
                Path written = reportFormatter.writeReport(report, Paths.get(reportDir));
                result.append("\nReport written to ").append(written).append("\n");
            }
            return result.toString();

        } catch (Exception e) {
            log.error("Session computation failed", e);
            return "Session computation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "sessions", value = "List stored sessions")
    public String sessions() {
        List<SessionSummary> summaries = sessionStore.summaries();
        if (summaries.isEmpty()) {
            return "No sessions stored yet. Run 'compute-session' first.";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%d sessions:\n", summaries.size()));
        for (SessionSummary summary : summaries) {
            sb.append(String.format("- %s: %d notes (vault %s)\n",
                summary.getSessionDate(), summary.getNoteCount(), summary.getVaultStateHash().substring(0, 12)));
        }

        SemanticCache.CacheStats stats = semanticCache.getStats();
        sb.append(String.format("\nSemantic cache: %d entries, %d hits, %d misses since startup\n",
            stats.getPersistedEntries(), stats.getHits(), stats.getMisses()));
        return sb.toString();
    }

    @ShellMethod(key = "drift", value = "Show how a note moved across sessions")
    public String drift(
        @ShellOption(help = "Note id") String note,
        @ShellOption(defaultValue = ShellOption.NULL, help = "First session date") String from,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Last session date") String to
    ) {
        try {
            LocalDate start = from == null ? LocalDate.of(1, 1, 1) : LocalDate.parse(from);
            LocalDate end = to == null ? LocalDate.of(9999, 12, 31) : LocalDate.parse(to);
            List<LocalDate> sessions = sessionStore.sessionsBetween(start, end);
            NoteTrajectory trajectory = trajectoryAnalyzer.trajectory(note, sessions);

            if (trajectory.isEmpty()) {
                return String.format("Note %s does not appear in any session.", note);
            }

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Trajectory of %s over %d sessions:\n", note, trajectory.size()));
            OptionalDouble drift = trajectoryAnalyzer.drift(trajectory);
            sb.append(String.format("- Total drift: %.4f\n", drift.orElse(0.0)));
            trajectoryAnalyzer.velocity(trajectory)
                .ifPresent(v -> sb.append(String.format("- Recent velocity: %.4f per session\n", v)));
            trajectoryAnalyzer.acceleration(trajectory)
                .ifPresent(a -> sb.append(String.format("- Acceleration: %+.4f%s\n", a,
                    trajectoryAnalyzer.isAccelerating(trajectory) ? " (accelerating)" : "")));

            List<Double> rates = trajectoryAnalyzer.windowedDriftRates(trajectory,
                Math.min(3, trajectory.size()));
            if (!rates.isEmpty()) {
                sb.append("- Windowed drift rates:");
                rates.forEach(r -> sb.append(String.format(" %.4f", r)));
                sb.append("\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Drift lookup failed", e);
            return "Drift lookup failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "clusters", value = "Show the clusters of a session")
    public String clusters(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Session date, today if omitted") String date
    ) {
        LocalDate sessionDate = parseDate(date);
        try (SessionContext context = contextFactory.open(sessionDate)) {
            ClusterResult result = context.clusters();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Session %s: %d clusters, %d notes as noise\n\n",
                sessionDate, result.clusterCount(), result.noise().size()));

            for (Cluster cluster : result.clusters().values()) {
                sb.append(String.format("%d. %s (%d notes)\n", cluster.getId(), cluster.getLabel(), cluster.size()));
                for (String noteId : context.representatives(cluster.getId(), 3)) {
                    sb.append("   - ").append(context.note(noteId).map(n -> n.getTitle()).orElse(noteId)).append("\n");
                }
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Cluster listing failed", e);
            return "Cluster listing failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats", value = "Embedding space statistics for a session")
    public String stats(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Session date, today if omitted") String date,
        @ShellOption(defaultValue = "false", help = "Recompute instead of using cached values") boolean force
    ) {
        LocalDate sessionDate = parseDate(date);
        try (SessionContext context = contextFactory.open(sessionDate)) {
            EmbeddingMetrics metrics = metricsComputer.compute(context, force);

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Embedding metrics for %s:\n", sessionDate));
            sb.append(String.format("- Notes: %d (%d in pairwise sample)\n", metrics.getNoteCount(), metrics.getSampledNotes()));
            sb.append(String.format("- Dimension: %d (intrinsic %.1f)\n", metrics.getDimension(), metrics.getIntrinsicDimension()));
            sb.append(String.format("- Similarity: mean %.3f, std %.3f\n", metrics.getMeanSimilarity(), metrics.getStdSimilarity()));
            sb.append(String.format("- Clusters: %d, noise %d (%.1f%%)\n",
                metrics.getClusterCount(), metrics.getNoiseCount(), metrics.getNoisePercent()));
            if (metrics.getSilhouette() != null) {
                sb.append(String.format("- Silhouette: %.3f\n", metrics.getSilhouette()));
            }
            if (metrics.getClusterEntropy() != null) {
                sb.append(String.format("- Cluster size entropy: %.2f bits\n", metrics.getClusterEntropy()));
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Stats failed", e);
            return "Stats failed: " + e.getMessage();
        }
    }

    private static LocalDate parseDate(String date) {
        return date == null ? LocalDate.now() : LocalDate.parse(date);
    }
}
