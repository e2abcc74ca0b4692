package com.dcruver.vaultdrift.detector;

import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.session.SessionHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs registered detectors against a session, each under its own timeout.
 *
 * A detector that fails or times out too many times in a row is disabled for the life of the executor;
 * a success resets its count.
 */
@Component
@Slf4j
public class DetectorExecutor {

    private final DetectorRegistry registry;
    private final Duration timeout;
    private final int maxConsecutiveFailures;
    private final ExecutorService executor;

    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();
    private final Set<String> disabled = ConcurrentHashMap.newKeySet();

    @Autowired
    public DetectorExecutor(DetectorRegistry registry, EngineProperties properties) {
        this(registry, properties.getDetectors().getTimeout(), properties.getDetectors().getMaxConsecutiveFailures());
    }

    public DetectorExecutor(DetectorRegistry registry, Duration timeout, int maxConsecutiveFailures) {
        this.registry = registry;
        this.timeout = timeout;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        CustomizableThreadFactory threads = new CustomizableThreadFactory("detector-");
        threads.setDaemon(true);
        this.executor = Executors.newCachedThreadPool(threads);
    }

    public DetectorRunSummary runAll(SessionHandle session) {
        Map<String, List<Suggestion>> suggestions = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<String, Detector> entry : registry.all().entrySet()) {
            String id = entry.getKey();
            if (disabled.contains(id)) {
                log.debug("Skipping disabled detector {}", id);
                continue;
            }
            try {
                suggestions.put(id, run(id, entry.getValue(), session));
                consecutiveFailures.remove(id);
            } catch (DetectorFailure e) {
                failures.put(id, e.getMessage());
                recordFailure(id, e);
            }
        }
        return DetectorRunSummary.builder()
            .suggestions(suggestions)
            .failures(failures)
            .disabled(disabled.stream().sorted().collect(Collectors.toList()))
            .build();
    }

    public boolean isDisabled(String detectorId) {
        return disabled.contains(detectorId);
    }

    public int failureCount(String detectorId) {
        return consecutiveFailures.getOrDefault(detectorId, 0);
    }

    /**
     * Re-enable a detector and clear its failure count.
     */
    public void reset(String detectorId) {
        disabled.remove(detectorId);
        consecutiveFailures.remove(detectorId);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private List<Suggestion> run(String id, Detector detector, SessionHandle session) {
        Future<List<Suggestion>> future = executor.submit(() -> detector.suggest(session));
        try {
            List<Suggestion> produced = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            List<Suggestion> tagged = new ArrayList<>();
            if (produced != null) {
                for (Suggestion suggestion : produced) {
                    tagged.add(suggestion.toBuilder().detectorId(id).build());
                }
            }
            log.debug("Detector {} produced {} suggestions", id, tagged.size());
            return tagged;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DetectorFailure("timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw new DetectorFailure(String.valueOf(e.getCause().getMessage()), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DetectorFailure("interrupted", e);
        }
    }

    private void recordFailure(String id, DetectorFailure failure) {
        int count = consecutiveFailures.merge(id, 1, Integer::sum);
        log.warn("Detector {} failed ({} in a row): {}", id, count, failure.getMessage());
        if (count >= maxConsecutiveFailures) {
            disabled.add(id);
            log.warn("Disabled detector {} after {} consecutive failures", id, count);
        }
    }

    private static class DetectorFailure extends RuntimeException {
        DetectorFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
