package com.dcruver.vaultdrift.nlp;

import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.CacheCorruptionException;
import com.dcruver.vaultdrift.domain.Deadline;
import com.dcruver.vaultdrift.domain.DeadlineExceededException;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException.Reason;
import com.dcruver.vaultdrift.store.SchemaManager;
import com.dcruver.vaultdrift.store.VectorCodec;
import io.github.resilience4j.retry.Retry;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Content-addressed cache of semantic vectors, persisted in SQLite.
 *
 * Entries are keyed by content hash and model only, so they never expire: the same text yields the
 * same vector in every session. Concurrent misses for one hash share a single provider call, and a
 * failed call leaves no entry behind. Vectors live in the database; memory only holds lookups still
 * in flight.
 */
@Component
@Slf4j
public class SemanticCache {

    private final JdbcTemplate jdbcTemplate;
    private final EmbeddingProvider provider;
    private final Retry retry;
    private final Duration callTimeout;
    private final ExecutorService executor;

    private final ConcurrentHashMap<String, CompletableFuture<double[]>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong providerCalls = new AtomicLong();

    public SemanticCache(
        DataSource dataSource,
        SchemaManager schemaManager,
        EmbeddingProvider provider,
        Retry embeddingRetry,
        EngineProperties properties
    ) {
        schemaManager.init();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.provider = provider;
        this.retry = embeddingRetry;
        this.callTimeout = properties.getEmbedding().getTimeout();
        this.executor = Executors.newCachedThreadPool(daemonThreads());
    }

    public String modelName() {
        return provider.modelName();
    }

    public double[] getOrCompute(String contentHash, String text) {
        return getOrCompute(contentHash, text, Deadline.none());
    }

    /**
     * Return the unit-length semantic vector for the content, calling the provider only on a miss.
     *
     * @throws EmbeddingUnavailableException if the provider cannot produce a vector
     * @throws DeadlineExceededException if the deadline passes while waiting
     */
    public double[] getOrCompute(String contentHash, String text, Deadline deadline) {
        CompletableFuture<double[]> mine = new CompletableFuture<>();
        CompletableFuture<double[]> existing = entries.putIfAbsent(contentHash, mine);
        if (existing != null) {
            if (existing.isDone() && !existing.isCompletedExceptionally()) {
                hits.incrementAndGet();
            }
            return await(existing, deadline).clone();
        }

        try {
            Optional<double[]> persisted = loadPersisted(contentHash);
            double[] vector;
            if (persisted.isPresent()) {
                hits.incrementAndGet();
                vector = persisted.get();
            } else {
                misses.incrementAndGet();
                vector = computeAndPersist(contentHash, text, deadline);
            }
            mine.complete(vector);
            entries.remove(contentHash, mine);
            return vector.clone();
        } catch (RuntimeException e) {
            // leave no entry behind; a later call may try again
            entries.remove(contentHash, mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Cached vector without calling the provider.
     */
    public Optional<double[]> peek(String contentHash) {
        CompletableFuture<double[]> future = entries.get(contentHash);
        if (future != null && future.isDone() && !future.isCompletedExceptionally()) {
            return Optional.of(future.join().clone());
        }
        return loadPersisted(contentHash);
    }

    /**
     * Lookups currently being computed or loaded.
     */
    public int inFlight() {
        return entries.size();
    }

    public CacheStats getStats() {
        CacheStats stats = new CacheStats();
        stats.setHits(hits.get());
        stats.setMisses(misses.get());
        stats.setProviderCalls(providerCalls.get());
        Integer persisted = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM semantic_cache WHERE model = ?", Integer.class, provider.modelName());
        stats.setPersistedEntries(persisted == null ? 0 : persisted);
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private double[] computeAndPersist(String contentHash, String text, Deadline deadline) {
        double[] raw = Retry.decorateSupplier(retry, () -> callProvider(text, deadline)).get();
        double[] unit = VectorMath.normalize(raw);
        if (unit == null) {
            throw new EmbeddingUnavailableException(Reason.MALFORMED_INPUT,
                "Provider returned a zero vector for content " + contentHash);
        }

        jdbcTemplate.update(
            "INSERT OR IGNORE INTO semantic_cache (content_hash, model, dimension, vector, created_at) " +
            "VALUES (?, ?, ?, ?, ?)",
            contentHash, provider.modelName(), unit.length, VectorCodec.encode(unit), Instant.now().getEpochSecond()
        );
        log.debug("Cached semantic vector for content {}", contentHash);
        return unit;
    }

    private double[] callProvider(String text, Deadline deadline) {
        deadline.check("embedding");
        providerCalls.incrementAndGet();
        Duration budget = deadline.remaining(callTimeout);
        Future<float[]> call = executor.submit(() -> provider.embed(text));
        try {
            float[] output = call.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null || output.length == 0) {
                throw new EmbeddingUnavailableException(Reason.MALFORMED_INPUT, "Provider returned an empty vector");
            }
            double[] vector = VectorMath.toDoubles(output);
            for (double v : vector) {
                if (!Double.isFinite(v)) {
                    throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE, "Provider returned a non-finite vector");
                }
            }
            return vector;
        } catch (TimeoutException e) {
            call.cancel(true);
            if (deadline.isExpired()) {
                throw new DeadlineExceededException("embedding");
            }
            throw new EmbeddingUnavailableException(Reason.TIMEOUT,
                "Provider did not answer within " + budget.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmbeddingUnavailableException) {
                throw (EmbeddingUnavailableException) cause;
            }
            throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE,
                "Provider call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE, "Interrupted while embedding", e);
        }
    }

    private Optional<double[]> loadPersisted(String contentHash) {
        List<double[]> rows = jdbcTemplate.query(
            "SELECT dimension, vector FROM semantic_cache WHERE content_hash = ? AND model = ?",
            (rs, rowNum) -> VectorCodec.decode(rs.getBytes("vector"), rs.getInt("dimension"),
                "content " + contentHash),
            contentHash, provider.modelName()
        );
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        double[] vector = rows.get(0);
        if (VectorMath.normalize(vector) == null) {
            throw new CacheCorruptionException("Cached vector for content " + contentHash + " has zero length");
        }
        return Optional.of(vector);
    }

    private static double[] await(CompletableFuture<double[]> future, Deadline deadline) {
        try {
            if (deadline.isUnbounded()) {
                return future.get();
            }
            Duration left = deadline.remaining(Duration.ofDays(1));
            return future.get(left.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new DeadlineExceededException("embedding");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE, cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE, "Interrupted while waiting for embedding", e);
        }
    }

    private static CustomizableThreadFactory daemonThreads() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("embedding-");
        factory.setDaemon(true);
        return factory;
    }

    /**
     * Counters since startup
     */
    @Data
    public static class CacheStats {
        private long hits;
        private long misses;
        private long providerCalls;
        private int persistedEntries;
    }
}
