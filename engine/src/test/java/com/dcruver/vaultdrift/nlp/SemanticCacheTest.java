package com.dcruver.vaultdrift.nlp;

import com.dcruver.vaultdrift.VaultFixtures;
import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.config.ResilienceConfiguration;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException.Reason;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.store.SchemaManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SemanticCacheTest {

    private static final String TEXT = "Spaced repetition keeps notes alive";

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private EngineProperties properties;
    private CountingProvider provider;
    private final List<SemanticCache> caches = new ArrayList<>();

    @BeforeEach
    void setUp() {
        dataSource = VaultFixtures.dataSource(tempDir);
        properties = VaultFixtures.properties();
        provider = new CountingProvider();
    }

    @AfterEach
    void tearDown() {
        caches.forEach(SemanticCache::shutdown);
    }

    private SemanticCache newCache(EmbeddingProvider embeddingProvider) {
        SemanticCache cache = new SemanticCache(dataSource, new SchemaManager(dataSource), embeddingProvider,
            ResilienceConfiguration.embeddingRetry(properties.getEmbedding()), properties);
        caches.add(cache);
        return cache;
    }

    @Test
    void testSameContentReturnsSameVector() {
        SemanticCache cache = newCache(provider);

        double[] first = cache.getOrCompute(Note.hash(TEXT), TEXT);
        double[] second = cache.getOrCompute(Note.hash(TEXT), TEXT);

        assertArrayEquals(first, second);
        assertEquals(1.0, VectorMath.norm(first), 1e-9);
        assertEquals(1, provider.calls.get());
        assertEquals(1, cache.getStats().getHits());
        assertEquals(1, cache.getStats().getMisses());
        assertEquals(1, cache.getStats().getPersistedEntries());
    }

    @Test
    void testCompletedLookupsAreNotKeptInMemory() {
        SemanticCache cache = newCache(provider);
        for (int i = 0; i < 50; i++) {
            String text = TEXT + " " + i;
            cache.getOrCompute(Note.hash(text), text);
        }

        assertEquals(0, cache.inFlight());
        assertEquals(50, cache.getStats().getPersistedEntries());

        // Served from the database, not the provider
        double[] again = cache.getOrCompute(Note.hash(TEXT + " 7"), TEXT + " 7");
        assertEquals(1.0, VectorMath.norm(again), 1e-9);
        assertEquals(50, provider.calls.get());
        assertEquals(1, cache.getStats().getHits());
        assertTrue(cache.peek(Note.hash(TEXT + " 7")).isPresent());
        assertEquals(0, cache.inFlight());
    }

    @Test
    void testWarmCacheSurvivesRestart() {
        double[] original = newCache(provider).getOrCompute(Note.hash(TEXT), TEXT);

        // Fresh instance over the same database, as after a restart
        CountingProvider restarted = new CountingProvider();
        SemanticCache cache = newCache(restarted);
        double[] replayed = cache.getOrCompute(Note.hash(TEXT), TEXT);

        assertArrayEquals(original, replayed);
        assertEquals(0, restarted.calls.get());
        assertEquals(0, cache.getStats().getProviderCalls());
    }

    @Test
    void testConcurrentMissesShareOneProviderCall() throws Exception {
        provider.delayMillis = 200;
        SemanticCache cache = newCache(provider);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<double[]>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCompute(Note.hash(TEXT), TEXT);
                }));
            }
            start.countDown();

            double[] expected = results.get(0).get();
            for (Future<double[]> result : results) {
                assertArrayEquals(expected, result.get());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, provider.calls.get());
        assertEquals(1, cache.getStats().getPersistedEntries());
        assertEquals(0, cache.inFlight());
    }

    @Test
    void testFailedComputationLeavesNoEntry() {
        provider.failures = 1;
        provider.failure = Reason.MALFORMED_INPUT;
        SemanticCache cache = newCache(provider);

        EmbeddingUnavailableException error = assertThrows(EmbeddingUnavailableException.class,
            () -> cache.getOrCompute(Note.hash(TEXT), TEXT));
        assertEquals(Reason.MALFORMED_INPUT, error.getReason());
        assertTrue(cache.peek(Note.hash(TEXT)).isEmpty());
        assertEquals(0, cache.getStats().getPersistedEntries());

        // A later call tries again and succeeds
        assertNotNull(cache.getOrCompute(Note.hash(TEXT), TEXT));
        assertEquals(2, provider.calls.get());
        assertTrue(cache.peek(Note.hash(TEXT)).isPresent());
    }

    @Test
    void testProviderFailureIsRetried() {
        provider.failures = 2;
        provider.failure = Reason.PROVIDER_FAILURE;
        SemanticCache cache = newCache(provider);

        double[] vector = cache.getOrCompute(Note.hash(TEXT), TEXT);

        assertNotNull(vector);
        assertEquals(3, provider.calls.get());
    }

    @Test
    void testTimeoutIsNotRetried() {
        properties.getEmbedding().setTimeout(Duration.ofMillis(100));
        provider.delayMillis = 2_000;
        SemanticCache cache = newCache(provider);

        EmbeddingUnavailableException error = assertThrows(EmbeddingUnavailableException.class,
            () -> cache.getOrCompute(Note.hash(TEXT), TEXT));

        assertEquals(Reason.TIMEOUT, error.getReason());
        assertEquals(1, cache.getStats().getProviderCalls());
    }

    @Test
    void testZeroVectorIsMalformedInput() {
        EmbeddingProvider zeros = mock(EmbeddingProvider.class);
        when(zeros.modelName()).thenReturn("zeros");
        when(zeros.embed(anyString())).thenReturn(new float[4]);
        SemanticCache cache = newCache(zeros);

        EmbeddingUnavailableException error = assertThrows(EmbeddingUnavailableException.class,
            () -> cache.getOrCompute(Note.hash(TEXT), TEXT));

        assertEquals(Reason.MALFORMED_INPUT, error.getReason());
        assertEquals(0, cache.getStats().getPersistedEntries());
    }

    @Test
    void testModelsDoNotShareEntries() {
        newCache(provider).getOrCompute(Note.hash(TEXT), TEXT);

        EmbeddingProvider other = mock(EmbeddingProvider.class);
        when(other.modelName()).thenReturn("other-model");
        when(other.embed(anyString())).thenReturn(new float[] {1.0f, 0.0f});
        SemanticCache cache = newCache(other);

        assertArrayEquals(new double[] {1.0, 0.0}, cache.getOrCompute(Note.hash(TEXT), TEXT));
        assertEquals(1, cache.getStats().getProviderCalls());
    }

    /**
     * Hashing provider that counts calls and can be told to fail or stall.
     */
    private static class CountingProvider implements EmbeddingProvider {
        private final HashingEmbeddingProvider delegate = new HashingEmbeddingProvider(16);
        private final AtomicInteger calls = new AtomicInteger();
        private volatile int failures;
        private volatile Reason failure = Reason.PROVIDER_FAILURE;
        private volatile long delayMillis;

        @Override
        public float[] embed(String text) {
            calls.incrementAndGet();
            if (failures > 0) {
                failures--;
                throw new EmbeddingUnavailableException(failure, "simulated " + failure);
            }
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE, "interrupted", e);
                }
            }
            return delegate.embed(text);
        }

        @Override
        public String modelName() {
            return "counting-16";
        }
    }
}
