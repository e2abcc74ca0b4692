package com.dcruver.vaultdrift.session;

import lombok.Value;

import java.time.LocalDate;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.DoubleSupplier;

/**
 * Pairwise similarity memo for one run. Keys are unordered note pairs scoped to the session date, so
 * (a, b) and (b, a) share an entry and two dates never do.
 */
public class SimilarityCache {

    private final ConcurrentHashMap<PairKey, Double> values = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    /**
     * Cached value, or compute and remember it. Two threads may compute the same pair; both get the same value.
     */
    public double get(LocalDate session, String a, String b, DoubleSupplier compute) {
        PairKey key = PairKey.of(session, a, b);
        Double cached = values.get(key);
        if (cached != null) {
            hits.increment();
            return cached;
        }
        misses.increment();
        double value = compute.getAsDouble();
        Double previous = values.putIfAbsent(key, value);
        return previous != null ? previous : value;
    }

    public OptionalDouble peek(LocalDate session, String a, String b) {
        Double cached = values.get(PairKey.of(session, a, b));
        return cached == null ? OptionalDouble.empty() : OptionalDouble.of(cached);
    }

    public int size() {
        return values.size();
    }

    public long hits() {
        return hits.sum();
    }

    public long misses() {
        return misses.sum();
    }

    public void clear() {
        values.clear();
    }

    @Value
    static class PairKey {
        LocalDate session;
        String first;
        String second;

        static PairKey of(LocalDate session, String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(session, a, b) : new PairKey(session, b, a);
        }
    }
}
