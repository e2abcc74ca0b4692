package com.dcruver.vaultdrift.session;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Random sampling that repeats exactly for a session date.
 */
public final class DeterministicSampler {

    private final long seed;

    public DeterministicSampler(LocalDate sessionDate) {
        this.seed = seedFor(sessionDate);
    }

    /**
     * yyyyMMdd as a number, e.g. 20250114.
     */
    public static long seedFor(LocalDate date) {
        return date.getYear() * 10000L + date.getMonthValue() * 100L + date.getDayOfMonth();
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Up to k items, in sampled order. The same input and salt give the same sample.
     */
    public <T> List<T> sample(List<T> items, int k, String salt) {
        if (k <= 0 || items.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(items);
        Collections.shuffle(copy, new Random(seed * 31 + salt.hashCode()));
        return copy.size() > k ? new ArrayList<>(copy.subList(0, k)) : copy;
    }
}
