package com.dcruver.vaultdrift.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Point in time by which a caller wants an operation finished.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public boolean isUnbounded() {
        return expiresAt == null;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * Time left, capped at {@code cap}. Unbounded deadlines return the cap.
     */
    public Duration remaining(Duration cap) {
        if (expiresAt == null) {
            return cap;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        if (left.isNegative()) {
            return Duration.ZERO;
        }
        return left.compareTo(cap) < 0 ? left : cap;
    }

    public void check(String phase) {
        if (isExpired()) {
            throw new DeadlineExceededException(phase);
        }
    }
}
