package com.raditha.cppnorm.analyzer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock deadline shared by the alias phases of one file.
 * <p>
 * A deadline created with {@link #pending(Duration, Clock)} does not run until
 * {@link #start()} is called, so that work done before the alias phases does not
 * count against their budget.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Duration budget;
    private final Clock clock;
    private Instant expiry;

    /**
     * @param expiry instant after which the deadline has passed; null for no deadline
     * @param clock  clock used to read the current time
     */
    public Deadline(Instant expiry, Clock clock) {
        this(null, expiry, clock);
    }

    private Deadline(Duration budget, Instant expiry, Clock clock) {
        this.budget = budget;
        this.expiry = expiry;
        this.clock = clock;
    }

    public static Deadline none() {
        return NONE;
    }

    /**
     * Deadline {@code budget} from now. A zero budget means no deadline.
     */
    public static Deadline after(Duration budget, Clock clock) {
        if (budget == null || budget.isZero()) {
            return NONE;
        }
        return new Deadline(clock.instant().plus(budget), clock);
    }

    /**
     * Deadline {@code budget} from the moment {@link #start()} is first called.
     * A zero budget means no deadline.
     */
    public static Deadline pending(Duration budget, Clock clock) {
        if (budget == null || budget.isZero()) {
            return NONE;
        }
        return new Deadline(budget, null, clock);
    }

    /**
     * Start a pending deadline. Has no effect on a deadline that is already running
     * or unlimited.
     *
     * @return this deadline
     */
    public Deadline start() {
        if (expiry == null && budget != null) {
            expiry = clock.instant().plus(budget);
        }
        return this;
    }

    public boolean isStarted() {
        return expiry != null;
    }

    public boolean isExpired() {
        return expiry != null && !clock.instant().isBefore(expiry);
    }
}
