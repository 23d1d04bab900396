package app.lexis.core.review.algorithm;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Source of "now" for scheduling, with an optional time-acceleration factor.
 *
 * <p>With a factor of 1000 a nominal one-day deadline resolves 86.4 seconds after
 * the reading and a one-minute deadline after 60 milliseconds. The factor is fixed
 * for the lifetime of the instance, so every caller holding the same clock sees the
 * same time scale.</p>
 */
public final class ReviewClock {

    public static final long NORMAL_FACTOR = 1;
    public static final long ACCELERATED_FACTOR = 1000;

    private final Clock clock;
    private final long accelerationFactor;

    public ReviewClock(Clock clock, long accelerationFactor) {
        if (clock == null) {
            throw new IllegalArgumentException("clock is required");
        }
        if (accelerationFactor < 1) {
            throw new IllegalArgumentException("accelerationFactor must be >= 1, got " + accelerationFactor);
        }
        this.clock = clock;
        this.accelerationFactor = accelerationFactor;
    }

    public static ReviewClock system(boolean accelerated) {
        return new ReviewClock(Clock.systemUTC(), accelerated ? ACCELERATED_FACTOR : NORMAL_FACTOR);
    }

    public Instant now() {
        return clock.instant();
    }

    public Duration scale(Duration nominal) {
        return nominal.dividedBy(accelerationFactor);
    }

    public Instant deadline(Duration nominal) {
        return deadline(now(), nominal);
    }

    public Instant deadline(Instant from, Duration nominal) {
        return from.plus(scale(nominal));
    }

    public long accelerationFactor() {
        return accelerationFactor;
    }

    public boolean isAccelerated() {
        return accelerationFactor > NORMAL_FACTOR;
    }
}
