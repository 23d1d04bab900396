package app.lexis.core.review.util;

import app.lexis.core.review.algorithm.ReviewClock;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Renders the wait until a due instant. Accelerated runs show real seconds, since a
 * compressed day is only a minute and a half long.
 */
@Component
public class TimeUntilFormatter {

    private final ReviewClock clock;

    public TimeUntilFormatter(ReviewClock clock) {
        this.clock = clock;
    }

    public String format(Instant target) {
        return format(target, clock.now());
    }

    public String format(Instant target, Instant now) {
        if (target == null) return null;

        Duration d = Duration.between(now, target);
        if (d.isNegative()) return "now";

        if (clock.isAccelerated()) {
            double seconds = d.toMillis() / 1000.0;
            if (seconds < 60) return String.format(Locale.ROOT, "%.1fs", seconds);
            return String.format(Locale.ROOT, "%.1fmin", seconds / 60);
        }

        long minutes = d.toMinutes();
        if (minutes < 60) return minutes + "min";
        if (minutes < 1440) return (minutes / 60) + "h";
        return (minutes / 1440) + "d";
    }
}
