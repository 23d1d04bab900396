package app.lexis.core.review.algorithm;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * SM-2 recurrence for graduated cards.
 *
 * <p>Interval anchors are 1 and 6 days for the first two successful reviews; from the
 * third on the previous interval is multiplied by the easiness factor the card had
 * <em>before</em> this review. The easiness factor update runs in decimal arithmetic so
 * that repeated updates stay on the exact two-decimal grid (2.5, 2.36, 2.6, ...).
 * Intervals never exceed {@link #MAXIMUM_INTERVAL_DAYS}.</p>
 */
@Component
public class Sm2IntervalCalculator {

    public static final int MAXIMUM_INTERVAL_DAYS = 36500;

    private static final BigDecimal MIN_EF = BigDecimal.valueOf(CardState.MINIMUM_EASINESS_FACTOR);
    private static final BigDecimal BASE_BONUS = new BigDecimal("0.1");
    private static final BigDecimal LINEAR_PENALTY = new BigDecimal("0.08");
    private static final BigDecimal QUADRATIC_PENALTY = new BigDecimal("0.02");
    private static final BigDecimal MAX_INTERVAL = BigDecimal.valueOf(MAXIMUM_INTERVAL_DAYS);

    public Sm2Outcome calculate(int repetitions, int intervalDays, double easinessFactor, int quality) {
        if (quality == RatingMapper.QUALITY_FORGOT) {
            return new Sm2Outcome.Lapse();
        }
        if (quality != RatingMapper.QUALITY_HARD && quality != RatingMapper.QUALITY_EASY) {
            throw new IllegalArgumentException("Unsupported SM-2 quality: " + quality);
        }

        int nextRepetitions = repetitions + 1;
        int nextInterval;
        if (nextRepetitions == 1) {
            nextInterval = 1;
        } else if (nextRepetitions == 2) {
            nextInterval = 6;
        } else {
            nextInterval = BigDecimal.valueOf(intervalDays)
                    .multiply(BigDecimal.valueOf(easinessFactor))
                    .setScale(0, RoundingMode.CEILING)
                    .min(MAX_INTERVAL)
                    .intValueExact();
        }

        return new Sm2Outcome.Next(nextRepetitions, Math.max(1, nextInterval), nextEasiness(easinessFactor, quality));
    }

    static double nextEasiness(double easinessFactor, int quality) {
        BigDecimal miss = BigDecimal.valueOf(5L - quality);
        BigDecimal delta = BASE_BONUS.subtract(miss.multiply(LINEAR_PENALTY.add(miss.multiply(QUADRATIC_PENALTY))));
        BigDecimal ef = BigDecimal.valueOf(easinessFactor).add(delta);
        return ef.max(MIN_EF).doubleValue();
    }

    public sealed interface Sm2Outcome permits Sm2Outcome.Lapse, Sm2Outcome.Next {

        record Lapse() implements Sm2Outcome {
        }

        record Next(int repetitions, int intervalDays, double easinessFactor) implements Sm2Outcome {
        }
    }
}
