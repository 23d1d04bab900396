package app.lexis.core.review.algorithm;

import app.lexis.core.review.domain.Phase;

import java.time.Instant;

/**
 * Schedule state of one card: either still walking the learning steps or graduated
 * into SM-2 review. Step-only and SM-2-only fields live on their own variant.
 */
public sealed interface CardState permits CardState.Learning, CardState.Reviewing {

    double INITIAL_EASINESS_FACTOR = 2.5;
    double MINIMUM_EASINESS_FACTOR = 1.3;

    Phase phase();

    double easinessFactor();

    Instant nextDue();

    static Learning newCard(Instant nextDue) {
        return new Learning(1, INITIAL_EASINESS_FACTOR, nextDue);
    }

    record Learning(int step, double easinessFactor, Instant nextDue) implements CardState {
        public Learning {
            if (step < 1 || step > LearningStepEngine.STEP_COUNT) {
                throw new InconsistentStateException("Learning step out of range: " + step);
            }
            requireEasiness(easinessFactor);
            requireDue(nextDue);
        }

        @Override
        public Phase phase() {
            return Phase.LEARNING;
        }
    }

    record Reviewing(int repetitions, int intervalDays, double easinessFactor, Instant nextDue) implements CardState {
        public Reviewing {
            if (repetitions < 0) {
                throw new InconsistentStateException("Repetitions must be >= 0, got " + repetitions);
            }
            if (intervalDays < 1) {
                throw new InconsistentStateException("Review interval must be >= 1 day, got " + intervalDays);
            }
            requireEasiness(easinessFactor);
            requireDue(nextDue);
        }

        @Override
        public Phase phase() {
            return Phase.REVIEWING;
        }
    }

    private static void requireEasiness(double ef) {
        if (Double.isNaN(ef) || ef < MINIMUM_EASINESS_FACTOR) {
            throw new InconsistentStateException("Easiness factor below " + MINIMUM_EASINESS_FACTOR + ": " + ef);
        }
    }

    private static void requireDue(Instant nextDue) {
        if (nextDue == null) {
            throw new InconsistentStateException("Next due instant is missing");
        }
    }
}
