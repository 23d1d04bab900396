package app.lexis.core.review.algorithm;

import app.lexis.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Applies one rating to one card. Learning cards go through {@link LearningStepEngine},
 * graduated cards through {@link Sm2IntervalCalculator}. Due-time eligibility is the
 * caller's concern; a card that is not yet due is rescheduled all the same.
 */
@Component
public class SchedulerStateMachine {

    private final RatingMapper ratingMapper;
    private final LearningStepEngine learningSteps;
    private final Sm2IntervalCalculator sm2;

    public SchedulerStateMachine(RatingMapper ratingMapper,
                                 LearningStepEngine learningSteps,
                                 Sm2IntervalCalculator sm2) {
        this.ratingMapper = ratingMapper;
        this.learningSteps = learningSteps;
        this.sm2 = sm2;
    }

    public ReviewTransition review(CardState state, Rating rating, ReviewClock clock) {
        return review(state, rating, clock.now(), clock);
    }

    public ReviewTransition review(CardState state, Rating rating, Instant now, ReviewClock clock) {
        if (state == null) {
            throw new InconsistentStateException("Card state is missing");
        }
        if (rating == null) {
            throw new IllegalArgumentException("Rating is required");
        }

        if (state instanceof CardState.Learning learning) {
            return learningSteps.apply(learning, ratingMapper.toLearningAction(rating), now, clock);
        }
        return reviewGraduated((CardState.Reviewing) state, ratingMapper.toQuality(rating), now, clock);
    }

    public Map<Rating, Instant> preview(CardState state, ReviewClock clock) {
        Instant now = clock.now();
        Map<Rating, Instant> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            out.put(r, review(state, r, now, clock).state().nextDue());
        }
        return out;
    }

    private ReviewTransition reviewGraduated(CardState.Reviewing card, int quality, Instant now, ReviewClock clock) {
        Sm2IntervalCalculator.Sm2Outcome outcome = sm2.calculate(
                card.repetitions(),
                card.intervalDays(),
                card.easinessFactor(),
                quality
        );

        if (outcome instanceof Sm2IntervalCalculator.Sm2Outcome.Next next) {
            CardState.Reviewing reviewed = new CardState.Reviewing(
                    next.repetitions(),
                    next.intervalDays(),
                    next.easinessFactor(),
                    clock.deadline(now, Duration.ofDays(next.intervalDays()))
            );
            return new ReviewTransition(reviewed, ReviewEvent.reviewed(next.intervalDays()), now);
        }

        return learningSteps.restart(card.easinessFactor(), now, clock, ReviewEvent.lapsed());
    }
}
