package app.lexis.core.review.service;

import app.lexis.core.review.algorithm.CardState;
import app.lexis.core.review.algorithm.InconsistentStateException;
import app.lexis.core.review.api.ReviewSchedulePort.ScheduleSummary;
import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.entity.SrCardStateEntity;
import app.lexis.core.review.util.TimeUntilFormatter;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class CardStateMapper {

    private final TimeUntilFormatter timeUntil;

    public CardStateMapper(TimeUntilFormatter timeUntil) {
        this.timeUntil = timeUntil;
    }

    /**
     * Reads a persisted row into the typed state. A row that breaks the card-state
     * invariants is reported, never patched.
     */
    public CardState toState(SrCardStateEntity entity) {
        try {
            if (entity.getPhase() == null) {
                throw new InconsistentStateException("Phase is missing");
            }
            if (entity.getPhase() == Phase.LEARNING) {
                if (entity.getLearningStep() == null) {
                    throw new InconsistentStateException("Learning step is missing");
                }
                return new CardState.Learning(
                        entity.getLearningStep(),
                        entity.getEasinessFactor(),
                        entity.getNextReviewAt()
                );
            }
            return new CardState.Reviewing(
                    entity.getRepetitions(),
                    entity.getIntervalDays(),
                    entity.getEasinessFactor(),
                    entity.getNextReviewAt()
            );
        } catch (InconsistentStateException ex) {
            throw new InconsistentStateException("Schedule of word " + entity.getWordId() + " is inconsistent: " + ex.getMessage(), ex);
        }
    }

    public void apply(CardState state, SrCardStateEntity target) {
        target.setPhase(state.phase());
        target.setEasinessFactor(state.easinessFactor());
        target.setNextReviewAt(state.nextDue());

        if (state instanceof CardState.Learning learning) {
            target.setLearningStep(learning.step());
            target.setRepetitions(0);
            target.setIntervalDays(1);
        } else if (state instanceof CardState.Reviewing reviewing) {
            target.setLearningStep(null);
            target.setRepetitions(reviewing.repetitions());
            target.setIntervalDays(reviewing.intervalDays());
        }
    }

    public ScheduleSummary toSummary(SrCardStateEntity entity, Instant now) {
        return new ScheduleSummary(
                entity.getPhase(),
                entity.getLearningStep(),
                entity.getRepetitions(),
                entity.getIntervalDays(),
                entity.getEasinessFactor(),
                entity.getNextReviewAt(),
                timeUntil.format(entity.getNextReviewAt(), now)
        );
    }
}
