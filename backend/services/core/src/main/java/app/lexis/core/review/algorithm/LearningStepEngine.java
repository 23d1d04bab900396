package app.lexis.core.review.algorithm;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class LearningStepEngine {

    public static final List<Duration> STEP_DURATIONS = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(10),
            Duration.ofDays(1)
    );
    public static final int STEP_COUNT = 3;
    public static final Duration GRADUATING_INTERVAL = Duration.ofDays(1);

    public static Duration stepDuration(int step) {
        return STEP_DURATIONS.get(step - 1);
    }

    public ReviewTransition apply(CardState.Learning card, LearningAction action, Instant now, ReviewClock clock) {
        int step = card.step();
        double ef = card.easinessFactor();

        switch (action) {
            case REGRESS -> {
                return learning(1, ef, now, clock, ReviewEvent.reset());
            }
            case REPEAT -> {
                return learning(step, ef, now, clock, ReviewEvent.repeat(step));
            }
            case ADVANCE -> {
                if (step >= STEP_COUNT) {
                    CardState.Reviewing graduated = new CardState.Reviewing(
                            1,
                            1,
                            ef,
                            clock.deadline(now, GRADUATING_INTERVAL)
                    );
                    return new ReviewTransition(graduated, ReviewEvent.graduated(), now);
                }
                int next = step + 1;
                return learning(next, ef, now, clock, ReviewEvent.advance(next));
            }
            default -> throw new IllegalArgumentException("Unsupported learning action: " + action);
        }
    }

    /**
     * Sends a lapsed card back to step 1, keeping its easiness factor.
     */
    public ReviewTransition restart(double easinessFactor, Instant now, ReviewClock clock, ReviewEvent event) {
        return learning(1, easinessFactor, now, clock, event);
    }

    private static ReviewTransition learning(int step, double ef, Instant now, ReviewClock clock, ReviewEvent event) {
        CardState.Learning next = new CardState.Learning(step, ef, clock.deadline(now, stepDuration(step)));
        return new ReviewTransition(next, event, now);
    }
}
