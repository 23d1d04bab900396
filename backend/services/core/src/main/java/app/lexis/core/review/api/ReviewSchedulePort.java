package app.lexis.core.review.api;

import app.lexis.core.review.domain.Phase;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

public interface ReviewSchedulePort {

    record ScheduleSummary(
            Phase phase,
            Integer learningStep,
            int repetitions,
            int intervalDays,
            double easinessFactor,
            Instant nextReviewAt,
            String nextReviewIn
    ) {}

    /**
     * Starts the schedule of a freshly stored word at learning step 1.
     */
    ScheduleSummary enroll(Long wordId);

    Map<Long, ScheduleSummary> findSchedules(Collection<Long> wordIds);
}
