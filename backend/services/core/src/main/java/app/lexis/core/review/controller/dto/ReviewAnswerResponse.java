package app.lexis.core.review.controller.dto;

import app.lexis.core.review.algorithm.ReviewEvent;
import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.domain.Rating;

import java.time.Instant;

public record ReviewAnswerResponse(
        Long wordId,
        Rating rating,
        ReviewEvent.Type event,
        String feedback,
        boolean graduated,
        Phase phase,
        Integer learningStep,
        int repetitions,
        int intervalDays,
        double easinessFactor,
        Instant nextReviewAt,
        String nextReviewIn
) {
}
