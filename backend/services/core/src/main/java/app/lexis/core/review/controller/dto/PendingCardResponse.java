package app.lexis.core.review.controller.dto;

import app.lexis.core.review.domain.Phase;

import java.time.Instant;

public record PendingCardResponse(
        Long wordId,
        String word,
        Phase phase,
        Integer learningStep,
        int repetitions,
        Instant nextReviewAt,
        String status
) {
}
