package app.lexis.core.review.controller.dto;

import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.domain.Rating;

import java.time.Instant;
import java.util.Map;

public record ReviewNextCardResponse(
        Long wordId,
        String word,
        String partOfSpeech,
        String meaning,
        String translation,
        Phase phase,
        String status,
        Map<Rating, IntervalPreview> intervals,
        Instant dueAt,
        QueueSummary queue
) {
    public record IntervalPreview(
            Instant at,
            String display
    ) {
    }

    public record QueueSummary(
            long dueCount,
            long totalCount
    ) {
    }
}
