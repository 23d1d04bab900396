package app.lexis.core.vocab.domain.dto;

import app.lexis.core.review.api.ReviewSchedulePort.ScheduleSummary;

import java.time.Instant;

public record VocabWordDTO(
        Long wordId,
        String word,
        String partOfSpeech,
        String meaning,
        String translation,
        Instant createdAt,
        ScheduleSummary schedule
) {
}
