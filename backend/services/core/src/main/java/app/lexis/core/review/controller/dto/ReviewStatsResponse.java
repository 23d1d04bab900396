package app.lexis.core.review.controller.dto;

public record ReviewStatsResponse(
        long total,
        long pending,
        long learning,
        long graduated,
        double averageEasinessFactor
) {
}
