package app.lexis.core.review.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record AnswerCardRequest(
        @NotBlank String rating
) {}
