package app.lexis.core.vocab.domain.dto;

public record ClearWordsResponse(
        int deleted,
        String message
) {
}
