package app.lexis.core.vocab.domain.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateWordRequest(
        @NotBlank @Size(max = 200) String word,
        @Size(max = 100) String partOfSpeech,
        @NotBlank @Size(max = 2000) String meaning,
        @Size(max = 2000) String translation
) {
}
