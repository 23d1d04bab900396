package app.lexis.core.review.api;

import java.util.List;

public interface WordViewPort {

    record WordView(
            Long wordId,
            String word,
            String partOfSpeech,
            String meaning,
            String translation
    ) {}

    /**
     * Views in the order of {@code wordIds}; ids without a stored word are skipped.
     */
    List<WordView> getWordViews(List<Long> wordIds);
}
