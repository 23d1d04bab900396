package app.lexis.core.vocab.adapter;

import app.lexis.core.review.api.WordViewPort;
import app.lexis.core.vocab.domain.entity.VocabWordEntity;
import app.lexis.core.vocab.repository.VocabWordRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class VocabWordViewAdapter implements WordViewPort {

    private final VocabWordRepository wordRepository;

    public VocabWordViewAdapter(VocabWordRepository wordRepository) {
        this.wordRepository = wordRepository;
    }

    @Override
    public List<WordView> getWordViews(List<Long> wordIds) {
        if (wordIds == null || wordIds.isEmpty()) {
            return List.of();
        }

        Map<Long, VocabWordEntity> byId = wordRepository.findByWordIdIn(wordIds).stream()
                .collect(Collectors.toMap(VocabWordEntity::getWordId, Function.identity()));

        List<WordView> result = new ArrayList<>(wordIds.size());
        for (Long wordId : wordIds) {
            VocabWordEntity w = byId.get(wordId);
            if (w == null) {
                continue;
            }
            result.add(new WordView(
                    w.getWordId(),
                    w.getWord(),
                    w.getPartOfSpeech(),
                    w.getMeaning(),
                    w.getTranslation()
            ));
        }
        return result;
    }
}
