package app.lexis.core.vocab.service;

import app.lexis.core.review.api.ReviewSchedulePort;
import app.lexis.core.review.api.ReviewSchedulePort.ScheduleSummary;
import app.lexis.core.vocab.domain.dto.ClearWordsResponse;
import app.lexis.core.vocab.domain.dto.VocabWordDTO;
import app.lexis.core.vocab.domain.entity.VocabWordEntity;
import app.lexis.core.vocab.domain.request.CreateWordRequest;
import app.lexis.core.vocab.repository.VocabWordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
public class VocabService {

    private static final Logger log = LoggerFactory.getLogger(VocabService.class);

    private final VocabWordRepository wordRepository;
    private final ReviewSchedulePort schedulePort;

    public VocabService(VocabWordRepository wordRepository, ReviewSchedulePort schedulePort) {
        this.wordRepository = wordRepository;
        this.schedulePort = schedulePort;
    }

    @Transactional
    public VocabWordDTO addWord(CreateWordRequest req) {
        if (req == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        String word = trimToEmpty(req.word());
        String meaning = trimToEmpty(req.meaning());
        if (word.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Word cannot be empty.");
        }
        if (meaning.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Definition cannot be empty.");
        }
        if (wordRepository.existsByWordIgnoreCase(word)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Word '" + word + "' already exists.");
        }

        VocabWordEntity entity = new VocabWordEntity();
        entity.setWord(word);
        entity.setPartOfSpeech(trimToEmpty(req.partOfSpeech()));
        entity.setMeaning(meaning);
        entity.setTranslation(trimToEmpty(req.translation()));
        entity.setCreatedAt(Instant.now());

        VocabWordEntity saved;
        try {
            saved = wordRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Word '" + word + "' already exists.", ex);
        }

        ScheduleSummary schedule = schedulePort.enroll(saved.getWordId());
        log.info("Word added wordId={} firstReviewIn={}", saved.getWordId(), schedule.nextReviewIn());
        return toDto(saved, schedule);
    }

    @Transactional(readOnly = true)
    public List<VocabWordDTO> listWords() {
        List<VocabWordEntity> words = wordRepository.findAllByOrderByWordAsc();
        if (words.isEmpty()) {
            return List.of();
        }

        Map<Long, ScheduleSummary> schedules = schedulePort.findSchedules(
                words.stream().map(VocabWordEntity::getWordId).toList()
        );
        return words.stream()
                .map(w -> toDto(w, schedules.get(w.getWordId())))
                .toList();
    }

    @Transactional
    public ClearWordsResponse clearAll() {
        int count = wordRepository.deleteAllWords();
        log.info("All words cleared count={}", count);
        return new ClearWordsResponse(count, "Deleted " + count + " word" + (count != 1 ? "s" : "") + ".");
    }

    private static VocabWordDTO toDto(VocabWordEntity w, ScheduleSummary schedule) {
        return new VocabWordDTO(
                w.getWordId(),
                w.getWord(),
                w.getPartOfSpeech(),
                w.getMeaning(),
                w.getTranslation(),
                w.getCreatedAt(),
                schedule
        );
    }

    private static String trimToEmpty(String v) {
        return v == null ? "" : v.trim();
    }
}
