package app.lexis.core.review.service;

import app.lexis.core.review.algorithm.CardState;
import app.lexis.core.review.algorithm.LearningStepEngine;
import app.lexis.core.review.algorithm.ReviewClock;
import app.lexis.core.review.api.ReviewSchedulePort;
import app.lexis.core.review.entity.SrCardStateEntity;
import app.lexis.core.review.repository.SrCardStateRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ScheduleEnrollmentService implements ReviewSchedulePort {

    private final SrCardStateRepository stateRepo;
    private final CardStateMapper mapper;
    private final ReviewClock clock;

    public ScheduleEnrollmentService(SrCardStateRepository stateRepo,
                                     CardStateMapper mapper,
                                     ReviewClock clock) {
        this.stateRepo = stateRepo;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public ScheduleSummary enroll(Long wordId) {
        if (wordId == null) {
            throw new IllegalArgumentException("Word id is required");
        }
        if (stateRepo.existsById(wordId)) {
            throw new IllegalStateException("Word is already scheduled: " + wordId);
        }

        Instant now = clock.now();
        CardState initial = CardState.newCard(clock.deadline(now, LearningStepEngine.stepDuration(1)));

        SrCardStateEntity entity = new SrCardStateEntity();
        entity.setWordId(wordId);
        entity.setReviewCount(0);
        mapper.apply(initial, entity);

        SrCardStateEntity saved = stateRepo.save(entity);
        return mapper.toSummary(saved, now);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, ScheduleSummary> findSchedules(Collection<Long> wordIds) {
        if (wordIds == null || wordIds.isEmpty()) {
            return Map.of();
        }

        Instant now = clock.now();
        Map<Long, ScheduleSummary> out = new HashMap<>();
        for (SrCardStateEntity s : stateRepo.findByWordIdIn(List.copyOf(wordIds))) {
            out.put(s.getWordId(), mapper.toSummary(s, now));
        }
        return out;
    }
}
