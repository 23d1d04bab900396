package app.lexis.core.review.service;

import app.lexis.core.review.algorithm.CardState;
import app.lexis.core.review.algorithm.LearningStepEngine;
import app.lexis.core.review.algorithm.ReviewClock;
import app.lexis.core.review.algorithm.ReviewTransition;
import app.lexis.core.review.algorithm.SchedulerStateMachine;
import app.lexis.core.review.api.WordViewPort;
import app.lexis.core.review.controller.dto.PendingCardResponse;
import app.lexis.core.review.controller.dto.ReviewAnswerResponse;
import app.lexis.core.review.controller.dto.ReviewNextCardResponse;
import app.lexis.core.review.controller.dto.ReviewStatsResponse;
import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.entity.SrCardStateEntity;
import app.lexis.core.review.repository.SrCardStateRepository;
import app.lexis.core.review.util.TimeUntilFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final SrCardStateRepository stateRepo;
    private final SchedulerStateMachine scheduler;
    private final CardStateMapper mapper;
    private final WordViewPort wordViewPort;
    private final TimeUntilFormatter timeUntil;
    private final ReviewClock clock;

    public ReviewService(SrCardStateRepository stateRepo,
                         SchedulerStateMachine scheduler,
                         CardStateMapper mapper,
                         WordViewPort wordViewPort,
                         TimeUntilFormatter timeUntil,
                         ReviewClock clock) {
        this.stateRepo = stateRepo;
        this.scheduler = scheduler;
        this.mapper = mapper;
        this.wordViewPort = wordViewPort;
        this.timeUntil = timeUntil;
        this.clock = clock;
    }

    @Transactional
    public ReviewAnswerResponse answer(Long wordId, Rating rating) {
        SrCardStateEntity entity = stateRepo.findByIdForUpdate(wordId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Word not found: " + wordId));

        CardState current = mapper.toState(entity);
        ReviewTransition transition = scheduler.review(current, rating, clock);

        mapper.apply(transition.state(), entity);
        entity.setLastReviewAt(transition.reviewedAt());
        entity.setReviewCount(entity.getReviewCount() + 1);
        stateRepo.save(entity);

        log.debug("Review applied wordId={} rating={} from={} event={} nextReviewAt={}",
                wordId, rating, current.phase(), transition.event().type(), entity.getNextReviewAt());
        if (transition.graduated()) {
            log.info("Word graduated wordId={} easinessFactor={}", wordId, entity.getEasinessFactor());
        }

        return new ReviewAnswerResponse(
                wordId,
                rating,
                transition.event().type(),
                transition.event().description(),
                transition.graduated(),
                entity.getPhase(),
                entity.getLearningStep(),
                entity.getRepetitions(),
                entity.getIntervalDays(),
                entity.getEasinessFactor(),
                entity.getNextReviewAt(),
                timeUntil.format(entity.getNextReviewAt(), transition.reviewedAt())
        );
    }

    @Transactional(readOnly = true)
    public List<PendingCardResponse> pending() {
        Instant now = clock.now();
        List<SrCardStateEntity> due = stateRepo.findDue(now);
        if (due.isEmpty()) {
            return List.of();
        }

        List<Long> ids = due.stream().map(SrCardStateEntity::getWordId).toList();
        Map<Long, WordViewPort.WordView> views = wordViewPort.getWordViews(ids).stream()
                .collect(Collectors.toMap(WordViewPort.WordView::wordId, Function.identity()));

        List<PendingCardResponse> out = new ArrayList<>(due.size());
        for (SrCardStateEntity s : due) {
            WordViewPort.WordView view = views.get(s.getWordId());
            if (view == null) {
                continue;
            }
            out.add(new PendingCardResponse(
                    s.getWordId(),
                    view.word(),
                    s.getPhase(),
                    s.getLearningStep(),
                    s.getRepetitions(),
                    s.getNextReviewAt(),
                    status(s)
            ));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public ReviewNextCardResponse nextCard() {
        Instant now = clock.now();
        var queue = new ReviewNextCardResponse.QueueSummary(stateRepo.countDue(now), stateRepo.count());

        List<Long> dueIds = stateRepo.findDueWordIds(now, PageRequest.of(0, 1));
        if (dueIds.isEmpty()) {
            return new ReviewNextCardResponse(null, null, null, null, null, null, null, Map.of(), null, queue);
        }

        Long wordId = dueIds.get(0);
        var views = wordViewPort.getWordViews(List.of(wordId));
        if (views.isEmpty()) {
            throw new IllegalStateException("WordViewPort returned empty for wordId=" + wordId);
        }
        var view = views.get(0);

        SrCardStateEntity entity = stateRepo.findById(wordId)
                .orElseThrow(() -> new IllegalStateException("Schedule vanished for wordId=" + wordId));
        CardState state = mapper.toState(entity);

        Map<Rating, Instant> nextAt = scheduler.preview(state, clock);
        var intervals = new EnumMap<Rating, ReviewNextCardResponse.IntervalPreview>(Rating.class);
        for (var e : nextAt.entrySet()) {
            intervals.put(e.getKey(), new ReviewNextCardResponse.IntervalPreview(e.getValue(), timeUntil.format(e.getValue(), now)));
        }

        return new ReviewNextCardResponse(
                view.wordId(),
                view.word(),
                view.partOfSpeech(),
                view.meaning(),
                view.translation(),
                entity.getPhase(),
                status(entity),
                intervals,
                entity.getNextReviewAt(),
                queue
        );
    }

    @Transactional(readOnly = true)
    public ReviewStatsResponse stats() {
        Instant now = clock.now();
        Double avg = stateRepo.averageEasinessFactor(Phase.REVIEWING);
        return new ReviewStatsResponse(
                stateRepo.count(),
                stateRepo.countDue(now),
                stateRepo.countByPhase(Phase.LEARNING),
                stateRepo.countByPhase(Phase.REVIEWING),
                avg == null ? 0.0 : avg
        );
    }

    private static String status(SrCardStateEntity s) {
        if (s.getPhase() == Phase.LEARNING) {
            return "learning (step " + s.getLearningStep() + "/" + LearningStepEngine.STEP_COUNT + ")";
        }
        return "reviewing (reps: " + s.getRepetitions() + ")";
    }
}
