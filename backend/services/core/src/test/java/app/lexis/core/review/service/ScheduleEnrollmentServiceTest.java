package app.lexis.core.review.service;

import app.lexis.core.review.algorithm.ReviewClock;
import app.lexis.core.review.api.ReviewSchedulePort.ScheduleSummary;
import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.entity.SrCardStateEntity;
import app.lexis.core.review.repository.SrCardStateRepository;
import app.lexis.core.review.util.TimeUntilFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleEnrollmentServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    @Mock
    SrCardStateRepository stateRepo;

    ScheduleEnrollmentService service;

    @BeforeEach
    void setup() {
        ReviewClock clock = new ReviewClock(Clock.fixed(NOW, ZoneOffset.UTC), ReviewClock.ACCELERATED_FACTOR);
        service = new ScheduleEnrollmentService(stateRepo, new CardStateMapper(new TimeUntilFormatter(clock)), clock);
    }

    @Test
    void enroll_startsAtFirstLearningStep() {
        when(stateRepo.existsById(5L)).thenReturn(false);
        when(stateRepo.save(any(SrCardStateEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ScheduleSummary summary = service.enroll(5L);

        ArgumentCaptor<SrCardStateEntity> captor = ArgumentCaptor.forClass(SrCardStateEntity.class);
        verify(stateRepo).save(captor.capture());
        SrCardStateEntity saved = captor.getValue();
        assertThat(saved.getWordId()).isEqualTo(5L);
        assertThat(saved.getPhase()).isEqualTo(Phase.LEARNING);
        assertThat(saved.getLearningStep()).isEqualTo(1);
        assertThat(saved.getEasinessFactor()).isEqualTo(2.5);
        assertThat(saved.getNextReviewAt()).isEqualTo(NOW.plusMillis(60));
        assertThat(saved.getReviewCount()).isZero();
        assertThat(saved.getLastReviewAt()).isNull();

        assertThat(summary.phase()).isEqualTo(Phase.LEARNING);
        assertThat(summary.nextReviewIn()).isEqualTo("0.1s");
    }

    @Test
    void enroll_refusesSecondSchedule() {
        when(stateRepo.existsById(5L)).thenReturn(true);

        assertThatThrownBy(() -> service.enroll(5L)).isInstanceOf(IllegalStateException.class);
        verify(stateRepo, never()).save(any());
    }

    @Test
    void findSchedules_keysSummariesByWord() {
        SrCardStateEntity row = new SrCardStateEntity();
        row.setWordId(8L);
        row.setPhase(Phase.REVIEWING);
        row.setRepetitions(2);
        row.setIntervalDays(6);
        row.setEasinessFactor(2.6);
        row.setNextReviewAt(NOW.minusSeconds(1));
        when(stateRepo.findByWordIdIn(List.of(8L))).thenReturn(List.of(row));

        Map<Long, ScheduleSummary> out = service.findSchedules(List.of(8L));

        assertThat(out).containsOnlyKeys(8L);
        assertThat(out.get(8L).intervalDays()).isEqualTo(6);
        assertThat(out.get(8L).nextReviewIn()).isEqualTo("now");
    }
}
