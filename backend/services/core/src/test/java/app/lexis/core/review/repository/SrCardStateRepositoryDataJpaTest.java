package app.lexis.core.review.repository;

import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.entity.SrCardStateEntity;
import app.lexis.core.support.PostgresIntegrationTest;
import app.lexis.core.vocab.domain.entity.VocabWordEntity;
import app.lexis.core.vocab.repository.VocabWordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class SrCardStateRepositoryDataJpaTest extends PostgresIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    @Autowired
    SrCardStateRepository stateRepo;

    @Autowired
    VocabWordRepository wordRepository;

    @Test
    void dueQueueIsOrderedByDueTimeThenWordId() {
        Long late = seedWord("late");
        Long early = seedWord("early");
        Long tieA = seedWord("tie-a");
        Long tieB = seedWord("tie-b");
        Long future = seedWord("future");

        learning(late, 1, NOW.minusSeconds(10));
        learning(early, 2, NOW.minusSeconds(3600));
        reviewing(tieB, 1, 1, 2.5, NOW.minusSeconds(60));
        reviewing(tieA, 2, 6, 2.6, NOW.minusSeconds(60));
        learning(future, 1, NOW.plusSeconds(60));

        assertThat(stateRepo.findDue(NOW))
                .extracting(SrCardStateEntity::getWordId)
                .containsExactly(early, Math.min(tieA, tieB), Math.max(tieA, tieB), late);
        assertThat(stateRepo.findDueWordIds(NOW, PageRequest.of(0, 1))).containsExactly(early);
        assertThat(stateRepo.countDue(NOW)).isEqualTo(4);
    }

    @Test
    void dueBoundaryIsInclusive() {
        Long id = seedWord("boundary");
        learning(id, 1, NOW);

        assertThat(stateRepo.countDue(NOW)).isEqualTo(1);
        assertThat(stateRepo.countDue(NOW.minusMillis(1))).isZero();
    }

    @Test
    void aggregatesPhaseCountsAndAverageEasiness() {
        learning(seedWord("one"), 1, NOW);
        reviewing(seedWord("two"), 1, 1, 2.5, NOW);
        reviewing(seedWord("three"), 2, 6, 2.7, NOW);

        assertThat(stateRepo.countByPhase(Phase.LEARNING)).isEqualTo(1);
        assertThat(stateRepo.countByPhase(Phase.REVIEWING)).isEqualTo(2);
        assertThat(stateRepo.averageEasinessFactor(Phase.REVIEWING)).isCloseTo(2.6, within(1e-9));
    }

    @Test
    void averageEasinessIsNullWithoutReviewingCards() {
        learning(seedWord("fresh"), 1, NOW);

        assertThat(stateRepo.averageEasinessFactor(Phase.REVIEWING)).isNull();
    }

    @Test
    void findByIdForUpdateReturnsPersistedSchedule() {
        Long id = seedWord("locked");
        reviewing(id, 3, 16, 2.7, NOW);

        SrCardStateEntity row = stateRepo.findByIdForUpdate(id).orElseThrow();

        assertThat(row.getPhase()).isEqualTo(Phase.REVIEWING);
        assertThat(row.getLearningStep()).isNull();
        assertThat(row.getIntervalDays()).isEqualTo(16);
        assertThat(row.getRowVersion()).isNotNull();
    }

    @Test
    void deletingWordsRemovesTheirSchedules() {
        learning(seedWord("gone"), 1, NOW);
        learning(seedWord("also-gone"), 2, NOW);

        int deleted = wordRepository.deleteAllWords();

        assertThat(deleted).isEqualTo(2);
        assertThat(stateRepo.count()).isZero();
    }

    @Test
    void wordLookupIgnoresCase() {
        seedWord("Serendipity");

        assertThat(wordRepository.existsByWordIgnoreCase("serendipity")).isTrue();
        assertThat(wordRepository.existsByWordIgnoreCase("serendip")).isFalse();
    }

    @Test
    void wordUniquenessIgnoresCase() {
        seedWord("Serendipity");

        assertThatThrownBy(() -> seedWord("serendipity"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private Long seedWord(String word) {
        VocabWordEntity w = new VocabWordEntity();
        w.setWord(word);
        w.setPartOfSpeech("noun");
        w.setMeaning("meaning of " + word);
        w.setTranslation("");
        w.setCreatedAt(NOW);
        return wordRepository.saveAndFlush(w).getWordId();
    }

    private void learning(Long wordId, int step, Instant due) {
        SrCardStateEntity s = new SrCardStateEntity();
        s.setWordId(wordId);
        s.setPhase(Phase.LEARNING);
        s.setLearningStep(step);
        s.setRepetitions(0);
        s.setIntervalDays(1);
        s.setEasinessFactor(2.5);
        s.setNextReviewAt(due);
        s.setReviewCount(0);
        stateRepo.saveAndFlush(s);
    }

    private void reviewing(Long wordId, int reps, int interval, double ef, Instant due) {
        SrCardStateEntity s = new SrCardStateEntity();
        s.setWordId(wordId);
        s.setPhase(Phase.REVIEWING);
        s.setRepetitions(reps);
        s.setIntervalDays(interval);
        s.setEasinessFactor(ef);
        s.setNextReviewAt(due);
        s.setReviewCount(reps);
        stateRepo.saveAndFlush(s);
    }
}
