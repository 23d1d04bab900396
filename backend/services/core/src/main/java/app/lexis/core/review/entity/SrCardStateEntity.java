package app.lexis.core.review.entity;

import app.lexis.core.review.domain.Phase;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "sr_card_states", schema = "app_core")
public class SrCardStateEntity {

    @Id
    @Column(name = "word_id")
    private Long wordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false)
    private Phase phase;

    @Column(name = "learning_step")
    private Integer learningStep;

    @Column(name = "repetitions", nullable = false)
    private int repetitions;

    @Column(name = "interval_days", nullable = false)
    private int intervalDays;

    @Column(name = "easiness_factor", nullable = false)
    private double easinessFactor;

    @Column(name = "next_review_at", nullable = false)
    private Instant nextReviewAt;

    @Column(name = "last_review_at")
    private Instant lastReviewAt;

    @Column(name = "review_count", nullable = false)
    private int reviewCount;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    public Long getWordId() {
        return wordId;
    }

    public void setWordId(Long wordId) {
        this.wordId = wordId;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public Integer getLearningStep() {
        return learningStep;
    }

    public void setLearningStep(Integer learningStep) {
        this.learningStep = learningStep;
    }

    public int getRepetitions() {
        return repetitions;
    }

    public void setRepetitions(int repetitions) {
        this.repetitions = repetitions;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    public void setIntervalDays(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public double getEasinessFactor() {
        return easinessFactor;
    }

    public void setEasinessFactor(double easinessFactor) {
        this.easinessFactor = easinessFactor;
    }

    public Instant getNextReviewAt() {
        return nextReviewAt;
    }

    public void setNextReviewAt(Instant nextReviewAt) {
        this.nextReviewAt = nextReviewAt;
    }

    public Instant getLastReviewAt() {
        return lastReviewAt;
    }

    public void setLastReviewAt(Instant lastReviewAt) {
        this.lastReviewAt = lastReviewAt;
    }

    public int getReviewCount() {
        return reviewCount;
    }

    public void setReviewCount(int reviewCount) {
        this.reviewCount = reviewCount;
    }

    public Long getRowVersion() {
        return rowVersion;
    }

}
