package app.lexis.core.review.algorithm;

public enum LearningAction {
    REGRESS, REPEAT, ADVANCE
}
