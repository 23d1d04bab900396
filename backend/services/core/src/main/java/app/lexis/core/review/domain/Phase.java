package app.lexis.core.review.domain;

public enum Phase {
    LEARNING, REVIEWING
}
