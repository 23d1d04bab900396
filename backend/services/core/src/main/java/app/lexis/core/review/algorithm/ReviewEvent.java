package app.lexis.core.review.algorithm;

public record ReviewEvent(
        Type type,
        String description
) {

    public enum Type {
        RESET, REPEAT, ADVANCE, GRADUATED, LAPSED, REVIEWED
    }

    static ReviewEvent reset() {
        return new ReviewEvent(Type.RESET, "reset to step 1");
    }

    static ReviewEvent repeat(int step) {
        return new ReviewEvent(Type.REPEAT, "repeat step " + step);
    }

    static ReviewEvent advance(int step) {
        return new ReviewEvent(Type.ADVANCE, "advance to step " + step);
    }

    static ReviewEvent graduated() {
        return new ReviewEvent(Type.GRADUATED, "graduated");
    }

    static ReviewEvent lapsed() {
        return new ReviewEvent(Type.LAPSED, "back to learning");
    }

    static ReviewEvent reviewed(int intervalDays) {
        return new ReviewEvent(Type.REVIEWED, "reviewing, interval now " + intervalDays + " day(s)");
    }
}
