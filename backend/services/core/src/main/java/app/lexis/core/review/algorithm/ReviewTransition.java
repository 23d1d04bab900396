package app.lexis.core.review.algorithm;

import java.time.Instant;

public record ReviewTransition(
        CardState state,
        ReviewEvent event,
        Instant reviewedAt
) {
    public boolean graduated() {
        return event.type() == ReviewEvent.Type.GRADUATED;
    }
}
