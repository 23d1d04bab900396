package app.lexis.core.review.algorithm;

import app.lexis.core.review.domain.Rating;
import org.springframework.stereotype.Component;

/**
 * Learning cards read ratings as step moves; reviewing cards read them as SM-2 quality.
 */
@Component
public class RatingMapper {

    public static final int QUALITY_FORGOT = 0;
    public static final int QUALITY_HARD = 3;
    public static final int QUALITY_EASY = 5;

    public LearningAction toLearningAction(Rating rating) {
        return switch (rating) {
            case FORGOT -> LearningAction.REGRESS;
            case HARD -> LearningAction.REPEAT;
            case EASY -> LearningAction.ADVANCE;
        };
    }

    public int toQuality(Rating rating) {
        return switch (rating) {
            case FORGOT -> QUALITY_FORGOT;
            case HARD -> QUALITY_HARD;
            case EASY -> QUALITY_EASY;
        };
    }
}
