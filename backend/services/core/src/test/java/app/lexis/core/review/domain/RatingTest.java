package app.lexis.core.review.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RatingTest {

    @Test
    void fromString_acceptsNamesAndKeypadCodes() {
        assertThat(Rating.fromString("forgot")).isEqualTo(Rating.FORGOT);
        assertThat(Rating.fromString(" Hard ")).isEqualTo(Rating.HARD);
        assertThat(Rating.fromString("EASY")).isEqualTo(Rating.EASY);
        assertThat(Rating.fromString("1")).isEqualTo(Rating.FORGOT);
        assertThat(Rating.fromString("2")).isEqualTo(Rating.HARD);
        assertThat(Rating.fromString("3")).isEqualTo(Rating.EASY);
    }

    @Test
    void fromString_rejectsUnknownTokens() {
        assertThatThrownBy(() -> Rating.fromString("good"))
                .isInstanceOf(InvalidRatingException.class)
                .hasMessageContaining("good");
        assertThatThrownBy(() -> Rating.fromString("4")).isInstanceOf(InvalidRatingException.class);
        assertThatThrownBy(() -> Rating.fromString(" ")).isInstanceOf(InvalidRatingException.class);
        assertThatThrownBy(() -> Rating.fromString(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
