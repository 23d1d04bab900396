package app.lexis.core.review.algorithm;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardStateTest {

    private static final Instant DUE = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void newCard_startsAtStepOneWithDefaultEasiness() {
        CardState.Learning card = CardState.newCard(DUE);

        assertThat(card.step()).isEqualTo(1);
        assertThat(card.easinessFactor()).isEqualTo(2.5);
        assertThat(card.nextDue()).isEqualTo(DUE);
    }

    @Test
    void learning_rejectsStepOutsideRange() {
        assertThatThrownBy(() -> new CardState.Learning(0, 2.5, DUE)).isInstanceOf(InconsistentStateException.class);
        assertThatThrownBy(() -> new CardState.Learning(4, 2.5, DUE)).isInstanceOf(InconsistentStateException.class);
    }

    @Test
    void reviewing_rejectsShortIntervalAndLowEasiness() {
        assertThatThrownBy(() -> new CardState.Reviewing(2, 0, 2.5, DUE))
                .isInstanceOf(InconsistentStateException.class)
                .hasMessageContaining("interval");
        assertThatThrownBy(() -> new CardState.Reviewing(2, 6, 1.29, DUE))
                .isInstanceOf(InconsistentStateException.class)
                .hasMessageContaining("Easiness");
    }

    @Test
    void states_requireDueInstant() {
        assertThatThrownBy(() -> new CardState.Learning(1, 2.5, null)).isInstanceOf(InconsistentStateException.class);
        assertThatThrownBy(() -> new CardState.Reviewing(1, 1, 2.5, null)).isInstanceOf(InconsistentStateException.class);
    }
}
