package br.com.fantasyflicks.backend.domain.model;

import br.com.fantasyflicks.backend.exception.InvalidDraftConfigurationException;
import br.com.fantasyflicks.backend.support.DraftFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DraftConfigurationTest {

    @Test
    void validConfigurationPasses() {
        DraftConfiguration config = DraftFixtures.config("A", "B", "C").build();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.totalPicks()).isEqualTo(6);
        assertThat(config.isTimed()).isTrue();
    }

    @Test
    void duplicatedParticipantIsRejected() {
        DraftConfiguration config = DraftFixtures.config("A", "B", "A").build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidDraftConfigurationException.class)
                .hasMessageContaining("A");
    }

    @Test
    void paddedParticipantIdIsRejected() {
        DraftConfiguration config = DraftFixtures.config("A", " P1").build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidDraftConfigurationException.class)
                .hasMessageContaining("' P1'");
    }

    @Test
    void roundsAndBudgetMustBeInRange() {
        assertThatThrownBy(DraftFixtures.config("A").roundsTotal(0).build()::validate)
                .isInstanceOf(InvalidDraftConfigurationException.class);
        assertThatThrownBy(DraftFixtures.config("A").turnBudgetSeconds(-1).build()::validate)
                .isInstanceOf(InvalidDraftConfigurationException.class);
    }

    @Test
    void untimedDraftHasNoBudget() {
        DraftConfiguration config = DraftFixtures.config("A", "B").turnBudgetSeconds(0).build();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.isTimed()).isFalse();
    }

    @Test
    void roundLockedOnlyForCategoryRounds() {
        assertThat(DraftFixtures.config("A")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .categoryStyle(CategoryStyle.CATEGORY_ROUNDS)
                .build().isRoundLocked()).isTrue();
        assertThat(DraftFixtures.config("A")
                .categoryStyle(CategoryStyle.CATEGORY_ROUNDS)
                .build().isRoundLocked()).isFalse();
    }
}
