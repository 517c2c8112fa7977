package io.github.riemr.roster.optimization.objective;

import io.github.riemr.roster.exception.RosterModelException;
import io.github.riemr.roster.optimization.constraint.PenaltyFamily;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeightTableTest {

    @Test
    void defaults_areStrictlyRanked() {
        var weights = WeightTable.defaults();

        for (int i = 1; i < WeightTable.RANKING.size(); i++) {
            assertThat(weights.weightOf(WeightTable.RANKING.get(i - 1)))
                    .isGreaterThan(weights.weightOf(WeightTable.RANKING.get(i)));
        }
        assertThat(weights.weightOf(PenaltyFamily.REST_TIME)).isEqualTo(1_000_000L);
        assertThat(weights.weightOf(PenaltyFamily.FAIRNESS)).isEqualTo(1L);
    }

    @Test
    void withOverrides_returnsNewTableAndKeepsDefaults() {
        var raised = WeightTable.defaults().withOverrides(Map.of(PenaltyFamily.REST_TIME, 5_000_000L));

        assertThat(raised.weightOf(PenaltyFamily.REST_TIME)).isEqualTo(5_000_000L);
        assertThat(WeightTable.defaults().weightOf(PenaltyFamily.REST_TIME)).isEqualTo(1_000_000L);
        assertThat(raised.asMap()).hasSize(PenaltyFamily.values().length);
    }

    @Test
    void withOverrides_rejectsInvertedRanking() {
        assertThatThrownBy(() -> WeightTable.defaults().withOverrides(Map.of(PenaltyFamily.FAIRNESS, 200L)))
                .isInstanceOf(RosterModelException.class)
                .hasMessageContaining("RELIEF_RESERVE");
    }

    @Test
    void withOverrides_rejectsNonPositiveWeights() {
        assertThatThrownBy(() -> WeightTable.defaults().withOverrides(Map.of(PenaltyFamily.FAIRNESS, 0L)))
                .isInstanceOf(RosterModelException.class)
                .hasMessageContaining("must be positive");
    }
}
