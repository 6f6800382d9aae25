package com.hometown.happiness.service;

import com.hometown.happiness.config.ScoringWeights;
import com.hometown.happiness.dto.TeamGameResult;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerBuilderTest {

    private final LedgerBuilder builder = new LedgerBuilder(new OutcomeScorer(ScoringWeights.defaults()));

    private static Game vegasAtToronto() {
        return new Game("nhl_2023-01-10_vegas-golden-knights_toronto-maple-leafs", LocalDate.of(2023, 1, 10),
                League.NHL, SeasonType.REGULAR, "nhl_toronto-maple-leafs", "nhl_vegas-golden-knights",
                2, 4, "nhl_vegas-golden-knights");
    }

    @Test
    void decisiveGameGivesOppositeRowsHomeFirst() {
        List<TeamGameResult> rows = builder.build(vegasAtToronto());

        assertThat(rows).hasSize(2);
        TeamGameResult toronto = rows.get(0);
        TeamGameResult vegas = rows.get(1);

        assertThat(toronto.home()).isTrue();
        assertThat(toronto.teamId()).isEqualTo("nhl_toronto-maple-leafs");
        assertThat(toronto.opponentTeamId()).isEqualTo("nhl_vegas-golden-knights");
        assertThat(toronto.teamScore()).isEqualTo(2);
        assertThat(toronto.opponentScore()).isEqualTo(4);
        assertThat(toronto.result()).isEqualTo("L");
        assertThat(toronto.indexScore()).isEqualTo(-1);
        assertThat(toronto.weightedScore()).isEqualTo(-1);

        assertThat(vegas.home()).isFalse();
        assertThat(vegas.result()).isEqualTo("W");
        assertThat(vegas.indexScore()).isEqualTo(1);
        assertThat(vegas.weightedScore()).isEqualTo(1);

        assertThat(toronto.weekStart()).isEqualTo(LocalDate.of(2023, 1, 9));
        assertThat(toronto.monthStart()).isEqualTo(LocalDate.of(2023, 1, 1));
    }

    @Test
    void incompleteGameStillProducesTwoNeutralRows() {
        Game unplayed = new Game("mlb_2023-04-01_NYN_BOS", LocalDate.of(2023, 4, 1), League.MLB, SeasonType.REGULAR,
                "mlb_BOS", "mlb_NYN", null, null, "");
        List<TeamGameResult> rows = builder.build(unplayed);
        assertThat(rows).hasSize(2);
        assertThat(rows).allSatisfy(r -> {
            assertThat(r.result()).isEmpty();
            assertThat(r.indexScore()).isZero();
            assertThat(r.weightedScore()).isZero();
        });
    }

    @Test
    void ledgerIsSortedByDateLeagueGameAndTeam() {
        LocalDate d = LocalDate.of(2023, 1, 10);
        Game nhl = vegasAtToronto();
        Game mlb = new Game("mlb_2023-01-10_NYN_BOS", d, League.MLB, SeasonType.REGULAR, "mlb_BOS", "mlb_NYN", 1, 0, "mlb_BOS");
        Game earlier = new Game("nfl_2023-01-09_a_b", d.minusDays(1), League.NFL, SeasonType.PLAYOFF, "nfl_b", "nfl_a", 10, 20, "nfl_a");

        List<TeamGameResult> ledger = builder.buildAll(List.of(nhl, mlb, earlier));

        assertThat(ledger).extracting(TeamGameResult::teamId).containsExactly(
                "nfl_a", "nfl_b",
                "mlb_BOS", "mlb_NYN",
                "nhl_toronto-maple-leafs", "nhl_vegas-golden-knights");
        assertThat(ledger.get(0).weightedScore()).isEqualTo(3);
        assertThat(ledger.get(1).weightedScore()).isEqualTo(-3);
    }

    @Test
    void weekStartsOnMonday() {
        assertThat(LedgerBuilder.weekStart(LocalDate.of(2024, 3, 4))).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(LedgerBuilder.weekStart(LocalDate.of(2024, 3, 10))).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(LedgerBuilder.weekStart(LocalDate.of(2024, 1, 1))).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(LedgerBuilder.weekStart(LocalDate.of(2023, 1, 1))).isEqualTo(LocalDate.of(2022, 12, 26));
        assertThat(LedgerBuilder.monthStart(LocalDate.of(2024, 2, 29))).isEqualTo(LocalDate.of(2024, 2, 1));
    }
}
