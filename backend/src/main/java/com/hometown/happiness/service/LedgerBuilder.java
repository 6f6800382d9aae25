package com.hometown.happiness.service;

import com.hometown.happiness.dto.GameOutcome;
import com.hometown.happiness.dto.ScoredOutcome;
import com.hometown.happiness.dto.TeamGameResult;
import com.hometown.happiness.model.Game;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Expands each game into one ledger row per participating team. */
@Service
public class LedgerBuilder {

    public static final Comparator<TeamGameResult> LEDGER_ORDER = Comparator
            .comparing(TeamGameResult::date)
            .thenComparing(r -> r.league().code())
            .thenComparing(TeamGameResult::gameId)
            .thenComparing(TeamGameResult::teamId);

    private final OutcomeScorer scorer;

    public LedgerBuilder(OutcomeScorer scorer) {
        this.scorer = scorer;
    }

    /** Home perspective first, then away. */
    public List<TeamGameResult> build(Game game) {
        GameOutcome outcome = scorer.score(game);
        return List.of(
                row(game, game.getHomeTeamId(), game.getAwayTeamId(), true,
                        game.getHomeScore(), game.getAwayScore(), outcome.home()),
                row(game, game.getAwayTeamId(), game.getHomeTeamId(), false,
                        game.getAwayScore(), game.getHomeScore(), outcome.away()));
    }

    public List<TeamGameResult> buildAll(Collection<Game> games) {
        List<TeamGameResult> ledger = new ArrayList<>(games.size() * 2);
        for (Game g : games) {
            ledger.addAll(build(g));
        }
        ledger.sort(LEDGER_ORDER);
        return ledger;
    }

    /** Monday of the ISO week containing {@code date}. */
    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate monthStart(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    private static TeamGameResult row(Game game, String teamId, String opponentId, boolean home,
                                      Integer teamScore, Integer opponentScore, ScoredOutcome outcome) {
        return new TeamGameResult(game.getId(), game.getDate(), game.getLeague(), game.getSeasonType(),
                teamId, opponentId, home, teamScore, opponentScore,
                outcome.result(), outcome.indexScore(), outcome.weightedScore(),
                weekStart(game.getDate()), monthStart(game.getDate()));
    }
}
