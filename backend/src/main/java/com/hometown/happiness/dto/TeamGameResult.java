package com.hometown.happiness.dto;

import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;

import java.time.LocalDate;

/** One ledger row: a game seen from one team's side. */
public record TeamGameResult(
        String gameId,
        LocalDate date,
        League league,
        SeasonType seasonType,
        String teamId,
        String opponentTeamId,
        boolean home,
        Integer teamScore,
        Integer opponentScore,
        String result,
        int indexScore,
        int weightedScore,
        LocalDate weekStart,
        LocalDate monthStart
) {
    public boolean isWin() { return "W".equals(result); }
    public boolean isLoss() { return "L".equals(result); }
    public boolean isPlayoff() { return seasonType == SeasonType.PLAYOFF; }
}
