package com.hometown.happiness.service;

import com.hometown.happiness.dto.ResolvedTeam;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.SeasonType;
import com.hometown.happiness.util.TeamNameNormalizer;

import java.time.LocalDate;

/** Feeds that name teams in full ("Toronto Maple Leafs") and carry both scores on one row. */
public abstract class NameBasedFeedLoader extends AbstractCsvFeedLoader {

    protected final EntityResolver resolver;

    protected NameBasedFeedLoader(EntityResolver resolver) {
        this.resolver = resolver;
    }

    protected Game buildGame(LocalDate date, SeasonType seasonType,
                             String homeName, Integer homeScore,
                             String awayName, Integer awayScore,
                             ResolutionContext ctx) {
        ResolvedTeam home = resolver.resolveByFullName(league(), homeName, ctx);
        ResolvedTeam away = resolver.resolveByFullName(league(), awayName, ctx);
        String gameId = league().code() + "_" + date + "_"
                + TeamNameNormalizer.slugify(awayName) + "_" + TeamNameNormalizer.slugify(homeName);
        return new Game(gameId, date, league(), seasonType,
                home.teamId(), away.teamId(), homeScore, awayScore,
                winnerByScore(home.teamId(), homeScore, away.teamId(), awayScore));
    }
}
