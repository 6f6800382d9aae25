package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.ResolvedTeam;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;
import com.hometown.happiness.util.CsvFeedReader;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Retrosheet-style game info: visitor/home retro codes, both scores and a "Game Winner" flag
 * (1 = visitor, 0 = home). Every game is regular season.
 */
@Service
public class MlbFeedLoader extends AbstractCsvFeedLoader {

    private static final List<String> COLUMNS = List.of("Date", "VT", "HT", "VT Score", "HT Score", "Game Winner");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyyMMdd"),
            DateTimeFormatter.ISO_LOCAL_DATE);

    private final EntityResolver resolver;
    private final ReferenceTableLoader referenceTableLoader;
    private final HappinessProperties properties;

    public MlbFeedLoader(EntityResolver resolver, ReferenceTableLoader referenceTableLoader, HappinessProperties properties) {
        this.resolver = resolver;
        this.referenceTableLoader = referenceTableLoader;
        this.properties = properties;
    }

    @Override
    public League league() { return League.MLB; }

    @Override
    public List<String> requiredColumns() { return COLUMNS; }

    @Override
    protected RowMapper rowMapper(ResolutionContext ctx) {
        TeamReferenceTable currentNames = referenceTableLoader.loadMlbCurrentNames(
                properties.getData().raw(properties.getReference().getMlbCurrentNames()));
        return rec -> toGame(rec, currentNames, ctx);
    }

    private Game toGame(CSVRecord rec, TeamReferenceTable currentNames, ResolutionContext ctx) {
        LocalDate date = requireDate(rec, "Date", DATE_FORMATS);
        String visitor = requireText(rec, "VT");
        String home = requireText(rec, "HT");
        Integer visitorScore = CsvFeedReader.parseScore(CsvFeedReader.value(rec, "VT Score"));
        Integer homeScore = CsvFeedReader.parseScore(CsvFeedReader.value(rec, "HT Score"));
        Integer winnerFlag = CsvFeedReader.parseScore(CsvFeedReader.value(rec, "Game Winner"));

        ResolvedTeam away = resolver.resolveByCode(League.MLB, visitor, currentNames, ctx);
        ResolvedTeam homeTeam = resolver.resolveByCode(League.MLB, home, currentNames, ctx);

        String winner = "";
        if (winnerFlag != null && visitorScore != null && homeScore != null) {
            winner = winnerFlag == 1 ? away.teamId() : homeTeam.teamId();
        }
        String gameId = "mlb_" + date + "_" + visitor + "_" + home;
        return new Game(gameId, date, League.MLB, SeasonType.REGULAR,
                homeTeam.teamId(), away.teamId(), homeScore, visitorScore, winner);
    }
}
