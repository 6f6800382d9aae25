package com.hometown.happiness.service;

import com.hometown.happiness.dto.ParsedFeed;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.IngestionIssue;
import com.hometown.happiness.util.CsvFeedReader;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/** Row-at-a-time loader: one CSV record becomes at most one game. */
public abstract class AbstractCsvFeedLoader implements LeagueFeedLoader {
    private static final Logger log = LoggerFactory.getLogger(AbstractCsvFeedLoader.class);

    /**
     * Converts one record. Throws {@link IllegalArgumentException} for rows that cannot identify a game;
     * implementations validate before resolving so a rejected row does not register teams.
     */
    @FunctionalInterface
    protected interface RowMapper {
        Game toGame(CSVRecord rec);
    }

    @Override
    public ParsedFeed load(Path feed, ResolutionContext ctx) {
        try (CSVParser parser = CsvFeedReader.open(feed, league() + " feed", requiredColumns())) {
            return readRows(parser, rowMapper(ctx), ctx);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed reading " + feed, ex);
        }
    }

    /** Called once per load, after the header has been validated. */
    protected abstract RowMapper rowMapper(ResolutionContext ctx);

    private ParsedFeed readRows(CSVParser parser, RowMapper mapper, ResolutionContext ctx) {
        List<Game> games = new ArrayList<>();
        int total = 0, skipped = 0;
        int rowNum = 1; // header is row 1
        for (CSVRecord rec : parser) {
            rowNum++;
            total++;
            try {
                Game game = mapper.toGame(rec);
                if (game.getHomeScore() == null || game.getAwayScore() == null) {
                    recordIncomplete(ctx, rowNum, CsvFeedReader.payload(rec), game, "score missing or not a number");
                }
                games.add(game);
            } catch (IllegalArgumentException ex) {
                skipped++;
                log.debug("[INGEST][{}] row {} skipped: {}", league(), rowNum, ex.getMessage());
                ctx.recordIssue(new IngestionIssue(rowNum, IngestionIssue.Kind.SKIPPED_ROW, CsvFeedReader.payload(rec), ex.getMessage()));
            }
        }
        return new ParsedFeed(games, total, skipped);
    }

    protected void recordIncomplete(ResolutionContext ctx, Integer rowNum, String payload, Game game, String reason) {
        log.debug("[INGEST][{}][INCOMPLETE] {}: {}", league(), game.getId(), reason);
        ctx.recordIssue(new IngestionIssue(rowNum, IngestionIssue.Kind.INCOMPLETE_GAME, payload, game.getId() + ": " + reason));
    }

    protected static String requireText(CSVRecord rec, String column) {
        String v = CsvFeedReader.value(rec, column);
        if (v.isEmpty()) throw new IllegalArgumentException("Blank " + column);
        return v;
    }

    protected static LocalDate requireDate(CSVRecord rec, String column, List<DateTimeFormatter> formats) {
        String raw = CsvFeedReader.value(rec, column);
        LocalDate d = CsvFeedReader.parseDate(raw, formats);
        if (d == null) throw new IllegalArgumentException("Unparseable " + column + ": '" + raw + "'");
        return d;
    }

    /** Winner by score for feeds that carry no explicit flag; equal or missing scores mean no winner. */
    protected static String winnerByScore(String homeTeamId, Integer homeScore, String awayTeamId, Integer awayScore) {
        if (homeScore == null || awayScore == null || homeScore.equals(awayScore)) return "";
        return homeScore > awayScore ? homeTeamId : awayTeamId;
    }
}
