package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.ParsedFeed;
import com.hometown.happiness.dto.ResolvedTeam;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.IngestionIssue;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;
import com.hometown.happiness.util.CsvFeedReader;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * NBA team-game totals: one row per team per game, so rows are grouped by {@code GAME_ID} before a
 * game can be built. Home and away come from {@code MATCHUP} ("GSW @ POR": GSW away, POR home;
 * "BKN vs. PHI": BKN home, PHI away), taking the majority across the game's rows.
 */
@Service
public class NbaFeedLoader implements LeagueFeedLoader {
    private static final Logger log = LoggerFactory.getLogger(NbaFeedLoader.class);

    private static final List<String> COLUMNS = List.of("TEAM_ABBREVIATION", "GAME_ID", "GAME_DATE", "MATCHUP", "WL");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(DateTimeFormatter.ISO_LOCAL_DATE);

    private final EntityResolver resolver;
    private final ReferenceTableLoader referenceTableLoader;
    private final HappinessProperties properties;

    public NbaFeedLoader(EntityResolver resolver, ReferenceTableLoader referenceTableLoader, HappinessProperties properties) {
        this.resolver = resolver;
        this.referenceTableLoader = referenceTableLoader;
        this.properties = properties;
    }

    @Override
    public League league() { return League.NBA; }

    @Override
    public List<String> requiredColumns() { return COLUMNS; }

    @Override
    public ParsedFeed load(Path feed, ResolutionContext ctx) {
        TeamReferenceTable roster = referenceTableLoader.loadNbaRoster(
                properties.getData().raw(properties.getReference().getNbaTeams()));
        Map<String, List<TeamRow>> byGame = new LinkedHashMap<>();
        int total = 0;
        int skipped = 0;
        try (CSVParser parser = CsvFeedReader.open(feed, "NBA feed", COLUMNS)) {
            int rowNum = 1;
            for (CSVRecord rec : parser) {
                rowNum++;
                total++;
                String gameId = CsvFeedReader.value(rec, "GAME_ID");
                String team = CsvFeedReader.value(rec, "TEAM_ABBREVIATION");
                if (gameId.isEmpty() || team.isEmpty()) {
                    skipped++;
                    ctx.recordIssue(new IngestionIssue(rowNum, IngestionIssue.Kind.SKIPPED_ROW,
                            CsvFeedReader.payload(rec), "Blank GAME_ID or TEAM_ABBREVIATION"));
                    continue;
                }
                byGame.computeIfAbsent(gameId, k -> new ArrayList<>()).add(new TeamRow(rowNum, team,
                        CsvFeedReader.parseDate(CsvFeedReader.value(rec, "GAME_DATE"), DATE_FORMATS),
                        CsvFeedReader.value(rec, "MATCHUP"),
                        CsvFeedReader.value(rec, "WL"),
                        CsvFeedReader.parseScore(CsvFeedReader.value(rec, "PTS")),
                        CsvFeedReader.payload(rec)));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed reading " + feed, ex);
        }

        int seeded = resolver.seedFromReference(League.NBA, roster, ctx);
        log.debug("[INGEST][NBA] seeded {} roster teams", seeded);

        List<Game> games = new ArrayList<>();
        for (Map.Entry<String, List<TeamRow>> e : byGame.entrySet()) {
            List<TeamRow> rows = e.getValue();
            Optional<Sides> sides = voteSides(rows);
            LocalDate date = rows.stream().map(TeamRow::date).filter(Objects::nonNull).findFirst().orElse(null);
            if (sides.isEmpty() || date == null) {
                skipped += rows.size();
                String reason = sides.isEmpty() ? "No parseable MATCHUP" : "Unparseable GAME_DATE";
                for (TeamRow r : rows) {
                    ctx.recordIssue(new IngestionIssue(r.rowNum(), IngestionIssue.Kind.SKIPPED_ROW, r.payload(), reason));
                }
                continue;
            }
            Game game = toGame(e.getKey(), date, sides.get(), rows, roster, ctx);
            if (game.getHomeScore() == null || game.getAwayScore() == null) {
                ctx.recordIssue(new IngestionIssue(rows.get(0).rowNum(), IngestionIssue.Kind.INCOMPLETE_GAME,
                        rows.get(0).payload(), game.getId() + ": no PTS for one or both teams"));
            }
            games.add(game);
        }
        return new ParsedFeed(games, total, skipped);
    }

    private Game toGame(String rawGameId, LocalDate date, Sides sides, List<TeamRow> rows,
                        TeamReferenceTable roster, ResolutionContext ctx) {
        ResolvedTeam home = resolver.resolveByCode(League.NBA, sides.home(), roster, ctx);
        ResolvedTeam away = resolver.resolveByCode(League.NBA, sides.away(), roster, ctx);

        Integer homeScore = null;
        Integer awayScore = null;
        String winner = "";
        for (TeamRow r : rows) {
            if (r.team().equals(sides.home()) && homeScore == null) homeScore = r.points();
            if (r.team().equals(sides.away()) && awayScore == null) awayScore = r.points();
            if (winner.isEmpty() && "W".equalsIgnoreCase(r.wl())) {
                if (r.team().equals(sides.home())) winner = home.teamId();
                else if (r.team().equals(sides.away())) winner = away.teamId();
            }
        }
        // WL alone is not a result: no score, no winner
        if (homeScore == null || awayScore == null) winner = "";
        return new Game("nba_" + rawGameId, date, League.NBA, SeasonType.REGULAR,
                home.teamId(), away.teamId(), homeScore, awayScore, winner);
    }

    /** Majority vote over every row's reading of MATCHUP; ties go to the first reading seen. */
    static Optional<Sides> voteSides(List<TeamRow> rows) {
        Map<Sides, Integer> votes = new LinkedHashMap<>();
        for (TeamRow r : rows) {
            parseMatchup(r.matchup()).ifPresent(s -> votes.merge(s, 1, Integer::sum));
        }
        Sides best = null;
        int bestCount = 0;
        for (Map.Entry<Sides, Integer> v : votes.entrySet()) {
            if (v.getValue() > bestCount) {
                best = v.getKey();
                bestCount = v.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    static Optional<Sides> parseMatchup(String matchup) {
        if (matchup == null) return Optional.empty();
        int at = matchup.indexOf('@');
        if (at >= 0) {
            return sides(matchup.substring(at + 1), matchup.substring(0, at));
        }
        int vs = matchup.indexOf(" vs");
        if (vs >= 0) {
            String right = matchup.substring(vs + 3);
            if (right.startsWith(".")) right = right.substring(1);
            return sides(matchup.substring(0, vs), right);
        }
        return Optional.empty();
    }

    private static Optional<Sides> sides(String home, String away) {
        String h = home.trim();
        String a = away.trim();
        if (h.isEmpty() || a.isEmpty()) return Optional.empty();
        return Optional.of(new Sides(h, a));
    }

    record Sides(String home, String away) {}

    record TeamRow(int rowNum, String team, LocalDate date, String matchup, String wl, Integer points, String payload) {}
}
