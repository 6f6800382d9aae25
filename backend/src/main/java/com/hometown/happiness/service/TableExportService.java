package com.hometown.happiness.service;

import com.hometown.happiness.dto.*;
import com.hometown.happiness.model.City;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.Team;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * Writes the flat CSV tables read by downstream renderers. Every table is written to a temporary file
 * next to the target and moved into place, so readers never see a half-written file.
 */
@Service
public class TableExportService {
    private static final Logger log = LoggerFactory.getLogger(TableExportService.class);

    public static final String[] CITY_HEADER = {"city_id", "city_name", "state", "country", "slug"};
    public static final String[] TEAM_HEADER = {"team_id", "team_name", "league", "city_id", "city_name",
            "start_date", "end_date", "alt_names"};
    public static final String[] GAME_HEADER = {"game_id", "date", "league", "season_type", "home_team_id",
            "away_team_id", "home_score", "away_score", "winning_team_id"};
    public static final String[] LEDGER_HEADER = {"game_id", "date", "league", "season_type", "team_id",
            "opponent_team_id", "is_home", "team_score", "opponent_score", "result", "index_score",
            "weighted_score", "week_start", "month_start"};
    public static final String[] TEAM_ROLLUP_HEADER = {"league", "team_id", "period_start",
            "index_score_sum", "weighted_score_sum", "games"};
    public static final String[] CITY_ROLLUP_HEADER = {"city_id", "period_start",
            "index_score_sum", "weighted_score_sum", "games"};
    public static final String[] CITY_DAILY_HEADER = {"date", "city_id", "index_sum", "weighted_sum", "games",
            "index_sum_7d", "weighted_sum_7d", "games_7d"};
    public static final String[] CITY_SCORE_HEADER = {"date", "city_id", "city_name", "score", "wins", "losses",
            "playoff_wins", "playoff_losses"};
    public static final String[] SELECTED_TEAMS_HEADER = {"month_end", "month", "total_index_score", "games"};

    static final CSVFormat OUTPUT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    /** Mode for new tables; temp files start owner-only. */
    static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    @FunctionalInterface
    interface RowWriter {
        void write(CSVPrinter printer) throws IOException;
    }

    public void writeCities(Path target, Collection<City> cities) {
        write(target, CITY_HEADER, p -> {
            for (City c : cities) {
                p.printRecord(c.getId(), c.getCityName(), c.getState(), c.getCountry(), c.getSlug());
            }
        });
    }

    public void writeTeams(Path target, Collection<Team> teams) {
        write(target, TEAM_HEADER, p -> {
            for (Team t : teams) {
                p.printRecord(t.getId(), t.getTeamName(), t.getLeague().code(), t.getCityId(), t.getCityName(),
                        cell(t.getStartDate()), cell(t.getEndDate()), cell(t.getAltNames()));
            }
        });
    }

    public void writeGames(Path target, Collection<Game> games) {
        write(target, GAME_HEADER, p -> {
            for (Game g : games) {
                p.printRecord(g.getId(), g.getDate(), g.getLeague().code(), g.getSeasonType().code(),
                        g.getHomeTeamId(), g.getAwayTeamId(), cell(g.getHomeScore()), cell(g.getAwayScore()),
                        cell(g.getWinningTeamId()));
            }
        });
    }

    public void writeLedger(Path target, Collection<TeamGameResult> ledger) {
        write(target, LEDGER_HEADER, p -> {
            for (TeamGameResult r : ledger) {
                p.printRecord(r.gameId(), r.date(), r.league().code(), r.seasonType().code(), r.teamId(),
                        r.opponentTeamId(), r.home() ? "True" : "False", cell(r.teamScore()), cell(r.opponentScore()),
                        r.result(), r.indexScore(), r.weightedScore(), r.weekStart(), r.monthStart());
            }
        });
    }

    public void writeTeamRollups(Path target, Collection<TeamRollupRow> rows) {
        write(target, TEAM_ROLLUP_HEADER, p -> {
            for (TeamRollupRow r : rows) {
                p.printRecord(r.league().code(), r.teamId(), r.periodStart(),
                        r.indexScoreSum(), r.weightedScoreSum(), r.games());
            }
        });
    }

    public void writeCityRollups(Path target, Collection<CityRollupRow> rows) {
        write(target, CITY_ROLLUP_HEADER, p -> {
            for (CityRollupRow r : rows) {
                p.printRecord(r.cityId(), r.periodStart(), r.indexScoreSum(), r.weightedScoreSum(), r.games());
            }
        });
    }

    public void writeCityDailyRolling(Path target, Collection<CityDailyRollingRow> rows) {
        write(target, CITY_DAILY_HEADER, p -> {
            for (CityDailyRollingRow r : rows) {
                p.printRecord(r.date(), r.cityId(), r.indexSum(), r.weightedSum(), r.games(),
                        r.indexSum7d(), r.weightedSum7d(), r.games7d());
            }
        });
    }

    public void writeCityScores(Path target, Collection<CityScoreRow> rows) {
        write(target, CITY_SCORE_HEADER, p -> {
            for (CityScoreRow r : rows) {
                p.printRecord(r.date(), r.cityId(), r.cityName(), r.score(), r.wins(), r.losses(),
                        r.playoffWins(), r.playoffLosses());
            }
        });
    }

    public void writeSelectedTeamsMonthly(Path target, Collection<SelectedTeamsMonthlyRow> rows) {
        write(target, SELECTED_TEAMS_HEADER, p -> {
            for (SelectedTeamsMonthlyRow r : rows) {
                p.printRecord(r.monthEnd(), r.month(), r.totalIndexScore(), r.games());
            }
        });
    }

    /** Header-only file in the canonical game schema. */
    public void writeGameHeader(Path target) {
        write(target, GAME_HEADER, p -> { });
    }

    void write(Path target, String[] header, RowWriter rows) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(out, OUTPUT)) {
                printer.printRecord(Arrays.asList(header));
                rows.write(printer);
            }
            applyPermissions(tmp, target);
            moveIntoPlace(tmp, target);
            log.debug("[EXPORT] wrote {}", target);
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed writing " + target, ex);
        }
    }

    /** A replaced table keeps its current mode; a new one gets {@link #DEFAULT_PERMISSIONS}. */
    private static void applyPermissions(Path tmp, Path target) throws IOException {
        if (!tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) return;
        Set<PosixFilePermission> perms = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, perms);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            log.warn("[EXPORT] could not remove temp file {}: {}", tmp, cleanup.getMessage());
        }
    }

    private static Object cell(Object v) {
        return v == null ? "" : v;
    }
}
