package com.hometown.happiness.service;

import com.hometown.happiness.dto.TeamGameResult;
import com.hometown.happiness.model.City;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TableExportServiceTest {

    private final TableExportService exporter = new TableExportService();

    @TempDir
    Path dir;

    @Test
    void gamesWriteBlankForAbsentScores() throws Exception {
        Path out = dir.resolve("processed/games.csv");
        exporter.writeGames(out, List.of(new Game("mlb_2023-04-01_NYN_BOS", LocalDate.of(2023, 4, 1), League.MLB,
                SeasonType.REGULAR, "mlb_BOS", "mlb_NYN", null, null, null)));

        assertThat(Files.readString(out, StandardCharsets.UTF_8)).isEqualTo(
                "game_id,date,league,season_type,home_team_id,away_team_id,home_score,away_score,winning_team_id\n"
                        + "mlb_2023-04-01_NYN_BOS,2023-04-01,mlb,regular,mlb_BOS,mlb_NYN,,,\n");
    }

    @Test
    void ledgerWritesPythonStyleBooleans() throws Exception {
        LocalDate d = LocalDate.of(2023, 1, 10);
        Path out = dir.resolve("team_game_results.csv");
        exporter.writeLedger(out, List.of(
                new TeamGameResult("g1", d, League.NHL, SeasonType.PLAYOFF, "nhl_a", "nhl_b", true, 2, 4,
                        "L", -1, -3, LedgerBuilder.weekStart(d), LedgerBuilder.monthStart(d))));

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(1)).isEqualTo("g1,2023-01-10,nhl,playoff,nhl_a,nhl_b,True,2,4,L,-1,-3,2023-01-09,2023-01-01");
    }

    @Test
    void rewriteReplacesContentAndLeavesNoTempFiles() throws Exception {
        Path out = dir.resolve("cities.csv");
        exporter.writeCities(out, List.of(new City("boston", "Boston", "", "USA")));
        exporter.writeCities(out, List.of(new City("st-louis", "St. Louis", "MO", "USA")));

        assertThat(Files.readAllLines(out)).containsExactly(
                "city_id,city_name,state,country,slug",
                "st-louis,St. Louis,MO,USA,st-louis");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("cities.csv");
        }
    }

    @Test
    void headerOnlyGameFile() throws Exception {
        Path out = dir.resolve("daily/2024-05-01.csv");
        exporter.writeGameHeader(out);
        assertThat(Files.readAllLines(out)).containsExactly(String.join(",", TableExportService.GAME_HEADER));
    }

    @Test
    void newTablesAreWorldReadable() throws Exception {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path out = dir.resolve("daily/2024-03-04.csv");

        exporter.writeGameHeader(out);

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(out))).isEqualTo("rw-r--r--");
    }

    @Test
    void replacedTablesKeepTheirMode() throws Exception {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path out = dir.resolve("cities.csv");
        Files.writeString(out, "stale\n");
        Files.setPosixFilePermissions(out, PosixFilePermissions.fromString("rw-rw-r--"));

        exporter.writeCities(out, List.of(new City("toronto", "Toronto", "", "USA")));

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(out))).isEqualTo("rw-rw-r--");
        assertThat(Files.readString(out, StandardCharsets.UTF_8)).startsWith("city_id,");
    }
}
