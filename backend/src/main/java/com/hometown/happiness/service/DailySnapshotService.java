package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.MergeResult;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.IngestionRun;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;
import com.hometown.happiness.repository.IngestionRunRepository;
import com.hometown.happiness.util.CsvFeedReader;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Daily snapshot files hold games already in the canonical schema (one file per day under
 * {@code happiness.data.daily-dir}). Appending one only adds game ids not stored yet.
 */
@Service
public class DailySnapshotService {
    private static final Logger log = LoggerFactory.getLogger(DailySnapshotService.class);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(DateTimeFormatter.ISO_LOCAL_DATE);
    static final String SOURCE = "snapshot";

    private final IngestionMerger merger;
    private final TableExportService exportService;
    private final IngestionRunRepository ingestionRunRepository;
    private final HappinessProperties properties;

    public DailySnapshotService(IngestionMerger merger,
                                TableExportService exportService,
                                IngestionRunRepository ingestionRunRepository,
                                HappinessProperties properties) {
        this.merger = merger;
        this.exportService = exportService;
        this.ingestionRunRepository = ingestionRunRepository;
        this.properties = properties;
    }

    @Transactional
    public MergeResult appendSnapshot(Path snapshot) {
        Instant started = Instant.now();
        List<Game> games = new ArrayList<>();
        int total = 0, skipped = 0;
        try (CSVParser parser = CsvFeedReader.open(snapshot, "daily snapshot", Arrays.asList(TableExportService.GAME_HEADER))) {
            for (CSVRecord rec : parser) {
                total++;
                try {
                    games.add(toGame(rec));
                } catch (IllegalArgumentException ex) {
                    skipped++;
                    log.warn("[SNAPSHOT] {} line {} skipped: {}", snapshot.getFileName(), rec.getRecordNumber() + 1, ex.getMessage());
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed reading " + snapshot, ex);
        }
        if (games.isEmpty() && skipped == 0) {
            log.info("[SNAPSHOT] {} has no games", snapshot);
            return MergeResult.EMPTY;
        }

        MergeResult merged = merger.merge(List.of(), List.of(), games);

        IngestionRun run = new IngestionRun();
        run.setSource(SOURCE);
        run.setSourceFile(snapshot.toAbsolutePath().toString());
        run.setFileHash(LeagueIngestionService.sha256Hex(snapshot));
        run.setRowsTotal(total);
        run.setRowsAccepted(total - skipped);
        run.setRowsSkipped(skipped);
        run.setGamesAdded(merged.gamesAdded());
        run.setGamesDuplicate(merged.gamesDuplicate());
        run.setStartedAt(started);
        run.setFinishedAt(Instant.now());
        run.setStatus("COMPLETED");
        ingestionRunRepository.save(run);

        log.info("[SNAPSHOT] {} gamesAdded={} alreadyKnown={} skipped={}",
                snapshot.getFileName(), merged.gamesAdded(), merged.gamesDuplicate(), skipped);
        return merged;
    }

    /** Creates the header-only snapshot file for {@code date} if it does not exist yet. */
    public Path ensureSnapshot(LocalDate date) {
        Path file = Path.of(properties.getData().getDailyDir()).resolve(date + ".csv");
        if (!Files.exists(file)) {
            exportService.writeGameHeader(file);
            log.info("[SNAPSHOT] created empty snapshot {}", file);
        }
        return file;
    }

    static Game toGame(CSVRecord rec) {
        String id = CsvFeedReader.value(rec, "game_id");
        if (id.isEmpty()) throw new IllegalArgumentException("Blank game_id");
        LocalDate date = CsvFeedReader.parseDate(CsvFeedReader.value(rec, "date"), DATE_FORMATS);
        if (date == null) throw new IllegalArgumentException("Unparseable date for " + id);
        String home = CsvFeedReader.value(rec, "home_team_id");
        String away = CsvFeedReader.value(rec, "away_team_id");
        if (home.isEmpty() || away.isEmpty()) throw new IllegalArgumentException("Missing team id for " + id);
        return new Game(id, date,
                League.fromCode(CsvFeedReader.value(rec, "league")),
                SeasonType.fromLabel(CsvFeedReader.value(rec, "season_type")),
                home, away,
                CsvFeedReader.parseScore(CsvFeedReader.value(rec, "home_score")),
                CsvFeedReader.parseScore(CsvFeedReader.value(rec, "away_score")),
                CsvFeedReader.value(rec, "winning_team_id"));
    }
}
