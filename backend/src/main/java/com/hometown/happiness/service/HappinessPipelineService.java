package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.CityScoreRow;
import com.hometown.happiness.dto.IngestionSummaryDTO;
import com.hometown.happiness.dto.TeamGameResult;
import com.hometown.happiness.model.City;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.Team;
import com.hometown.happiness.repository.CityRepository;
import com.hometown.happiness.repository.GameRepository;
import com.hometown.happiness.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One batch run: ingest every configured feed and pending daily snapshot, export the canonical tables,
 * then rebuild the ledger, rollups and city scores from what is stored.
 */
@Service
public class HappinessPipelineService {
    private static final Logger log = LoggerFactory.getLogger(HappinessPipelineService.class);

    private final HappinessProperties properties;
    private final LeagueIngestionService ingestionService;
    private final DailySnapshotService snapshotService;
    private final LedgerBuilder ledgerBuilder;
    private final RollupService rollupService;
    private final CityScoreService cityScoreService;
    private final SelectedTeamsRollupService selectedTeamsRollupService;
    private final TableExportService exportService;
    private final CityRepository cityRepository;
    private final TeamRepository teamRepository;
    private final GameRepository gameRepository;

    public HappinessPipelineService(HappinessProperties properties,
                                    LeagueIngestionService ingestionService,
                                    DailySnapshotService snapshotService,
                                    LedgerBuilder ledgerBuilder,
                                    RollupService rollupService,
                                    CityScoreService cityScoreService,
                                    SelectedTeamsRollupService selectedTeamsRollupService,
                                    TableExportService exportService,
                                    CityRepository cityRepository,
                                    TeamRepository teamRepository,
                                    GameRepository gameRepository) {
        this.properties = properties;
        this.ingestionService = ingestionService;
        this.snapshotService = snapshotService;
        this.ledgerBuilder = ledgerBuilder;
        this.rollupService = rollupService;
        this.cityScoreService = cityScoreService;
        this.selectedTeamsRollupService = selectedTeamsRollupService;
        this.exportService = exportService;
        this.cityRepository = cityRepository;
        this.teamRepository = teamRepository;
        this.gameRepository = gameRepository;
    }

    public List<IngestionSummaryDTO> runAll() {
        List<IngestionSummaryDTO> summaries = new ArrayList<>();
        for (League league : League.values()) {
            ingestLeague(league).ifPresent(summaries::add);
        }
        appendDailySnapshots();
        exportCanonicalTables();
        List<TeamGameResult> ledger = buildLedger();
        exportService.writeLedger(properties.getData().processed("team_game_results.csv"), ledger);
        writeRollups(ledger);
        writeCityScores(ledger);
        writeSelectedTeams(ledger);
        log.info("[PIPELINE] done: feeds={} games={} ledgerRows={}", summaries.size(), gameRepository.count(), ledger.size());
        return summaries;
    }

    /** Ingests the league's configured feed; empty when the feed name is blank. */
    public Optional<IngestionSummaryDTO> ingestLeague(League league) {
        String feedName = properties.getFeeds().forLeague(league);
        if (feedName == null || feedName.isBlank()) {
            log.info("[PIPELINE][{}] no feed configured, skipping", league);
            return Optional.empty();
        }
        return Optional.of(ingestionService.ingest(league, properties.getData().raw(feedName.trim())));
    }

    public int appendDailySnapshots() {
        Path dailyDir = Path.of(properties.getData().getDailyDir());
        if (!Files.isDirectory(dailyDir)) return 0;
        List<Path> files;
        try (Stream<Path> s = Files.list(dailyDir)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(".csv")).sorted().collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed listing " + dailyDir, ex);
        }
        int added = 0;
        for (Path f : files) {
            added += snapshotService.appendSnapshot(f).gamesAdded();
        }
        return added;
    }

    public void exportCanonicalTables() {
        exportService.writeCities(properties.getData().processed("cities.csv"), cityRepository.findAllByOrderByIdAsc());
        exportService.writeTeams(properties.getData().processed("teams.csv"), teamRepository.findAllByOrderByIdAsc());
        exportService.writeGames(properties.getData().processed("games.csv"), gameRepository.findAllByOrderByDateAscIdAsc());
        log.info("[EXPORT] canonical tables written to {}", properties.getData().getProcessedDir());
    }

    public List<TeamGameResult> buildLedger() {
        List<TeamGameResult> ledger = ledgerBuilder.buildAll(gameRepository.findAllByOrderByDateAscIdAsc());
        log.info("[LEDGER] {} team-game rows", ledger.size());
        return ledger;
    }

    public void writeRollups(List<TeamGameResult> ledger) {
        Map<String, String> teamCity = teamCityMap();
        HappinessProperties.DataDirs dirs = properties.getData();
        exportService.writeTeamRollups(dirs.outputs("team_rollup_weekly.csv"), rollupService.teamWeekly(ledger));
        exportService.writeTeamRollups(dirs.outputs("team_rollup_monthly.csv"), rollupService.teamMonthly(ledger));
        exportService.writeCityRollups(dirs.outputs("city_rollup_weekly.csv"), rollupService.cityWeekly(ledger, teamCity));
        exportService.writeCityRollups(dirs.outputs("city_rollup_monthly.csv"), rollupService.cityMonthly(ledger, teamCity));
        exportService.writeCityDailyRolling(dirs.outputs("city_daily_7d.csv"), rollupService.cityDailyRolling(ledger, teamCity));
    }

    public List<CityScoreRow> writeCityScores(List<TeamGameResult> ledger) {
        Map<String, String> cityNames = new HashMap<>();
        for (City c : cityRepository.findAll()) {
            cityNames.put(c.getId(), c.getCityName());
        }
        List<CityScoreRow> daily = cityScoreService.computeDaily(ledger, teamCityMap(), cityNames);
        List<CityScoreRow> latest = cityScoreService.latest(daily);
        exportService.writeCityScores(properties.getData().outputs("city_scores.csv"), daily);
        exportService.writeCityScores(properties.getData().outputs("city_scores_latest.csv"), latest);
        log.info("[CITY_SCORES] rows={} latest={}", daily.size(), latest.size());
        return latest;
    }

    private void writeSelectedTeams(List<TeamGameResult> ledger) {
        Map<String, String> configured = properties.getRollup().getSelectedTeams();
        if (configured == null || configured.isEmpty()) return;
        Map<League, String> selection = new EnumMap<>(League.class);
        configured.forEach((code, team) -> selection.put(League.fromCode(code), team));
        exportService.writeSelectedTeamsMonthly(properties.getData().outputs("selected_teams_monthly.csv"),
                selectedTeamsRollupService.monthly(ledger, selection));
    }

    private Map<String, String> teamCityMap() {
        Map<String, String> teamCity = new HashMap<>();
        for (Team t : teamRepository.findAll()) {
            teamCity.put(t.getId(), t.getCityId());
        }
        return teamCity;
    }
}
