package com.hometown.happiness.service;

import com.hometown.happiness.dto.IngestionSummaryDTO;
import com.hometown.happiness.dto.MergeResult;
import com.hometown.happiness.dto.ParsedFeed;
import com.hometown.happiness.model.IngestionIssue;
import com.hometown.happiness.model.IngestionRun;
import com.hometown.happiness.model.League;
import com.hometown.happiness.repository.CityRepository;
import com.hometown.happiness.repository.IngestionIssueRepository;
import com.hometown.happiness.repository.IngestionRunRepository;
import com.hometown.happiness.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one league loader end to end: resolve and parse the feed, append unseen canonical rows and
 * record the run with its issues. Either the whole run is committed or nothing is.
 */
@Service
public class LeagueIngestionService {
    private static final Logger log = LoggerFactory.getLogger(LeagueIngestionService.class);

    private final Map<League, LeagueFeedLoader> loaders = new EnumMap<>(League.class);
    private final IngestionMerger merger;
    private final CityRepository cityRepository;
    private final TeamRepository teamRepository;
    private final IngestionRunRepository ingestionRunRepository;
    private final IngestionIssueRepository ingestionIssueRepository;

    public LeagueIngestionService(List<LeagueFeedLoader> loaders,
                                  IngestionMerger merger,
                                  CityRepository cityRepository,
                                  TeamRepository teamRepository,
                                  IngestionRunRepository ingestionRunRepository,
                                  IngestionIssueRepository ingestionIssueRepository) {
        for (LeagueFeedLoader l : loaders) {
            this.loaders.put(l.league(), l);
        }
        this.merger = merger;
        this.cityRepository = cityRepository;
        this.teamRepository = teamRepository;
        this.ingestionRunRepository = ingestionRunRepository;
        this.ingestionIssueRepository = ingestionIssueRepository;
    }

    @Transactional
    public IngestionSummaryDTO ingest(League league, Path feed) {
        LeagueFeedLoader loader = loaders.get(league);
        if (loader == null) {
            throw new IllegalArgumentException("No loader registered for " + league);
        }
        Instant started = Instant.now();
        ResolutionContext ctx = ResolutionContext.of(cityRepository.findAllIds(), teamRepository.findAllIds());

        ParsedFeed parsed;
        try {
            parsed = loader.load(feed, ctx);
        } catch (RuntimeException ex) {
            log.error("[INGEST][{}] aborted reading {}: {}", league, feed, ex.getMessage());
            throw ex;
        }
        MergeResult merged = merger.merge(ctx.newCities(), ctx.newTeams(), parsed.games());

        IngestionRun run = new IngestionRun();
        run.setSource(league.code());
        run.setSourceFile(feed.toAbsolutePath().toString());
        run.setFileHash(sha256Hex(feed));
        run.setRowsTotal(parsed.rowsTotal());
        run.setRowsAccepted(parsed.rowsAccepted());
        run.setRowsSkipped(parsed.rowsSkipped());
        run.setCitiesAdded(merged.citiesAdded());
        run.setTeamsAdded(merged.teamsAdded());
        run.setGamesAdded(merged.gamesAdded());
        run.setGamesDuplicate(merged.gamesDuplicate());
        run.setStartedAt(started);
        run.setFinishedAt(Instant.now());
        run.setStatus("COMPLETED");
        run = ingestionRunRepository.save(run);
        saveIssues(run, ctx.issues());

        int unresolved = (int) ctx.countIssues(IngestionIssue.Kind.UNRESOLVED_ENTITY);
        int incomplete = (int) ctx.countIssues(IngestionIssue.Kind.INCOMPLETE_GAME);
        log.info("[INGEST][{}] rows={} skipped={} citiesAdded={} teamsAdded={} gamesAdded={} duplicates={} unresolved={} incomplete={}",
                league, parsed.rowsTotal(), parsed.rowsSkipped(), merged.citiesAdded(), merged.teamsAdded(),
                merged.gamesAdded(), merged.gamesDuplicate(), unresolved, incomplete);
        return toSummary(run, unresolved, incomplete);
    }

    private void saveIssues(IngestionRun run, List<IngestionIssue> issues) {
        if (issues.isEmpty()) return;
        Instant now = Instant.now();
        for (IngestionIssue issue : issues) {
            issue.setRun(run);
            issue.setCreatedAt(now);
            issue.setPayload(truncate(issue.getPayload(), 2000));
            issue.setReason(truncate(issue.getReason(), 1000));
        }
        ingestionIssueRepository.saveAll(issues);
    }

    static IngestionSummaryDTO toSummary(IngestionRun run, int unresolved, int incomplete) {
        IngestionSummaryDTO dto = new IngestionSummaryDTO();
        dto.setRunId(run.getId());
        dto.setSource(run.getSource());
        dto.setStatus(run.getStatus());
        dto.setRowsTotal(run.getRowsTotal());
        dto.setRowsAccepted(run.getRowsAccepted());
        dto.setRowsSkipped(run.getRowsSkipped());
        dto.setCitiesAdded(run.getCitiesAdded());
        dto.setTeamsAdded(run.getTeamsAdded());
        dto.setGamesAdded(run.getGamesAdded());
        dto.setGamesDuplicate(run.getGamesDuplicate());
        dto.setUnresolvedEntities(unresolved);
        dto.setIncompleteGames(incomplete);
        dto.setStartedAt(run.getStartedAt());
        dto.setFinishedAt(run.getFinishedAt());
        return dto;
    }

    static String sha256Hex(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] buf = new byte[8192];
            int n;
            while ((n = in.read(buf)) > 0) md.update(buf, 0, n);
            StringBuilder sb = new StringBuilder();
            for (byte b : md.digest()) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
