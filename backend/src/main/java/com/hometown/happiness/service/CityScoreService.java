package com.hometown.happiness.service;

import com.hometown.happiness.dto.CityScoreRow;
import com.hometown.happiness.dto.TeamGameResult;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/** Daily city leaderboard: weighted score plus win/loss counts per (date, city). */
@Service
public class CityScoreService {

    public static final Comparator<CityScoreRow> LEADERBOARD_ORDER = Comparator
            .comparing(CityScoreRow::date)
            .thenComparing(Comparator.comparingLong(CityScoreRow::score).reversed())
            .thenComparing(CityScoreRow::cityId);

    /**
     * @param teamCity  team id to city id; rows for unmapped teams are ignored
     * @param cityNames city id to display name; missing names are written blank
     */
    public List<CityScoreRow> computeDaily(List<TeamGameResult> ledger, Map<String, String> teamCity,
                                           Map<String, String> cityNames) {
        Map<String, Tally> tallies = new HashMap<>();
        for (TeamGameResult r : ledger) {
            String cityId = teamCity.get(r.teamId());
            if (cityId == null || cityId.isBlank()) continue;
            tallies.computeIfAbsent(r.date() + "|" + cityId, k -> new Tally(r.date(), cityId)).add(r);
        }
        List<CityScoreRow> rows = new ArrayList<>(tallies.size());
        for (Tally t : tallies.values()) {
            rows.add(new CityScoreRow(t.date, t.cityId, cityNames.getOrDefault(t.cityId, ""),
                    t.score, t.wins, t.losses, t.playoffWins, t.playoffLosses));
        }
        rows.sort(LEADERBOARD_ORDER);
        return rows;
    }

    /** Rows for the most recent date present; empty input gives an empty view. */
    public List<CityScoreRow> latest(List<CityScoreRow> rows) {
        Optional<LocalDate> max = rows.stream().map(CityScoreRow::date).max(Comparator.naturalOrder());
        if (max.isEmpty()) return List.of();
        return rows.stream().filter(r -> r.date().equals(max.get())).collect(Collectors.toList());
    }

    private static final class Tally {
        private final LocalDate date;
        private final String cityId;
        private long score;
        private int wins;
        private int losses;
        private int playoffWins;
        private int playoffLosses;

        private Tally(LocalDate date, String cityId) {
            this.date = date;
            this.cityId = cityId;
        }

        private void add(TeamGameResult r) {
            score += r.weightedScore();
            if (r.isWin()) {
                wins++;
                if (r.isPlayoff()) playoffWins++;
            } else if (r.isLoss()) {
                losses++;
                if (r.isPlayoff()) playoffLosses++;
            }
        }
    }
}
