package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.CityDailyRollingRow;
import com.hometown.happiness.dto.CityRollupRow;
import com.hometown.happiness.dto.TeamGameResult;
import com.hometown.happiness.dto.TeamRollupRow;
import com.hometown.happiness.model.League;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;

/**
 * Time-bucketed sums over the ledger. Team rollups key on (league, team, period); city rollups map each
 * team to its city first and drop rows whose team has no city.
 */
@Service
public class RollupService {
    private static final Logger log = LoggerFactory.getLogger(RollupService.class);

    static final int ROLLING_WINDOW_DAYS = 7;

    private final LocalDate dailyStartDate;

    public RollupService(HappinessProperties properties) {
        this.dailyStartDate = parseCutoff(properties.getRollup().getDailyStartDate());
    }

    public List<TeamRollupRow> teamWeekly(List<TeamGameResult> ledger) {
        return teamRollup(ledger, TeamGameResult::weekStart);
    }

    public List<TeamRollupRow> teamMonthly(List<TeamGameResult> ledger) {
        return teamRollup(ledger, TeamGameResult::monthStart);
    }

    public List<CityRollupRow> cityWeekly(List<TeamGameResult> ledger, Map<String, String> teamCity) {
        return cityRollup(ledger, teamCity, TeamGameResult::weekStart);
    }

    public List<CityRollupRow> cityMonthly(List<TeamGameResult> ledger, Map<String, String> teamCity) {
        return cityRollup(ledger, teamCity, TeamGameResult::monthStart);
    }

    /**
     * Per-city daily totals on a dense calendar from the city's first to last game day, with trailing
     * seven-day sums. Days without games appear as zero rows and still count toward the window.
     */
    public List<CityDailyRollingRow> cityDailyRolling(List<TeamGameResult> ledger, Map<String, String> teamCity) {
        // city -> date -> {index, weighted, games}
        Map<String, TreeMap<LocalDate, long[]>> byCity = new TreeMap<>();
        for (TeamGameResult r : ledger) {
            if (dailyStartDate != null && r.date().isBefore(dailyStartDate)) continue;
            String cityId = teamCity.get(r.teamId());
            if (cityId == null || cityId.isBlank()) continue;
            long[] acc = byCity.computeIfAbsent(cityId, k -> new TreeMap<>())
                    .computeIfAbsent(r.date(), k -> new long[3]);
            acc[0] += r.indexScore();
            acc[1] += r.weightedScore();
            acc[2]++;
        }

        List<CityDailyRollingRow> out = new ArrayList<>();
        for (Map.Entry<String, TreeMap<LocalDate, long[]>> e : byCity.entrySet()) {
            TreeMap<LocalDate, long[]> days = e.getValue();
            Deque<long[]> window = new ArrayDeque<>(ROLLING_WINDOW_DAYS);
            long idx7 = 0, w7 = 0, g7 = 0;
            for (LocalDate d = days.firstKey(); !d.isAfter(days.lastKey()); d = d.plusDays(1)) {
                long[] day = days.getOrDefault(d, new long[3]);
                window.addLast(day);
                idx7 += day[0];
                w7 += day[1];
                g7 += day[2];
                if (window.size() > ROLLING_WINDOW_DAYS) {
                    long[] old = window.removeFirst();
                    idx7 -= old[0];
                    w7 -= old[1];
                    g7 -= old[2];
                }
                out.add(new CityDailyRollingRow(d, e.getKey(), day[0], day[1], day[2], idx7, w7, g7));
            }
        }
        log.info("[ROLLUP][DAILY_7D] cities={} rows={}", byCity.size(), out.size());
        return out;
    }

    private static List<TeamRollupRow> teamRollup(List<TeamGameResult> ledger, Function<TeamGameResult, LocalDate> period) {
        Map<TeamKey, long[]> sums = new TreeMap<>();
        for (TeamGameResult r : ledger) {
            long[] acc = sums.computeIfAbsent(new TeamKey(r.league(), r.teamId(), period.apply(r)), k -> new long[3]);
            acc[0] += r.indexScore();
            acc[1] += r.weightedScore();
            acc[2]++;
        }
        List<TeamRollupRow> out = new ArrayList<>(sums.size());
        sums.forEach((k, v) -> out.add(new TeamRollupRow(k.league(), k.teamId(), k.period(), v[0], v[1], v[2])));
        return out;
    }

    private static List<CityRollupRow> cityRollup(List<TeamGameResult> ledger, Map<String, String> teamCity,
                                                  Function<TeamGameResult, LocalDate> period) {
        Map<CityKey, long[]> sums = new TreeMap<>();
        int unmapped = 0;
        for (TeamGameResult r : ledger) {
            String cityId = teamCity.get(r.teamId());
            if (cityId == null || cityId.isBlank()) {
                unmapped++;
                continue;
            }
            long[] acc = sums.computeIfAbsent(new CityKey(cityId, period.apply(r)), k -> new long[3]);
            acc[0] += r.indexScore();
            acc[1] += r.weightedScore();
            acc[2]++;
        }
        if (unmapped > 0) {
            log.warn("[ROLLUP] {} ledger rows have no city mapping and were left out of city rollups", unmapped);
        }
        List<CityRollupRow> out = new ArrayList<>(sums.size());
        sums.forEach((k, v) -> out.add(new CityRollupRow(k.cityId(), k.period(), v[0], v[1], v[2])));
        return out;
    }

    private static LocalDate parseCutoff(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalStateException("happiness.rollup.daily-start-date must be yyyy-MM-dd, got '" + raw + "'", ex);
        }
    }

    private record TeamKey(League league, String teamId, LocalDate period) implements Comparable<TeamKey> {
        private static final Comparator<TeamKey> ORDER = Comparator
                .comparing((TeamKey k) -> k.league().code())
                .thenComparing(TeamKey::teamId)
                .thenComparing(TeamKey::period);

        @Override
        public int compareTo(TeamKey o) {
            return ORDER.compare(this, o);
        }
    }

    private record CityKey(String cityId, LocalDate period) implements Comparable<CityKey> {
        private static final Comparator<CityKey> ORDER = Comparator
                .comparing(CityKey::cityId)
                .thenComparing(CityKey::period);

        @Override
        public int compareTo(CityKey o) {
            return ORDER.compare(this, o);
        }
    }
}
