package com.hometown.happiness.service;

import com.hometown.happiness.dto.SelectedTeamsMonthlyRow;
import com.hometown.happiness.dto.TeamGameResult;
import com.hometown.happiness.model.League;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;

/** Monthly index total for a hand-picked "hometown" set of one team per league. */
@Service
public class SelectedTeamsRollupService {

    /**
     * @param teamByLeague exactly one team id for each of the four leagues
     * @throws IllegalArgumentException if a league has no selected team
     */
    public List<SelectedTeamsMonthlyRow> monthly(List<TeamGameResult> ledger, Map<League, String> teamByLeague) {
        List<League> missing = new ArrayList<>();
        for (League league : League.values()) {
            String team = teamByLeague.get(league);
            if (team == null || team.isBlank()) missing.add(league);
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Selected teams missing leagues: " + missing);
        }

        TreeMap<LocalDate, long[]> byMonth = new TreeMap<>();
        for (TeamGameResult r : ledger) {
            if (!r.teamId().equals(teamByLeague.get(r.league()).trim())) continue;
            long[] acc = byMonth.computeIfAbsent(r.monthStart(), k -> new long[2]);
            acc[0] += r.indexScore();
            acc[1]++;
        }
        List<SelectedTeamsMonthlyRow> rows = new ArrayList<>(byMonth.size());
        byMonth.forEach((month, acc) -> rows.add(new SelectedTeamsMonthlyRow(
                month.withDayOfMonth(month.lengthOfMonth()), month, acc[0], acc[1])));
        return rows;
    }
}
