package com.hometown.happiness.service;

import com.hometown.happiness.model.City;
import com.hometown.happiness.model.IngestionIssue;
import com.hometown.happiness.model.Team;

import java.util.*;

/**
 * Identity state for one ingestion run: which city/team ids are already stored, which ones this run
 * created, and which raw tokens could not be mapped. Built once at the start of a run, discarded after.
 */
public class ResolutionContext {

    private final Set<String> knownCityIds;
    private final Set<String> knownTeamIds;
    private final Map<String, City> newCities = new LinkedHashMap<>();
    private final Map<String, Team> newTeams = new LinkedHashMap<>();
    private final Set<String> unresolvedTokens = new LinkedHashSet<>();
    private final List<IngestionIssue> issues = new ArrayList<>();

    private ResolutionContext(Collection<String> cityIds, Collection<String> teamIds) {
        this.knownCityIds = new HashSet<>(cityIds);
        this.knownTeamIds = new HashSet<>(teamIds);
    }

    public static ResolutionContext empty() {
        return new ResolutionContext(List.of(), List.of());
    }

    public static ResolutionContext of(Collection<String> storedCityIds, Collection<String> storedTeamIds) {
        return new ResolutionContext(storedCityIds, storedTeamIds);
    }

    /** @return true when the city was not seen before and has been queued for insertion */
    public boolean registerCity(City city) {
        if (!knownCityIds.add(city.getId())) return false;
        newCities.put(city.getId(), city);
        return true;
    }

    public boolean registerTeam(Team team) {
        if (!knownTeamIds.add(team.getId())) return false;
        newTeams.put(team.getId(), team);
        return true;
    }

    public boolean isKnownTeam(String teamId) {
        return knownTeamIds.contains(teamId);
    }

    /** @return true the first time a token is reported, so each unmapped code is recorded once per run */
    public boolean markUnresolved(String token) {
        return unresolvedTokens.add(token);
    }

    public void recordIssue(IngestionIssue issue) {
        issues.add(issue);
    }

    public List<City> newCities() { return new ArrayList<>(newCities.values()); }
    public List<Team> newTeams() { return new ArrayList<>(newTeams.values()); }
    public Set<String> unresolvedTokens() { return Collections.unmodifiableSet(unresolvedTokens); }
    public List<IngestionIssue> issues() { return Collections.unmodifiableList(issues); }

    public long countIssues(IngestionIssue.Kind kind) {
        return issues.stream().filter(i -> i.getKind() == kind).count();
    }
}
