package com.hometown.happiness.service;

import com.hometown.happiness.dto.MergeResult;
import com.hometown.happiness.model.City;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.Team;
import com.hometown.happiness.repository.CityRepository;
import com.hometown.happiness.repository.GameRepository;
import com.hometown.happiness.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;

/**
 * Appends canonical rows whose id is not stored yet. Stored rows are never rewritten, and within one
 * batch the first row for an id wins.
 */
@Service
public class IngestionMerger {
    private static final Logger log = LoggerFactory.getLogger(IngestionMerger.class);

    private final CityRepository cityRepository;
    private final TeamRepository teamRepository;
    private final GameRepository gameRepository;

    public IngestionMerger(CityRepository cityRepository, TeamRepository teamRepository, GameRepository gameRepository) {
        this.cityRepository = cityRepository;
        this.teamRepository = teamRepository;
        this.gameRepository = gameRepository;
    }

    @Transactional
    public MergeResult merge(Collection<City> cities, Collection<Team> teams, Collection<Game> games) {
        List<City> newCities = fresh(cities, City::getId, cityRepository.findAllIds());
        List<Team> newTeams = fresh(teams, Team::getId, teamRepository.findAllIds());
        List<Game> newGames = fresh(games, Game::getId, gameRepository.findAllIds());

        if (!newCities.isEmpty()) cityRepository.saveAll(newCities);
        if (!newTeams.isEmpty()) teamRepository.saveAll(newTeams);
        if (!newGames.isEmpty()) gameRepository.saveAll(newGames);

        int duplicates = games.size() - newGames.size();
        if (duplicates > 0) {
            log.debug("[MERGE] {} game rows already known or repeated in batch", duplicates);
        }
        return new MergeResult(newCities.size(), newTeams.size(), newGames.size(), duplicates);
    }

    private static <T> List<T> fresh(Collection<T> rows, Function<T, String> id, Collection<String> stored) {
        Set<String> seen = new HashSet<>(stored);
        List<T> out = new ArrayList<>();
        for (T row : rows) {
            if (seen.add(id.apply(row))) out.add(row);
        }
        return out;
    }
}
