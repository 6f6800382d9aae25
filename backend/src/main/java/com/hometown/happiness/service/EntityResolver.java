package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.CityTeamSplit;
import com.hometown.happiness.dto.ResolvedTeam;
import com.hometown.happiness.dto.TeamReference;
import com.hometown.happiness.model.City;
import com.hometown.happiness.model.IngestionIssue;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.Team;
import com.hometown.happiness.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Maps raw league team tokens to canonical team and city ids, queueing any City/Team row not yet
 * known to the {@link ResolutionContext}. Never fails on a missing mapping: unknown codes become
 * placeholder identities tagged {@link ResolvedTeam.Status#PLACEHOLDER}.
 */
@Service
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    static final String DEFAULT_COUNTRY = "USA";

    private final HappinessProperties properties;

    public EntityResolver(HappinessProperties properties) {
        this.properties = properties;
    }

    /** Name-based leagues: "Toronto Maple Leafs" -> city "Toronto", team nhl_toronto-maple-leafs. */
    public ResolvedTeam resolveByFullName(League league, String rawName, ResolutionContext ctx) {
        String display = collapse(rawName);
        if (display.isEmpty()) {
            throw new IllegalArgumentException("Blank team name for " + league);
        }
        CityTeamSplit split = splitCityTeam(display, properties.getResolver().nicknamesFor(league));
        String cityId = TeamNameNormalizer.slugify(split.city());
        String teamId = league.code() + "_" + TeamNameNormalizer.slugify(display);

        String cityName = ensureCity(cityId, split.city(), "", ctx);
        ctx.registerTeam(new Team(teamId, display, league, cityId, cityName, split.nickname()));

        // no nickname could be split off, so the whole name doubles as the city
        if (split.nickname().isEmpty()) {
            reportUnresolved(league, display, "no nickname could be split off; name used as city", ctx);
            return new ResolvedTeam(teamId, cityId, cityName, ResolvedTeam.Status.PLACEHOLDER);
        }
        return new ResolvedTeam(teamId, cityId, cityName, ResolvedTeam.Status.RESOLVED);
    }

    /**
     * Code-based leagues. A code missing from {@code table} falls back to the code itself as team id
     * suffix and as a degenerate city name.
     */
    public ResolvedTeam resolveByCode(League league, String rawCode, TeamReferenceTable table, ResolutionContext ctx) {
        String code = rawCode == null ? "" : rawCode.trim();
        if (code.isEmpty()) {
            throw new IllegalArgumentException("Blank team code for " + league);
        }
        String teamId = league.code() + "_" + code;
        Optional<TeamReference> ref = table.lookup(code);
        if (ref.isPresent() && !isBlank(ref.get().cityName())) {
            TeamReference r = ref.get();
            String cityId = TeamNameNormalizer.citySlug(r.cityName(), r.state());
            String cityName = ensureCity(cityId, r.cityName(), r.state(), ctx);
            ctx.registerTeam(new Team(teamId, teamDisplayName(r, cityName), league, cityId, cityName, r.altName()));
            return new ResolvedTeam(teamId, cityId, cityName, ResolvedTeam.Status.RESOLVED);
        }

        String cityId = TeamNameNormalizer.slugify(code);
        String cityName = ensureCity(cityId, code, "", ctx);
        ctx.registerTeam(new Team(teamId, code, league, cityId, cityName, code));
        reportUnresolved(league, code, "code not in reference table; city falls back to the code", ctx);
        return new ResolvedTeam(teamId, cityId, cityName, ResolvedTeam.Status.PLACEHOLDER);
    }

    /** Registers every team of a reference table up front (NBA seeds its roster before reading games). */
    public int seedFromReference(League league, TeamReferenceTable table, ResolutionContext ctx) {
        int seeded = 0;
        for (TeamReference r : table.entries()) {
            if (isBlank(r.cityName())) continue;
            String teamId = league.code() + "_" + r.code();
            if (ctx.isKnownTeam(teamId)) continue;
            resolveByCode(league, r.code(), table, ctx);
            seeded++;
        }
        return seeded;
    }

    /**
     * Splits "City Nickname". Known multi-word nicknames are tried longest first as a whole-word
     * suffix; otherwise the last space separates city from nickname. "New York Rangers" therefore
     * keeps its two-word city, and "Toronto Maple Leafs" its two-word nickname.
     */
    public static CityTeamSplit splitCityTeam(String fullName, Collection<String> multiwordNicknames) {
        String name = collapse(fullName);
        if (name.isEmpty()) return new CityTeamSplit("", "");
        String lower = name.toLowerCase(Locale.ROOT);

        List<String> candidates = new ArrayList<>();
        if (multiwordNicknames != null) {
            for (String n : multiwordNicknames) {
                String c = collapse(n);
                if (!c.isEmpty()) candidates.add(c);
            }
        }
        candidates.sort(Comparator.comparingInt(String::length).reversed());
        for (String nick : candidates) {
            String suffix = " " + nick.toLowerCase(Locale.ROOT);
            if (lower.endsWith(suffix) && lower.length() > suffix.length()) {
                int cut = name.length() - suffix.length();
                return new CityTeamSplit(name.substring(0, cut).trim(), name.substring(cut + 1));
            }
        }
        int lastSpace = name.lastIndexOf(' ');
        if (lastSpace > 0) {
            return new CityTeamSplit(name.substring(0, lastSpace), name.substring(lastSpace + 1));
        }
        return new CityTeamSplit(name, "");
    }

    private void reportUnresolved(League league, String token, String reason, ResolutionContext ctx) {
        String key = league.code() + ":" + token;
        if (!ctx.markUnresolved(key)) return;
        log.warn("[RESOLVER][PLACEHOLDER] {} '{}': {}", league, token, reason);
        ctx.recordIssue(new IngestionIssue(null, IngestionIssue.Kind.UNRESOLVED_ENTITY, key, reason));
    }

    /** Queues the city if unseen and returns the display name to carry on team rows. */
    private String ensureCity(String cityId, String cityName, String state, ResolutionContext ctx) {
        String display = collapse(cityName);
        ctx.registerCity(new City(cityId, display, state == null ? "" : state.trim(), DEFAULT_COUNTRY));
        return display;
    }

    private static String teamDisplayName(TeamReference r, String cityName) {
        String nickname = isBlank(r.teamName()) ? r.code() : r.teamName().trim();
        return (cityName + " " + nickname).trim();
    }

    private static String collapse(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
