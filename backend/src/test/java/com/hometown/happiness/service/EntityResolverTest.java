package com.hometown.happiness.service;

import com.hometown.happiness.config.HappinessProperties;
import com.hometown.happiness.dto.CityTeamSplit;
import com.hometown.happiness.dto.ResolvedTeam;
import com.hometown.happiness.dto.TeamReference;
import com.hometown.happiness.model.City;
import com.hometown.happiness.model.IngestionIssue;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntityResolverTest {

    private HappinessProperties properties;
    private EntityResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new HappinessProperties();
        resolver = new EntityResolver(properties);
    }

    @ParameterizedTest
    @CsvSource({
            "NHL, Toronto Maple Leafs, Toronto, Maple Leafs",
            "NHL, Columbus Blue Jackets, Columbus, Blue Jackets",
            "NHL, Vegas Golden Knights, Vegas, Golden Knights",
            "NHL, Detroit Red Wings, Detroit, Red Wings",
            "NFL, Washington Football Team, Washington, Football Team",
            "NFL, Washington Commanders, Washington, Commanders",
            "NFL, San Francisco 49ers, San Francisco, 49ers",
            "NHL, New York Rangers, New York, Rangers",
            "NFL, Tampa Bay Buccaneers, Tampa Bay, Buccaneers"
    })
    void splitsCityFromNickname(League league, String full, String city, String nickname) {
        CityTeamSplit split = EntityResolver.splitCityTeam(full, properties.getResolver().nicknamesFor(league));
        assertThat(split.city()).isEqualTo(city);
        assertThat(split.nickname()).isEqualTo(nickname);
    }

    @Test
    void everyConfiguredNicknameSplitsAsOneUnit() {
        for (League league : League.values()) {
            List<String> nicknames = properties.getResolver().nicknamesFor(league);
            for (String nick : nicknames) {
                CityTeamSplit split = EntityResolver.splitCityTeam("Sample City " + nick, nicknames);
                assertThat(split.city()).as(league + " " + nick).isEqualTo("Sample City");
                assertThat(split.nickname()).as(league + " " + nick).isEqualTo(nick);
            }
        }
        assertThat(properties.getResolver().nicknamesFor(League.NHL)).hasSize(4);
        assertThat(properties.getResolver().nicknamesFor(League.NFL)).hasSize(3);
    }

    @Test
    void nicknameMatchIsCaseInsensitiveAndWholeWord() {
        List<String> nicks = List.of("Red Wings");
        assertThat(EntityResolver.splitCityTeam("detroit red wings", nicks))
                .isEqualTo(new CityTeamSplit("detroit", "red wings"));
        // "Red Wings" must not match inside "Alfred"
        assertThat(EntityResolver.splitCityTeam("Alfred Wings", nicks))
                .isEqualTo(new CityTeamSplit("Alfred", "Wings"));
    }

    @Test
    void singleTokenIsCityWithEmptyNickname() {
        assertThat(EntityResolver.splitCityTeam("Utah", List.of())).isEqualTo(new CityTeamSplit("Utah", ""));
        assertThat(EntityResolver.splitCityTeam("  ", List.of())).isEqualTo(new CityTeamSplit("", ""));
    }

    @Test
    void fullNameResolutionRegistersCityAndTeam() {
        ResolutionContext ctx = ResolutionContext.empty();
        ResolvedTeam vegas = resolver.resolveByFullName(League.NHL, "Vegas Golden Knights", ctx);

        assertThat(vegas.status()).isEqualTo(ResolvedTeam.Status.RESOLVED);
        assertThat(vegas.teamId()).isEqualTo("nhl_vegas-golden-knights");
        assertThat(vegas.cityId()).isEqualTo("vegas");
        assertThat(vegas.cityName()).isEqualTo("Vegas");

        City city = ctx.newCities().get(0);
        assertThat(city.getId()).isEqualTo("vegas");
        assertThat(city.getSlug()).isEqualTo("vegas");
        assertThat(city.getCountry()).isEqualTo("USA");
        Team team = ctx.newTeams().get(0);
        assertThat(team.getTeamName()).isEqualTo("Vegas Golden Knights");
        assertThat(team.getAltNames()).isEqualTo("Golden Knights");
        assertThat(team.getCityId()).isEqualTo("vegas");
    }

    @Test
    void teamsFromTheSameCityShareOneCityRow() {
        ResolutionContext ctx = ResolutionContext.empty();
        resolver.resolveByFullName(League.NHL, "New York Rangers", ctx);
        resolver.resolveByFullName(League.NHL, "New York Islanders", ctx);
        resolver.resolveByFullName(League.NFL, "New  York Giants", ctx);

        assertThat(ctx.newCities()).extracting(City::getId).containsExactly("new-york");
        assertThat(ctx.newTeams()).extracting(Team::getId)
                .containsExactly("nhl_new-york-rangers", "nhl_new-york-islanders", "nfl_new-york-giants");
    }

    @Test
    void storedIdsAreNotQueuedAgain() {
        ResolutionContext ctx = ResolutionContext.of(List.of("toronto"), List.of("nhl_toronto-maple-leafs"));
        resolver.resolveByFullName(League.NHL, "Toronto Maple Leafs", ctx);
        assertThat(ctx.newCities()).isEmpty();
        assertThat(ctx.newTeams()).isEmpty();
    }

    @Test
    void singleWordNameIsPlaceholderAndRecordedOnce() {
        ResolutionContext ctx = ResolutionContext.empty();
        ResolvedTeam first = resolver.resolveByFullName(League.NFL, "Utah", ctx);
        resolver.resolveByFullName(League.NFL, "Utah", ctx);

        assertThat(first.isPlaceholder()).isTrue();
        assertThat(first.cityId()).isEqualTo("utah");
        assertThat(ctx.countIssues(IngestionIssue.Kind.UNRESOLVED_ENTITY)).isEqualTo(1);
    }

    @Test
    void mappedCodeUsesReferenceCityAndState() {
        TeamReferenceTable table = TeamReferenceTable.empty();
        table.put(new TeamReference("NYN", "New York", "NY", null, "NYN"));
        ResolutionContext ctx = ResolutionContext.empty();

        ResolvedTeam mets = resolver.resolveByCode(League.MLB, "NYN", table, ctx);

        assertThat(mets.status()).isEqualTo(ResolvedTeam.Status.RESOLVED);
        assertThat(mets.teamId()).isEqualTo("mlb_NYN");
        assertThat(mets.cityId()).isEqualTo("new-york-ny");
        Team team = ctx.newTeams().get(0);
        assertThat(team.getTeamName()).isEqualTo("New York NYN");
        assertThat(team.getAltNames()).isEqualTo("NYN");
        assertThat(ctx.newCities().get(0).getState()).isEqualTo("NY");
    }

    @Test
    void unmappedCodeFallsBackToPlaceholderCity() {
        ResolutionContext ctx = ResolutionContext.empty();
        ResolvedTeam unknown = resolver.resolveByCode(League.MLB, "XYZ", TeamReferenceTable.empty(), ctx);
        resolver.resolveByCode(League.MLB, "XYZ", TeamReferenceTable.empty(), ctx);

        assertThat(unknown.isPlaceholder()).isTrue();
        assertThat(unknown.teamId()).isEqualTo("mlb_XYZ");
        assertThat(unknown.cityId()).isEqualTo("xyz");
        assertThat(unknown.cityName()).isEqualTo("XYZ");
        assertThat(ctx.unresolvedTokens()).containsExactly("mlb:XYZ");
        assertThat(ctx.countIssues(IngestionIssue.Kind.UNRESOLVED_ENTITY)).isEqualTo(1);
    }

    @Test
    void rosterSeedingRegistersEveryTeamOnce() {
        TeamReferenceTable roster = TeamReferenceTable.empty();
        roster.put(new TeamReference("NYK", "New York", "", "Knicks", "1610612752"));
        roster.put(new TeamReference("BKN", "Brooklyn", "", "Nets", "1610612751"));
        ResolutionContext ctx = ResolutionContext.of(List.of(), List.of("nba_BKN"));

        int seeded = resolver.seedFromReference(League.NBA, roster, ctx);

        assertThat(seeded).isEqualTo(1);
        Team knicks = ctx.newTeams().get(0);
        assertThat(knicks.getId()).isEqualTo("nba_NYK");
        assertThat(knicks.getTeamName()).isEqualTo("New York Knicks");
        assertThat(knicks.getAltNames()).isEqualTo("1610612752");
        assertThat(knicks.getCityId()).isEqualTo("new-york");
    }
}
