package com.hometown.happiness.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.LocalDate;

@Entity
@Table(name = "games", indexes = {
        @Index(name = "idx_games_date", columnList = "game_date"),
        @Index(name = "idx_games_league_date", columnList = "league, game_date")
})
public class Game implements Persistable<String> {

    @Id
    @Column(name = "game_id", length = 255)
    private String id;

    @Column(name = "game_date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private League league;

    @Enumerated(EnumType.STRING)
    @Column(name = "season_type", nullable = false, length = 16)
    private SeasonType seasonType = SeasonType.REGULAR;

    @Column(name = "home_team_id", nullable = false, length = 160)
    private String homeTeamId;

    @Column(name = "away_team_id", nullable = false, length = 160)
    private String awayTeamId;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    // empty when the game is unplayed, tied or the winner is unknown
    @Column(name = "winning_team_id", length = 160)
    private String winningTeamId;

    // ids are assigned up front; cleared once the row is stored or loaded
    @Transient
    private boolean fresh = true;

    public Game() {}

    public Game(String id, LocalDate date, League league, SeasonType seasonType,
                String homeTeamId, String awayTeamId, Integer homeScore, Integer awayScore, String winningTeamId) {
        this.id = id;
        this.date = date;
        this.league = league;
        this.seasonType = seasonType;
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
        this.homeScore = homeScore;
        this.awayScore = awayScore;
        this.winningTeamId = winningTeamId == null ? "" : winningTeamId;
    }

    public boolean hasWinner() {
        return winningTeamId != null && !winningTeamId.isBlank();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }

    public SeasonType getSeasonType() { return seasonType; }
    public void setSeasonType(SeasonType seasonType) { this.seasonType = seasonType; }

    public String getHomeTeamId() { return homeTeamId; }
    public void setHomeTeamId(String homeTeamId) { this.homeTeamId = homeTeamId; }

    public String getAwayTeamId() { return awayTeamId; }
    public void setAwayTeamId(String awayTeamId) { this.awayTeamId = awayTeamId; }

    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }

    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }

    public String getWinningTeamId() { return winningTeamId; }
    public void setWinningTeamId(String winningTeamId) { this.winningTeamId = winningTeamId; }

    @Override
    public boolean isNew() { return fresh; }

    @PostLoad
    @PostPersist
    void markStored() { this.fresh = false; }
}
