package com.hometown.happiness.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;
import java.time.LocalDate;

@Entity
@Table(name = "teams", indexes = {
        @Index(name = "idx_team_city", columnList = "city_id"),
        @Index(name = "idx_team_league", columnList = "league")
})
public class Team implements Persistable<String> {

    @Id
    @Column(name = "team_id", length = 160)
    private String id;

    @Column(name = "team_name", nullable = false)
    private String teamName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private League league;

    @Column(name = "city_id", nullable = false, length = 128)
    private String cityId;

    @Column(name = "city_name")
    private String cityName;

    // Relocation history is not tracked; both dates stay empty for now.
    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "alt_names")
    private String altNames;

    // ids are assigned up front; cleared once the row is stored or loaded
    @Transient
    private boolean fresh = true;

    public Team() {}

    public Team(String id, String teamName, League league, String cityId, String cityName, String altNames) {
        this.id = id;
        this.teamName = teamName;
        this.league = league;
        this.cityId = cityId;
        this.cityName = cityName;
        this.altNames = altNames;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public League getLeague() { return league; }
    public void setLeague(League league) { this.league = league; }

    public String getCityId() { return cityId; }
    public void setCityId(String cityId) { this.cityId = cityId; }

    public String getCityName() { return cityName; }
    public void setCityName(String cityName) { this.cityName = cityName; }

    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }

    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }

    public String getAltNames() { return altNames; }
    public void setAltNames(String altNames) { this.altNames = altNames; }

    @Override
    public boolean isNew() { return fresh; }

    @PostLoad
    @PostPersist
    void markStored() { this.fresh = false; }
}
