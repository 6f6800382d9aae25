package com.hometown.happiness.dto;

import java.time.Instant;

public class IngestionSummaryDTO {
    private Long runId;
    private String source;
    private String status;
    private Integer rowsTotal;
    private Integer rowsAccepted;
    private Integer rowsSkipped;
    private Integer citiesAdded;
    private Integer teamsAdded;
    private Integer gamesAdded;
    private Integer gamesDuplicate;
    private Integer unresolvedEntities;
    private Integer incompleteGames;
    private Instant startedAt;
    private Instant finishedAt;

    public IngestionSummaryDTO() {}

    public Long getRunId() { return runId; }
    public void setRunId(Long runId) { this.runId = runId; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getRowsAccepted() { return rowsAccepted; }
    public void setRowsAccepted(Integer rowsAccepted) { this.rowsAccepted = rowsAccepted; }
    public Integer getRowsSkipped() { return rowsSkipped; }
    public void setRowsSkipped(Integer rowsSkipped) { this.rowsSkipped = rowsSkipped; }
    public Integer getCitiesAdded() { return citiesAdded; }
    public void setCitiesAdded(Integer citiesAdded) { this.citiesAdded = citiesAdded; }
    public Integer getTeamsAdded() { return teamsAdded; }
    public void setTeamsAdded(Integer teamsAdded) { this.teamsAdded = teamsAdded; }
    public Integer getGamesAdded() { return gamesAdded; }
    public void setGamesAdded(Integer gamesAdded) { this.gamesAdded = gamesAdded; }
    public Integer getGamesDuplicate() { return gamesDuplicate; }
    public void setGamesDuplicate(Integer gamesDuplicate) { this.gamesDuplicate = gamesDuplicate; }
    public Integer getUnresolvedEntities() { return unresolvedEntities; }
    public void setUnresolvedEntities(Integer unresolvedEntities) { this.unresolvedEntities = unresolvedEntities; }
    public Integer getIncompleteGames() { return incompleteGames; }
    public void setIncompleteGames(Integer incompleteGames) { this.incompleteGames = incompleteGames; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
