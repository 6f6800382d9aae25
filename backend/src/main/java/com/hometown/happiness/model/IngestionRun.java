package com.hometown.happiness.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "ingestion_run", indexes = {
        @Index(name = "idx_ingestion_run_file_hash", columnList = "file_hash")
})
public class IngestionRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 16, nullable = false)
    private String source; // league code, or "snapshot" for daily appends

    @Column(name = "source_file", length = 1000)
    private String sourceFile;

    @Column(name = "file_hash", length = 128)
    private String fileHash;

    @Column(name = "rows_total")
    private Integer rowsTotal = 0;

    @Column(name = "rows_accepted")
    private Integer rowsAccepted = 0;

    @Column(name = "rows_skipped")
    private Integer rowsSkipped = 0;

    @Column(name = "cities_added")
    private Integer citiesAdded = 0;

    @Column(name = "teams_added")
    private Integer teamsAdded = 0;

    @Column(name = "games_added")
    private Integer gamesAdded = 0;

    @Column(name = "games_duplicate")
    private Integer gamesDuplicate = 0;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status = "IN_PROGRESS";

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getSourceFile() { return sourceFile; }
    public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }
    public String getFileHash() { return fileHash; }
    public void setFileHash(String fileHash) { this.fileHash = fileHash; }
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
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
