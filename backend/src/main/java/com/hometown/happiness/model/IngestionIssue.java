package com.hometown.happiness.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A per-row content problem that was degraded rather than failed: a placeholder identity,
 * a game without a usable result, or a row that could not be read at all.
 */
@Entity
@Table(name = "ingestion_issue")
public class IngestionIssue {

    public enum Kind { UNRESOLVED_ENTITY, INCOMPLETE_GAME, SKIPPED_ROW }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", foreignKey = @ForeignKey(name = "fk_ingestion_issue_run"))
    private IngestionRun run;

    @Column(name = "row_num")
    private Integer rowNumber;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private Kind kind;

    @Column(length = 2000)
    private String payload;

    @Column(length = 1000)
    private String reason;

    @Column(name = "created_at")
    private Instant createdAt;

    public IngestionIssue() {}

    public IngestionIssue(Integer rowNumber, Kind kind, String payload, String reason) {
        this.rowNumber = rowNumber;
        this.kind = kind;
        this.payload = payload;
        this.reason = reason;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public IngestionRun getRun() { return run; }
    public void setRun(IngestionRun run) { this.run = run; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
