package com.hometown.happiness.repository;

import com.hometown.happiness.model.IngestionIssue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IngestionIssueRepository extends JpaRepository<IngestionIssue, Long> {
    List<IngestionIssue> findByRunId(Long runId);

    List<IngestionIssue> findByRunIdAndKind(Long runId, IngestionIssue.Kind kind);
}
