package com.spreadpool.repository;

import com.spreadpool.model.SyncIssue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SyncIssueRepository extends JpaRepository<SyncIssue, Long> {
    List<SyncIssue> findTop50ByOrderByCreatedAtDesc();
}
