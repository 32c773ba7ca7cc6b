package com.spreadpool.model;

import jakarta.persistence.*;
import java.time.Instant;

/** A single provider record that could not be written during a job run. */
@Entity
@Table(name = "sync_issue")
public class SyncIssue {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", length = 32, nullable = false)
    private String jobName;

    @Column(name = "external_id", length = 32)
    private String externalId;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_at")
    private Instant createdAt;

    public SyncIssue() {}

    public SyncIssue(String jobName, String externalId, String reason, Instant createdAt) {
        this.jobName = jobName;
        this.externalId = externalId;
        this.reason = reason;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
