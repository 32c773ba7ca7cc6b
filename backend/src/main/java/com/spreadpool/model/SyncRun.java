package com.spreadpool.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "sync_run", indexes = {
        @Index(name = "idx_sync_run_job_started", columnList = "job_name, started_at")
})
public class SyncRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", length = 32, nullable = false)
    private String jobName;

    @Column(name = "season_year")
    private Integer seasonYear;

    @Column(name = "week_number")
    private Integer weekNumber;

    @Column(name = "changed")
    private Integer changed = 0;

    @Column(name = "failed_records")
    private Integer failedRecords = 0;

    @Column(length = 32)
    private String status = "IN_PROGRESS";

    @Column(name = "error_reason", length = 32)
    private String errorReason;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }
    public Integer getSeasonYear() { return seasonYear; }
    public void setSeasonYear(Integer seasonYear) { this.seasonYear = seasonYear; }
    public Integer getWeekNumber() { return weekNumber; }
    public void setWeekNumber(Integer weekNumber) { this.weekNumber = weekNumber; }
    public Integer getChanged() { return changed; }
    public void setChanged(Integer changed) { this.changed = changed; }
    public Integer getFailedRecords() { return failedRecords; }
    public void setFailedRecords(Integer failedRecords) { this.failedRecords = failedRecords; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getErrorReason() { return errorReason; }
    public void setErrorReason(String errorReason) { this.errorReason = errorReason; }
    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
