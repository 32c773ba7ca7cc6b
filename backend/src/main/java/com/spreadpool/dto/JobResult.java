package com.spreadpool.dto;

/**
 * Result of one orchestrator job run. {@code ok=false} always carries an error reason;
 * skipped runs (offseason, off-day, already running) are ok with zero changes and a reason.
 */
public class JobResult {
    private String job;
    private boolean ok;
    private int changed;
    private int failedRecords;
    private JobErrorReason errorReason;
    private String message;
    private Integer seasonYear;
    private Integer weekNumber;

    public static JobResult ok(String job, int changed) {
        JobResult r = new JobResult();
        r.job = job;
        r.ok = true;
        r.changed = changed;
        return r;
    }

    public static JobResult skipped(String job, JobErrorReason reason, String message) {
        JobResult r = ok(job, 0);
        r.errorReason = reason;
        r.message = message;
        return r;
    }

    public static JobResult failed(String job, int changed, JobErrorReason reason, String message) {
        JobResult r = new JobResult();
        r.job = job;
        r.ok = false;
        r.changed = changed;
        r.errorReason = reason;
        r.message = message;
        return r;
    }

    public JobResult forWeek(Integer seasonYear, Integer weekNumber) {
        this.seasonYear = seasonYear;
        this.weekNumber = weekNumber;
        return this;
    }

    public JobResult withFailedRecords(int failedRecords) {
        this.failedRecords = failedRecords;
        return this;
    }

    public String getJob() { return job; }
    public boolean isOk() { return ok; }
    public int getChanged() { return changed; }
    public int getFailedRecords() { return failedRecords; }
    public JobErrorReason getErrorReason() { return errorReason; }
    public String getMessage() { return message; }
    public Integer getSeasonYear() { return seasonYear; }
    public Integer getWeekNumber() { return weekNumber; }

    @Override
    public String toString() {
        return job + "{ok=" + ok + ", changed=" + changed + (errorReason != null ? ", reason=" + errorReason : "") + "}";
    }
}
