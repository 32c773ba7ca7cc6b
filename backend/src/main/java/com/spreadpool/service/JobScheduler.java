package com.spreadpool.service;

import com.spreadpool.dto.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Cron triggers for the sync jobs; all real work and guarding happens in {@link JobRunner}. */
@Component
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobRunner jobRunner;

    public JobScheduler(JobRunner jobRunner) {
        this.jobRunner = jobRunner;
    }

    // Daily, early morning Pacific
    @Scheduled(cron = "${pool.cron.import-week:0 0 6 * * *}", zone = "${pool.time.app-zone:America/Los_Angeles}")
    public void importUpcomingWeek() {
        report(jobRunner.run(JobName.IMPORT_UPCOMING_WEEK));
    }

    // Every 5 minutes
    @Scheduled(cron = "${pool.cron.sync-scores:0 */5 * * * *}", zone = "${pool.time.app-zone:America/Los_Angeles}")
    public void syncScores() {
        report(jobRunner.run(JobName.SYNC_SCORES_ACTIVE_WEEK));
    }

    // Hourly; the job itself skips every day but the import day
    @Scheduled(cron = "${pool.cron.import-odds:0 0 * * * *}", zone = "${pool.time.app-zone:America/Los_Angeles}")
    public void importOdds() {
        report(jobRunner.run(JobName.IMPORT_ODDS_UPCOMING));
    }

    @Scheduled(cron = "${pool.cron.grade:0 */10 * * * *}", zone = "${pool.time.app-zone:America/Los_Angeles}")
    public void grade() {
        report(jobRunner.run(JobName.GRADE_COMPLETED_WEEKS));
    }

    private void report(JobResult result) {
        if (!result.isOk()) {
            log.warn("Scheduled {} failed: {} ({})", result.getJob(), result.getErrorReason(), result.getMessage());
        } else if (result.getChanged() > 0) {
            log.info("Scheduled {} changed {} rows.", result.getJob(), result.getChanged());
        }
    }
}
