package com.spreadpool.service;

import com.spreadpool.config.PoolSettings;
import com.spreadpool.dto.JobErrorReason;
import com.spreadpool.dto.JobResult;
import com.spreadpool.model.SyncRun;
import com.spreadpool.repository.SyncRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for every job run, scheduled or manual. Checks the offseason flag before anything
 * else, refuses to start a job while its previous run is still going, turns exceptions into
 * failed results and records each run in the sync ledger.
 */
@Service
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final SyncOrchestrator orchestrator;
    private final SyncRunRepository syncRunRepository;
    private final ClockService clockService;
    private final PoolSettings settings;
    private final Map<JobName, AtomicBoolean> running = new EnumMap<>(JobName.class);

    public JobRunner(SyncOrchestrator orchestrator,
                     SyncRunRepository syncRunRepository,
                     ClockService clockService,
                     PoolSettings settings) {
        this.orchestrator = orchestrator;
        this.syncRunRepository = syncRunRepository;
        this.clockService = clockService;
        this.settings = settings;
        for (JobName j : JobName.values()) {
            running.put(j, new AtomicBoolean(false));
        }
    }

    public JobResult run(JobName job) {
        if (settings.isOffseason()) {
            log.debug("Offseason: {} skipped", job.getKey());
            return JobResult.skipped(job.getKey(), JobErrorReason.OFFSEASON, "Offseason mode is on");
        }
        AtomicBoolean flag = running.get(job);
        if (!flag.compareAndSet(false, true)) {
            log.info("{} still running; skipping this run", job.getKey());
            return JobResult.skipped(job.getKey(), JobErrorReason.ALREADY_RUNNING, "Previous run still in flight");
        }
        SyncRun run = new SyncRun();
        run.setJobName(job.getKey());
        run.setStartedAt(clockService.nowUtc());
        JobResult result;
        try {
            result = dispatch(job);
        } catch (JobCancelledException e) {
            log.warn("{} cancelled: {}", job.getKey(), e.getMessage());
            result = JobResult.failed(job.getKey(), 0, JobErrorReason.CANCELLED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", job.getKey(), e);
            result = JobResult.failed(job.getKey(), 0, JobErrorReason.INTERNAL, e.getMessage());
        } finally {
            flag.set(false);
        }
        record(run, result);
        return result;
    }

    public boolean isRunning(JobName job) {
        return running.get(job).get();
    }

    private JobResult dispatch(JobName job) {
        switch (job) {
            case IMPORT_UPCOMING_WEEK: return orchestrator.importUpcomingWeek();
            case SYNC_SCORES_ACTIVE_WEEK: return orchestrator.syncScoresActiveWeek();
            case IMPORT_ODDS_UPCOMING: return orchestrator.importOddsUpcoming();
            case GRADE_COMPLETED_WEEKS: return orchestrator.gradeCompletedWeeks();
            default: throw new IllegalArgumentException("Unknown job " + job);
        }
    }

    private void record(SyncRun run, JobResult result) {
        try {
            run.setSeasonYear(result.getSeasonYear());
            run.setWeekNumber(result.getWeekNumber());
            run.setChanged(result.getChanged());
            run.setFailedRecords(result.getFailedRecords());
            run.setStatus(result.isOk() ? "COMPLETED" : "FAILED");
            run.setErrorReason(result.getErrorReason() != null ? result.getErrorReason().name() : null);
            run.setDetail(result.getMessage());
            run.setFinishedAt(clockService.nowUtc());
            syncRunRepository.save(run);
        } catch (RuntimeException e) {
            log.warn("Could not record sync run for {}: {}", run.getJobName(), e.getMessage());
        }
    }
}
