package com.spreadpool.controller;

import com.spreadpool.dto.JobResult;
import com.spreadpool.model.SyncIssue;
import com.spreadpool.model.SyncRun;
import com.spreadpool.repository.SyncIssueRepository;
import com.spreadpool.repository.SyncRunRepository;
import com.spreadpool.service.JobName;
import com.spreadpool.service.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/admin/jobs")
@CrossOrigin(origins = "*")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobRunner jobRunner;
    private final SyncRunRepository syncRunRepository;
    private final SyncIssueRepository syncIssueRepository;

    public JobController(JobRunner jobRunner, SyncRunRepository syncRunRepository, SyncIssueRepository syncIssueRepository) {
        this.jobRunner = jobRunner;
        this.syncRunRepository = syncRunRepository;
        this.syncIssueRepository = syncIssueRepository;
    }

    @PostMapping("/{job}")
    public JobResult run(@PathVariable("job") String job) {
        JobName name = JobName.parse(job)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + job));
        log.info("Manual run of {}", name.getKey());
        return jobRunner.run(name);
    }

    @GetMapping("/runs")
    public List<SyncRun> recentRuns() {
        return syncRunRepository.findTop20ByOrderByStartedAtDesc();
    }

    @GetMapping("/issues")
    public List<SyncIssue> recentIssues() {
        return syncIssueRepository.findTop50ByOrderByCreatedAtDesc();
    }
}
