package com.spreadpool.controller;

import com.spreadpool.anomaly.Anomaly;
import com.spreadpool.anomaly.AnomalyLog;
import com.spreadpool.dto.PickRequest;
import com.spreadpool.dto.PlaceholderResolution;
import com.spreadpool.dto.PropAutoGradeReport;
import com.spreadpool.dto.PropImportResult;
import com.spreadpool.model.*;
import com.spreadpool.service.AdminService;
import com.spreadpool.service.DataIntegrityException;
import com.spreadpool.service.PropAutoGradingService;
import com.spreadpool.service.PropImportService;
import com.spreadpool.service.ReminderService;
import com.spreadpool.service.WeekCalendar;
import com.spreadpool.provider.WeekSelector;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminController {

    private final AdminService adminService;
    private final PropImportService propImportService;
    private final PropAutoGradingService propAutoGradingService;
    private final ReminderService reminderService;
    private final WeekCalendar weekCalendar;
    private final AnomalyLog anomalyLog;

    public AdminController(AdminService adminService,
                           PropImportService propImportService,
                           PropAutoGradingService propAutoGradingService,
                           ReminderService reminderService,
                           WeekCalendar weekCalendar,
                           AnomalyLog anomalyLog) {
        this.adminService = adminService;
        this.propImportService = propImportService;
        this.propAutoGradingService = propAutoGradingService;
        this.reminderService = reminderService;
        this.weekCalendar = weekCalendar;
        this.anomalyLog = anomalyLog;
    }

    @PostMapping(value = "/weeks/{season}/{week}/props", consumes = {"text/csv", "text/plain"})
    public PropImportResult importProps(@PathVariable int season, @PathVariable int week, @RequestBody String csv) {
        try {
            return propImportService.importCsv(season, week, csv);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    /** Body maps prop id to OVER/UNDER/YES/NO; props left out stay ungraded. */
    @PostMapping("/props/grade")
    public Map<String, Object> gradeProps(@RequestBody Map<Long, String> results,
                                          @RequestParam(value = "actor", defaultValue = "admin") String actor) {
        Map<Long, PropOutcome> parsed = new LinkedHashMap<>();
        for (Map.Entry<Long, String> e : results.entrySet()) {
            PropOutcome outcome = PropOutcome.parse(e.getValue())
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown result for prop " + e.getKey() + ": " + e.getValue()));
            parsed.put(e.getKey(), outcome);
        }
        try {
            int graded = adminService.gradeProps(parsed, actor);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("props", parsed.size());
            resp.put("picksGraded", graded);
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    /** Grades open props from the provider box scores; without {@code commit=true} nothing is written. */
    @PostMapping("/weeks/{season}/{week}/props/auto-grade")
    public PropAutoGradeReport autoGradeProps(@PathVariable int season, @PathVariable int week,
                                              @RequestParam(value = "commit", defaultValue = "false") boolean commit,
                                              @RequestParam(value = "actor", defaultValue = "admin") String actor) {
        try {
            return propAutoGradingService.autoGrade(season, week, commit, actor);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    @PostMapping("/games/{gameId}/resolve")
    public Map<String, Object> resolvePlaceholder(@PathVariable Long gameId,
                                                  @RequestBody PlaceholderResolution body,
                                                  @RequestParam(value = "actor", defaultValue = "admin") String actor) {
        try {
            Game g = adminService.resolvePlaceholder(gameId, body.getHomeTeam(), body.getAwayTeam(),
                    body.getFavoriteTeam(), body.getSpreadPts(), actor);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("gameId", g.getId());
            resp.put("matchup", g.matchup());
            resp.put("favoriteTeam", g.getFavoriteTeam());
            resp.put("spreadPts", g.getSpreadPts());
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (DataIntegrityException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }

    @PutMapping("/weeks/{season}/{week}/deadline")
    public Map<String, Object> adjustDeadline(@PathVariable int season, @PathVariable int week,
                                              @RequestParam("deadline") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant deadline,
                                              @RequestParam(value = "actor", defaultValue = "admin") String actor) {
        try {
            Week w = adminService.adjustDeadline(season, week, deadline, actor);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("week", w.label());
            resp.put("picksDeadline", w.getPicksDeadline().toString());
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    @PostMapping("/picks/override")
    public Map<String, Object> overridePick(@RequestBody PickRequest req,
                                            @RequestParam(value = "actor", defaultValue = "admin") String actor) {
        try {
            Pick p = adminService.overridePick(req.getParticipantId(), req.getGameId(), req.getTeam(), actor);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("pickId", p.getId());
            resp.put("selectedTeam", p.getSelectedTeam());
            resp.put("overridden", p.isOverridden());
            return resp;
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/weeks/{season}/{week}/missing-picks")
    public List<String> missingPicks(@PathVariable int season, @PathVariable int week) {
        Week w;
        try {
            w = weekCalendar.find(new WeekSelector(season, week))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown week " + season + "-W" + week));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
        return reminderService.participantsMissingPicks(w.getId()).stream()
                .map(Participant::getExternalId)
                .collect(Collectors.toList());
    }

    @GetMapping("/anomalies")
    public List<Anomaly> anomalies(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        return anomalyLog.recent(Math.max(1, Math.min(limit, 200)));
    }
}
