package com.spreadpool.controller;

import com.spreadpool.dto.ScoreboardRow;
import com.spreadpool.dto.WeekResults;
import com.spreadpool.service.ScoreboardService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/scoreboard")
@CrossOrigin(origins = "*")
public class ScoreboardController {

    private final ScoreboardService scoreboardService;

    public ScoreboardController(ScoreboardService scoreboardService) {
        this.scoreboardService = scoreboardService;
    }

    @GetMapping("/{season}")
    public List<ScoreboardRow> season(@PathVariable int season) {
        return scoreboardService.getSeasonScoreboard(season);
    }

    @GetMapping("/{season}/weeks/{week}")
    public WeekResults week(@PathVariable int season, @PathVariable int week) {
        try {
            return scoreboardService.getWeekResults(season, week);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }
}
