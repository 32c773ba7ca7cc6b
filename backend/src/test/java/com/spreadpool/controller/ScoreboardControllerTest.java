package com.spreadpool.controller;

import com.spreadpool.dto.ScoreboardRow;
import com.spreadpool.dto.WeekResults;
import com.spreadpool.service.ScoreboardService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ScoreboardController.class)
@ActiveProfiles("test")
class ScoreboardControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private ScoreboardService scoreboardService;

    @Test
    void seasonStandings() throws Exception {
        ScoreboardRow bob = new ScoreboardRow("bob", "Bob");
        bob.addWin();
        bob.addWin();
        given(scoreboardService.getSeasonScoreboard(2025)).willReturn(List.of(bob));

        mockMvc.perform(get("/api/scoreboard/2025").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].participantId").value("bob"))
                .andExpect(jsonPath("$[0].wins").value(2));
    }

    @Test
    void weekResultsAndMissingWeek() throws Exception {
        given(scoreboardService.getWeekResults(2025, 1))
                .willReturn(new WeekResults(2025, 1, "Week 1 2025", true, List.of(), List.of("alice", "bob")));
        given(scoreboardService.getWeekResults(2025, 9)).willThrow(new IllegalArgumentException("Unknown week 2025-W9"));

        mockMvc.perform(get("/api/scoreboard/2025/weeks/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.complete").value(true))
                .andExpect(jsonPath("$.winners[1]").value("bob"));
        mockMvc.perform(get("/api/scoreboard/2025/weeks/9"))
                .andExpect(status().isNotFound());
    }
}
