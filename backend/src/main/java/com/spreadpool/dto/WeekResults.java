package com.spreadpool.dto;

import java.util.ArrayList;
import java.util.List;

public class WeekResults {
    private int seasonYear;
    private int weekNumber;
    private String label;
    private boolean complete;
    private List<ScoreboardRow> rows = new ArrayList<>();
    private List<String> winners = new ArrayList<>(); // participant ids sharing the top win count

    public WeekResults() {}

    public WeekResults(int seasonYear, int weekNumber, String label, boolean complete, List<ScoreboardRow> rows, List<String> winners) {
        this.seasonYear = seasonYear;
        this.weekNumber = weekNumber;
        this.label = label;
        this.complete = complete;
        this.rows = rows;
        this.winners = winners;
    }

    public int getSeasonYear() { return seasonYear; }
    public int getWeekNumber() { return weekNumber; }
    public String getLabel() { return label; }
    public boolean isComplete() { return complete; }
    public List<ScoreboardRow> getRows() { return rows; }
    public List<String> getWinners() { return winners; }
}
