package com.spreadpool.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "weeks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_week_season_number", columnNames = {"season_year", "week_number"})
}, indexes = {
        @Index(name = "idx_weeks_season", columnList = "season_year")
})
public class Week {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_year", nullable = false)
    private Integer seasonYear;

    @Column(name = "week_number", nullable = false)
    private Integer weekNumber;

    @Column(name = "picks_deadline", nullable = false)
    private Instant picksDeadline;

    @Column(name = "playoff", nullable = false)
    private boolean playoff;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 16)
    private WeekPhase phase = WeekPhase.IMPORTED;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Week() {}

    public Week(Integer seasonYear, Integer weekNumber, Instant picksDeadline) {
        this.seasonYear = seasonYear;
        this.weekNumber = weekNumber;
        this.picksDeadline = picksDeadline;
        this.playoff = weekNumber != null && PlayoffRound.isPlayoffWeek(weekNumber);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public String label() {
        return PlayoffRound.forWeek(weekNumber)
                .map(PlayoffRound::getLabel)
                .orElse("Week " + weekNumber) + " " + seasonYear;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Integer getSeasonYear() { return seasonYear; }
    public void setSeasonYear(Integer seasonYear) { this.seasonYear = seasonYear; }

    public Integer getWeekNumber() { return weekNumber; }
    public void setWeekNumber(Integer weekNumber) { this.weekNumber = weekNumber; }

    public Instant getPicksDeadline() { return picksDeadline; }
    public void setPicksDeadline(Instant picksDeadline) { this.picksDeadline = picksDeadline; }

    public boolean isPlayoff() { return playoff; }
    public void setPlayoff(boolean playoff) { this.playoff = playoff; }

    public WeekPhase getPhase() { return phase; }
    public void setPhase(WeekPhase phase) { this.phase = phase; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
