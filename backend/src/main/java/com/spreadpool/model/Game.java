package com.spreadpool.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "games", indexes = {
        @Index(name = "idx_games_week_kickoff", columnList = "week_id, kickoff"),
        @Index(name = "idx_games_status", columnList = "status")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_games_external_id", columnNames = {"external_id"})
})
public class Game {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "week_id", nullable = false, foreignKey = @ForeignKey(name = "fk_game_week"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Week week;

    @Column(name = "external_id", nullable = false, length = 32)
    private String externalId;

    @Column(name = "home_team", nullable = false, length = 64)
    private String homeTeam;

    @Column(name = "away_team", nullable = false, length = 64)
    private String awayTeam;

    @Column(name = "kickoff", nullable = false)
    private Instant kickoff;

    @Column(name = "favorite_team", length = 64)
    private String favoriteTeam;

    // magnitude the favorite lays; null until odds are imported
    @Column(name = "spread_pts", precision = 5, scale = 1)
    private BigDecimal spreadPts;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GameStatus status = GameStatus.SCHEDULED;

    @Column(name = "unresolved_team", nullable = false)
    private boolean unresolvedTeam;

    @Column(name = "graded_at")
    private Instant gradedAt;

    public Game() {}

    public Game(Week week, String externalId, String homeTeam, String awayTeam, Instant kickoff) {
        this.week = week;
        this.externalId = externalId;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.kickoff = kickoff;
    }

    public boolean hasScores() {
        return homeScore != null && awayScore != null;
    }

    public boolean involves(String team) {
        return team != null && (team.equalsIgnoreCase(homeTeam) || team.equalsIgnoreCase(awayTeam));
    }

    public String opponentOf(String team) {
        if (team == null) return null;
        if (team.equalsIgnoreCase(homeTeam)) return awayTeam;
        if (team.equalsIgnoreCase(awayTeam)) return homeTeam;
        return null;
    }

    public Integer scoreOf(String team) {
        if (team == null) return null;
        if (team.equalsIgnoreCase(homeTeam)) return homeScore;
        if (team.equalsIgnoreCase(awayTeam)) return awayScore;
        return null;
    }

    public String matchup() {
        return awayTeam + " @ " + homeTeam;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Week getWeek() { return week; }
    public void setWeek(Week week) { this.week = week; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public String getHomeTeam() { return homeTeam; }
    public void setHomeTeam(String homeTeam) { this.homeTeam = homeTeam; }

    public String getAwayTeam() { return awayTeam; }
    public void setAwayTeam(String awayTeam) { this.awayTeam = awayTeam; }

    public Instant getKickoff() { return kickoff; }
    public void setKickoff(Instant kickoff) { this.kickoff = kickoff; }

    public String getFavoriteTeam() { return favoriteTeam; }
    public void setFavoriteTeam(String favoriteTeam) { this.favoriteTeam = favoriteTeam; }

    public BigDecimal getSpreadPts() { return spreadPts; }
    public void setSpreadPts(BigDecimal spreadPts) { this.spreadPts = spreadPts; }

    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }

    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }

    public GameStatus getStatus() { return status; }
    public void setStatus(GameStatus status) { this.status = status; }

    public boolean isUnresolvedTeam() { return unresolvedTeam; }
    public void setUnresolvedTeam(boolean unresolvedTeam) { this.unresolvedTeam = unresolvedTeam; }

    public Instant getGradedAt() { return gradedAt; }
    public void setGradedAt(Instant gradedAt) { this.gradedAt = gradedAt; }
}
