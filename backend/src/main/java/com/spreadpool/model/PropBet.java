package com.spreadpool.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Table(name = "prop_bets", indexes = {
        @Index(name = "idx_prop_bets_week", columnList = "week_id")
})
public class PropBet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "week_id", nullable = false, foreignKey = @ForeignKey(name = "fk_prop_bet_week"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Week week;

    @Column(name = "game_label", length = 32)
    private String gameLabel; // e.g. AFC, NFC, SB

    @Column(name = "description", nullable = false, length = 255)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "domain", nullable = false, length = 16)
    private PropDomain domain;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", length = 8)
    private PropOutcome result;

    @Column(name = "graded_at")
    private Instant gradedAt;

    public PropBet() {}

    public PropBet(Week week, String gameLabel, String description, PropDomain domain) {
        this.week = week;
        this.gameLabel = gameLabel;
        this.description = description;
        this.domain = domain;
    }

    public boolean isGraded() {
        return result != null;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Week getWeek() { return week; }
    public void setWeek(Week week) { this.week = week; }

    public String getGameLabel() { return gameLabel; }
    public void setGameLabel(String gameLabel) { this.gameLabel = gameLabel; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public PropDomain getDomain() { return domain; }
    public void setDomain(PropDomain domain) { this.domain = domain; }

    public PropOutcome getResult() { return result; }
    public void setResult(PropOutcome result) { this.result = result; }

    public Instant getGradedAt() { return gradedAt; }
    public void setGradedAt(Instant gradedAt) { this.gradedAt = gradedAt; }
}
