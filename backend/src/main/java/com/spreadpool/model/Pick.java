package com.spreadpool.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Table(name = "picks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_picks_participant_game", columnNames = {"participant_id", "game_id"})
}, indexes = {
        @Index(name = "idx_picks_game", columnList = "game_id")
})
public class Pick {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "participant_id", nullable = false, foreignKey = @ForeignKey(name = "fk_pick_participant"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Participant participant;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false, foreignKey = @ForeignKey(name = "fk_pick_game"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Game game;

    @Column(name = "selected_team", nullable = false, length = 64)
    private String selectedTeam;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", length = 16)
    private AtsOutcome result;

    @Column(name = "overridden", nullable = false)
    private boolean overridden;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Pick() {}

    public Pick(Participant participant, Game game, String selectedTeam, Instant createdAt) {
        this.participant = participant;
        this.game = game;
        this.selectedTeam = selectedTeam;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Participant getParticipant() { return participant; }
    public void setParticipant(Participant participant) { this.participant = participant; }

    public Game getGame() { return game; }
    public void setGame(Game game) { this.game = game; }

    public String getSelectedTeam() { return selectedTeam; }
    public void setSelectedTeam(String selectedTeam) { this.selectedTeam = selectedTeam; }

    public AtsOutcome getResult() { return result; }
    public void setResult(AtsOutcome result) { this.result = result; }

    public boolean isOverridden() { return overridden; }
    public void setOverridden(boolean overridden) { this.overridden = overridden; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
