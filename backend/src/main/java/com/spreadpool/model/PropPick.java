package com.spreadpool.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Table(name = "prop_picks", uniqueConstraints = {
        @UniqueConstraint(name = "uk_prop_picks_participant_prop", columnNames = {"participant_id", "prop_bet_id"})
})
public class PropPick {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "participant_id", nullable = false, foreignKey = @ForeignKey(name = "fk_prop_pick_participant"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Participant participant;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "prop_bet_id", nullable = false, foreignKey = @ForeignKey(name = "fk_prop_pick_prop_bet"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private PropBet propBet;

    @Enumerated(EnumType.STRING)
    @Column(name = "selection", nullable = false, length = 8)
    private PropOutcome selection;

    @Enumerated(EnumType.STRING)
    @Column(name = "grade", length = 16)
    private PropGrade grade;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public PropPick() {}

    public PropPick(Participant participant, PropBet propBet, PropOutcome selection, Instant createdAt) {
        this.participant = participant;
        this.propBet = propBet;
        this.selection = selection;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Participant getParticipant() { return participant; }
    public void setParticipant(Participant participant) { this.participant = participant; }

    public PropBet getPropBet() { return propBet; }
    public void setPropBet(PropBet propBet) { this.propBet = propBet; }

    public PropOutcome getSelection() { return selection; }
    public void setSelection(PropOutcome selection) { this.selection = selection; }

    public PropGrade getGrade() { return grade; }
    public void setGrade(PropGrade grade) { this.grade = grade; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
