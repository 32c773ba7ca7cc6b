package com.spreadpool.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * Ledger row proving that a reminder of one kind already went out for a
 * (participant, week) or (participant, game) pair.
 */
@Entity
@Table(name = "reminders", uniqueConstraints = {
        @UniqueConstraint(name = "uk_reminders_participant_kind_target", columnNames = {"participant_id", "kind", "target_key"})
})
public class Reminder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "participant_id", nullable = false, foreignKey = @ForeignKey(name = "fk_reminder_participant"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Participant participant;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private ReminderKind kind;

    // "week:<id>" or "game:<id>"
    @Column(name = "target_key", nullable = false, length = 48)
    private String targetKey;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    public Reminder() {}

    public Reminder(Participant participant, ReminderKind kind, String targetKey, Instant sentAt) {
        this.participant = participant;
        this.kind = kind;
        this.targetKey = targetKey;
        this.sentAt = sentAt;
    }

    public static String weekKey(Long weekId) {
        return "week:" + weekId;
    }

    public static String gameKey(Long gameId) {
        return "game:" + gameId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Participant getParticipant() { return participant; }
    public void setParticipant(Participant participant) { this.participant = participant; }

    public ReminderKind getKind() { return kind; }
    public void setKind(ReminderKind kind) { this.kind = kind; }

    public String getTargetKey() { return targetKey; }
    public void setTargetKey(String targetKey) { this.targetKey = targetKey; }

    public Instant getSentAt() { return sentAt; }
    public void setSentAt(Instant sentAt) { this.sentAt = sentAt; }
}
