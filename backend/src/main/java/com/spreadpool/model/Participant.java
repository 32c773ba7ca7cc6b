package com.spreadpool.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "participants", uniqueConstraints = {
        @UniqueConstraint(name = "uk_participants_external_id", columnNames = {"external_id"})
})
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // chat/account id issued by the messaging platform
    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "display_name", nullable = false, length = 64)
    private String displayName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Participant() {}

    public Participant(String externalId, String displayName) {
        this.externalId = externalId;
        this.displayName = displayName;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
