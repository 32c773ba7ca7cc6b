package com.spreadpool.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One administrator correction. The target is typed so entries can be looked up per game, week,
 * prop or pick; {@code detail} is a human-readable summary and is never parsed.
 */
@Entity
@Table(name = "admin_audit", indexes = {
        @Index(name = "idx_admin_audit_ts", columnList = "performed_at"),
        @Index(name = "idx_admin_audit_target", columnList = "target_type,target_id")
})
public class AdminAudit {
    public static final int DETAIL_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "performed_at", nullable = false)
    private Instant performedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 32, nullable = false)
    private AdminAction action;

    @Column(name = "actor", length = 64, nullable = false)
    private String actor;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", length = 16, nullable = false)
    private AuditTarget targetType;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(name = "detail", length = DETAIL_LENGTH)
    private String detail;

    @Column(name = "affected_count", nullable = false)
    private long affectedCount;

    public AdminAudit() {}

    public AdminAudit(AdminAction action, String actor, AuditTarget targetType, Long targetId,
                      String detail, long affectedCount, Instant performedAt) {
        this.action = action;
        this.actor = actor;
        this.targetType = targetType;
        this.targetId = targetId;
        this.detail = detail != null && detail.length() > DETAIL_LENGTH ? detail.substring(0, DETAIL_LENGTH) : detail;
        this.affectedCount = affectedCount;
        this.performedAt = performedAt;
    }

    public Long getId() { return id; }

    public Instant getPerformedAt() { return performedAt; }

    public AdminAction getAction() { return action; }

    public String getActor() { return actor; }

    public AuditTarget getTargetType() { return targetType; }

    public Long getTargetId() { return targetId; }

    public String getDetail() { return detail; }

    public long getAffectedCount() { return affectedCount; }
}
