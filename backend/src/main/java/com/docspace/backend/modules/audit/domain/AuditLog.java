package com.docspace.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One row per recorded mutation. Rows are written once and never updated.
 */
@Entity
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, updatable = false, length = 64)
    private AuditAction action;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, updatable = false, length = 128)
    private String resourceKey;

    @Column(name = "actor_user_id", updatable = false, columnDefinition = "uuid")
    private UUID actorUserId;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public AuditLog(AuditAction action, String resourceKey, UUID actorUserId, String correlationId,
                    Map<String, Object> detail, OffsetDateTime createdAt) {
        this.action = action;
        this.resourceType = action.resourceType();
        this.resourceKey = resourceKey;
        this.actorUserId = actorUserId;
        this.correlationId = correlationId;
        this.detail = detail;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public AuditAction getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public UUID getActorUserId() {
        return actorUserId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
