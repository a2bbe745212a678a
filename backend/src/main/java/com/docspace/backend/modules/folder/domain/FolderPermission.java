package com.docspace.backend.modules.folder.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * ACL entry granting one permission level on one folder to a user or a department.
 * The two principal columns are only reachable through {@link #getTarget()} / {@link #setTarget(PrincipalRef)}.
 */
@Entity
@Table(name = "folder_permission")
public class FolderPermission {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "folder_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID folderId;

    @Column(name = "user_id", updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "department_id", updatable = false, columnDefinition = "uuid")
    private UUID departmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission_type", nullable = false, updatable = false, length = 16)
    private FolderPermissionType permissionType;

    @Column(name = "granted_by", columnDefinition = "uuid")
    private UUID grantedBy;

    @Column(name = "granted_at", nullable = false)
    private OffsetDateTime grantedAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_by", columnDefinition = "uuid")
    private UUID revokedBy;

    public UUID getId() {
        return id;
    }

    public UUID getFolderId() {
        return folderId;
    }

    public void setFolderId(UUID folderId) {
        this.folderId = folderId;
    }

    public PrincipalRef getTarget() {
        return userId != null ? PrincipalRef.user(userId) : PrincipalRef.department(departmentId);
    }

    public void setTarget(PrincipalRef target) {
        this.userId = target.isUser() ? target.id() : null;
        this.departmentId = target.isUser() ? null : target.id();
    }

    public FolderPermissionType getPermissionType() {
        return permissionType;
    }

    public void setPermissionType(FolderPermissionType permissionType) {
        this.permissionType = permissionType;
    }

    public UUID getGrantedBy() {
        return grantedBy;
    }

    public void setGrantedBy(UUID grantedBy) {
        this.grantedBy = grantedBy;
    }

    public OffsetDateTime getGrantedAt() {
        return grantedAt;
    }

    public void setGrantedAt(OffsetDateTime grantedAt) {
        this.grantedAt = grantedAt;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public UUID getRevokedBy() {
        return revokedBy;
    }

    public void revoke(UUID actorId, OffsetDateTime at) {
        this.active = false;
        this.revokedAt = at;
        this.revokedBy = actorId;
    }
}
