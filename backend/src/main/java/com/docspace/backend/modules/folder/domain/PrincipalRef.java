package com.docspace.backend.modules.folder.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Target of an ACL entry: exactly one user or exactly one department.
 */
public record PrincipalRef(PrincipalKind kind, UUID id) {

    public PrincipalRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static PrincipalRef user(UUID userId) {
        return new PrincipalRef(PrincipalKind.USER, userId);
    }

    public static PrincipalRef department(UUID departmentId) {
        return new PrincipalRef(PrincipalKind.DEPARTMENT, departmentId);
    }

    /**
     * Builds a reference from the two optional ids of a request.
     *
     * @throws IllegalArgumentException unless exactly one id is present
     */
    public static PrincipalRef of(UUID userId, UUID departmentId) {
        if ((userId == null) == (departmentId == null)) {
            throw new IllegalArgumentException("exactly one of userId and departmentId must be set");
        }
        return userId != null ? user(userId) : department(departmentId);
    }

    public boolean isUser() {
        return kind == PrincipalKind.USER;
    }
}
