package com.docspace.backend.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Authenticated caller: user, department and the department's coarse permission names.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email, UUID departmentId, List<String> permissions) {

    public JwtAuthenticationPrincipal {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public boolean hasPermission(String permissionName) {
        return permissions.contains(permissionName);
    }
}
