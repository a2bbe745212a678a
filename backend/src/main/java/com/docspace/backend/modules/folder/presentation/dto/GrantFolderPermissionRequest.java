package com.docspace.backend.modules.folder.presentation.dto;

import java.util.UUID;

import com.docspace.backend.modules.folder.domain.FolderPermissionType;

import jakarta.validation.constraints.NotNull;

/**
 * Exactly one of {@code userId} and {@code departmentId} must be present.
 */
public record GrantFolderPermissionRequest(
        UUID userId,
        UUID departmentId,
        @NotNull(message = "permissionType is required") FolderPermissionType permissionType
) {
}
