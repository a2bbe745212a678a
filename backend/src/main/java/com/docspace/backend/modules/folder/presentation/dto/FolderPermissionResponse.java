package com.docspace.backend.modules.folder.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.docspace.backend.modules.folder.domain.FolderPermission;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.domain.PrincipalKind;
import com.docspace.backend.modules.folder.domain.PrincipalRef;

public record FolderPermissionResponse(
        UUID permissionId,
        UUID folderId,
        PrincipalKind principalKind,
        UUID principalId,
        FolderPermissionType permissionType,
        UUID grantedBy,
        OffsetDateTime grantedAt
) {

    public static FolderPermissionResponse from(FolderPermission entry) {
        PrincipalRef target = entry.getTarget();
        return new FolderPermissionResponse(
                entry.getId(),
                entry.getFolderId(),
                target.kind(),
                target.id(),
                entry.getPermissionType(),
                entry.getGrantedBy(),
                entry.getGrantedAt()
        );
    }
}
