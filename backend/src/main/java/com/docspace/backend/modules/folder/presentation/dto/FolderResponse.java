package com.docspace.backend.modules.folder.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.docspace.backend.modules.folder.domain.Folder;
import com.docspace.backend.modules.folder.domain.FolderAccessLevel;

public record FolderResponse(
        UUID folderId,
        String name,
        String description,
        UUID parentId,
        FolderAccessLevel accessLevel,
        boolean inheritPermissions,
        UUID createdBy,
        boolean active,
        long documentCount,
        long subfolderCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static FolderResponse from(Folder folder, long documentCount, long subfolderCount) {
        return new FolderResponse(
                folder.getId(),
                folder.getName(),
                folder.getDescription(),
                folder.getParentId(),
                folder.getAccessLevel(),
                folder.isInheritPermissions(),
                folder.getCreatedBy(),
                folder.isActive(),
                documentCount,
                subfolderCount,
                folder.getCreatedAt(),
                folder.getUpdatedAt()
        );
    }
}
