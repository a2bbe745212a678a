package com.docspace.backend.modules.folder.presentation.dto;

import java.util.UUID;

import com.docspace.backend.modules.folder.domain.Folder;

public record FolderBreadcrumbResponse(UUID folderId, String name, UUID parentId) {

    public static FolderBreadcrumbResponse from(Folder folder) {
        return new FolderBreadcrumbResponse(folder.getId(), folder.getName(), folder.getParentId());
    }
}
