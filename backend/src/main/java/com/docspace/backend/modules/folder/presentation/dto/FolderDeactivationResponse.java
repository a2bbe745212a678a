package com.docspace.backend.modules.folder.presentation.dto;

import java.util.UUID;

public record FolderDeactivationResponse(UUID folderId, int foldersDeactivated, int documentsDeactivated) {
}
