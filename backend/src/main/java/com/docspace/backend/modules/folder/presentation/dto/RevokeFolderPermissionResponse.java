package com.docspace.backend.modules.folder.presentation.dto;

import java.util.UUID;

public record RevokeFolderPermissionResponse(UUID folderId, int revoked) {
}
