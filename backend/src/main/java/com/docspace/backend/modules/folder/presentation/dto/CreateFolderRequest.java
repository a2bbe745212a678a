package com.docspace.backend.modules.folder.presentation.dto;

import java.util.UUID;

import com.docspace.backend.modules.folder.domain.FolderAccessLevel;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateFolderRequest(
        @NotBlank(message = "name is required") @Size(max = 255) String name,
        @Size(max = 1000) String description,
        UUID parentId,
        FolderAccessLevel accessLevel,
        Boolean inheritPermissions
) {
}
