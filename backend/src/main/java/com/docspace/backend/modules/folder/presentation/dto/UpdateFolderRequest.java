package com.docspace.backend.modules.folder.presentation.dto;

import com.docspace.backend.modules.folder.domain.FolderAccessLevel;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateFolderRequest(
        @Size(max = 255) @Pattern(regexp = ".*\\S.*", message = "name must not be blank") String name,
        @Size(max = 1000) String description,
        FolderAccessLevel accessLevel,
        Boolean inheritPermissions
) {
}
