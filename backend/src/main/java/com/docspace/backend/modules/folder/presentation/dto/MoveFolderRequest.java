package com.docspace.backend.modules.folder.presentation.dto;

import java.util.UUID;

/**
 * {@code parentId == null} moves the folder to the top level.
 */
public record MoveFolderRequest(UUID parentId) {
}
