package com.docspace.backend.modules.folder.domain;

import java.util.UUID;

/**
 * The stored parent chain is broken: a parent link points at a missing folder, or the chain loops.
 * Never translated into a denial.
 */
public class FolderHierarchyIntegrityException extends RuntimeException {

    private final UUID folderId;

    public FolderHierarchyIntegrityException(UUID folderId, String message) {
        super(message);
        this.folderId = folderId;
    }

    public UUID getFolderId() {
        return folderId;
    }
}
