package com.docspace.backend.modules.audit.domain;

/**
 * Recorded mutations, each tied to the kind of resource it touches.
 */
public enum AuditAction {
    FOLDER_CREATE("FOLDER"),
    FOLDER_UPDATE("FOLDER"),
    FOLDER_MOVE("FOLDER"),
    FOLDER_DEACTIVATE("FOLDER"),
    FOLDER_PERMISSION_GRANT("FOLDER"),
    FOLDER_PERMISSION_REVOKE("FOLDER");

    private final String resourceType;

    AuditAction(String resourceType) {
        this.resourceType = resourceType;
    }

    public String resourceType() {
        return resourceType;
    }
}
