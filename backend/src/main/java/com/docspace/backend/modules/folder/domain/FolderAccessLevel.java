package com.docspace.backend.modules.folder.domain;

/**
 * Visibility label shown to clients. Access decisions come from ACL entries only.
 */
public enum FolderAccessLevel {
    PRIVATE,
    DEPARTMENT,
    PUBLIC
}
