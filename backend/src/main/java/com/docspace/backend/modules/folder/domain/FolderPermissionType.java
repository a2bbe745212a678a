package com.docspace.backend.modules.folder.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Folder access levels in ascending order. A level implies every level declared before it.
 */
public enum FolderPermissionType {
    READ,
    WRITE,
    DELETE,
    MANAGE;

    public boolean implies(FolderPermissionType required) {
        return this.compareTo(required) >= 0;
    }

    /**
     * Case-insensitive lookup accepting the lower-case names used on the wire.
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static FolderPermissionType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("permission type is required");
        }
        return FolderPermissionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
