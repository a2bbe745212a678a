package com.docspace.backend.modules.folder.domain;

public enum PrincipalKind {
    USER,
    DEPARTMENT
}
