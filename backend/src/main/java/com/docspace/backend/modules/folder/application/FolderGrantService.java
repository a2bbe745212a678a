package com.docspace.backend.modules.folder.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.global.security.AuthorizationGate;
import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.audit.application.AuditLogService;
import com.docspace.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.docspace.backend.modules.audit.domain.AuditAction;
import com.docspace.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.docspace.backend.modules.auth.infrastructure.persistence.DepartmentRepository;
import com.docspace.backend.modules.folder.domain.FolderPermission;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.domain.PrincipalRef;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderPermissionRepository;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates and revokes folder ACL entries. Every mutation requires MANAGE on the folder itself,
 * checked through {@link AuthorizationGate}, or the {@code manage_folders} override.
 */
@Service
@Transactional
public class FolderGrantService {

    private static final Logger log = LoggerFactory.getLogger(FolderGrantService.class);

    private final FolderRepository folderRepository;
    private final FolderPermissionRepository folderPermissionRepository;
    private final AppUserRepository appUserRepository;
    private final DepartmentRepository departmentRepository;
    private final AuthorizationGate authorizationGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public FolderGrantService(
            FolderRepository folderRepository,
            FolderPermissionRepository folderPermissionRepository,
            AppUserRepository appUserRepository,
            DepartmentRepository departmentRepository,
            AuthorizationGate authorizationGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.folderRepository = folderRepository;
        this.folderPermissionRepository = folderPermissionRepository;
        this.appUserRepository = appUserRepository;
        this.departmentRepository = departmentRepository;
        this.authorizationGate = authorizationGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public FolderPermission grant(
            JwtAuthenticationPrincipal principal,
            UUID folderId,
            UUID userId,
            UUID departmentId,
            FolderPermissionType permissionType
    ) {
        PrincipalRef target = toTarget(userId, departmentId);
        if (permissionType == null) {
            throw ProblemException.badRequest("PERMISSION_TYPE_REQUIRED");
        }
        requireManage(principal, folderId);
        requireTargetExists(target);

        if (isAlreadyGranted(folderId, target, permissionType)) {
            throw ProblemException.conflict("FOLDER_PERMISSION_EXISTS");
        }

        FolderPermission entry = new FolderPermission();
        entry.setFolderId(folderId);
        entry.setTarget(target);
        entry.setPermissionType(permissionType);
        entry.setGrantedBy(principal.userId());
        entry.setGrantedAt(OffsetDateTime.now(clock));

        FolderPermission saved;
        try {
            saved = folderPermissionRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException ex) {
            // concurrent grant of the same tuple hit the partial unique index
            throw new ProblemException(HttpStatus.CONFLICT, "FOLDER_PERMISSION_EXISTS", null, ex);
        }

        auditLogService.record(new AuditLogCommand(
                AuditAction.FOLDER_PERMISSION_GRANT,
                folderId.toString(),
                principal.userId(),
                describe(target, permissionType)
        ));
        log.info("Folder {} granted {} to {} {} by {}", folderId, permissionType, target.kind(), target.id(), principal.userId());
        return saved;
    }

    /**
     * Deactivates the active entries on the folder that match every given filter. A filter left
     * {@code null} matches anything. Matching nothing is a successful no-op.
     *
     * @return number of entries revoked
     */
    public int revoke(
            JwtAuthenticationPrincipal principal,
            UUID folderId,
            UUID userId,
            UUID departmentId,
            FolderPermissionType permissionType
    ) {
        requireManage(principal, folderId);

        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = 0;
        for (FolderPermission entry : folderPermissionRepository.findByFolderIdAndActiveTrueOrderByGrantedAtAsc(folderId)) {
            if (matches(entry, userId, departmentId, permissionType)) {
                entry.revoke(principal.userId(), now);
                revoked++;
            }
        }

        if (revoked > 0) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("userId", userId != null ? userId.toString() : null);
            detail.put("departmentId", departmentId != null ? departmentId.toString() : null);
            detail.put("permissionType", permissionType != null ? permissionType.name() : null);
            detail.put("revoked", revoked);
            auditLogService.record(new AuditLogCommand(
                    AuditAction.FOLDER_PERMISSION_REVOKE,
                    folderId.toString(),
                    principal.userId(),
                    detail
            ));
        }
        log.info("Folder {}: {} permission entries revoked by {}", folderId, revoked, principal.userId());
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<FolderPermission> listPermissions(JwtAuthenticationPrincipal principal, UUID folderId) {
        requireManage(principal, folderId);
        return folderPermissionRepository.findByFolderIdAndActiveTrueOrderByGrantedAtAsc(folderId);
    }

    private void requireManage(JwtAuthenticationPrincipal principal, UUID folderId) {
        if (folderRepository.findByIdAndActiveTrue(folderId).isEmpty()) {
            throw ProblemException.notFound("FOLDER_NOT_FOUND");
        }
        if (!authorizationGate.canAccessFolder(principal, folderId, FolderPermissionType.MANAGE)) {
            log.warn("User {} denied ACL change on folder {}", principal.userId(), folderId);
            throw ProblemException.forbidden("FOLDER_ACCESS_DENIED");
        }
    }

    private void requireTargetExists(PrincipalRef target) {
        if (target.isUser()) {
            if (!appUserRepository.existsById(target.id())) {
                throw ProblemException.notFound("USER_NOT_FOUND");
            }
        } else if (!departmentRepository.existsById(target.id())) {
            throw ProblemException.notFound("DEPARTMENT_NOT_FOUND");
        }
    }

    private boolean isAlreadyGranted(UUID folderId, PrincipalRef target, FolderPermissionType permissionType) {
        return target.isUser()
                ? folderPermissionRepository.existsByFolderIdAndUserIdAndPermissionTypeAndActiveTrue(
                        folderId, target.id(), permissionType)
                : folderPermissionRepository.existsByFolderIdAndDepartmentIdAndPermissionTypeAndActiveTrue(
                        folderId, target.id(), permissionType);
    }

    private static PrincipalRef toTarget(UUID userId, UUID departmentId) {
        try {
            return PrincipalRef.of(userId, departmentId);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_PERMISSION_TARGET");
        }
    }

    private static boolean matches(FolderPermission entry, UUID userId, UUID departmentId, FolderPermissionType type) {
        PrincipalRef target = entry.getTarget();
        if (userId != null && !(target.isUser() && Objects.equals(target.id(), userId))) {
            return false;
        }
        if (departmentId != null && !(!target.isUser() && Objects.equals(target.id(), departmentId))) {
            return false;
        }
        return type == null || entry.getPermissionType() == type;
    }

    private static Map<String, Object> describe(PrincipalRef target, FolderPermissionType permissionType) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("principalKind", target.kind().name());
        detail.put("principalId", target.id().toString());
        detail.put("permissionType", permissionType.name());
        return detail;
    }
}
