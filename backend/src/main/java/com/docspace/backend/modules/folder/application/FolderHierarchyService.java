package com.docspace.backend.modules.folder.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.global.security.AuthorizationGate;
import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.audit.application.AuditLogService;
import com.docspace.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.docspace.backend.modules.audit.domain.AuditAction;
import com.docspace.backend.modules.auth.domain.SystemPermission;
import com.docspace.backend.modules.folder.domain.Folder;
import com.docspace.backend.modules.folder.domain.FolderAccessLevel;
import com.docspace.backend.modules.folder.domain.FolderHierarchyIntegrityException;
import com.docspace.backend.modules.folder.domain.FolderPermission;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.domain.PrincipalRef;
import com.docspace.backend.modules.folder.infrastructure.persistence.DocumentRepository;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderPermissionRepository;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderRepository;
import com.docspace.backend.modules.folder.presentation.dto.CreateFolderRequest;
import com.docspace.backend.modules.folder.presentation.dto.FolderDeactivationResponse;
import com.docspace.backend.modules.folder.presentation.dto.FolderResponse;
import com.docspace.backend.modules.folder.presentation.dto.UpdateFolderRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Folder tree operations. The tree is kept acyclic here: a folder is never placed under itself or
 * one of its descendants.
 */
@Service
@Transactional
public class FolderHierarchyService {

    private static final Logger log = LoggerFactory.getLogger(FolderHierarchyService.class);

    private final FolderRepository folderRepository;
    private final DocumentRepository documentRepository;
    private final FolderPermissionRepository folderPermissionRepository;
    private final FolderPermissionResolver permissionResolver;
    private final AuthorizationGate authorizationGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public FolderHierarchyService(
            FolderRepository folderRepository,
            DocumentRepository documentRepository,
            FolderPermissionRepository folderPermissionRepository,
            FolderPermissionResolver permissionResolver,
            AuthorizationGate authorizationGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.folderRepository = folderRepository;
        this.documentRepository = documentRepository;
        this.folderPermissionRepository = folderPermissionRepository;
        this.permissionResolver = permissionResolver;
        this.authorizationGate = authorizationGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates a folder and gives its creator MANAGE on it. Top-level folders need {@code manage_folders};
     * anything else needs WRITE on the parent.
     */
    public FolderResponse create(JwtAuthenticationPrincipal principal, CreateFolderRequest request) {
        UUID parentId = request.parentId();
        if (parentId == null) {
            authorizationGate.requireSystemPermission(principal, SystemPermission.MANAGE_FOLDERS);
        } else {
            if (folderRepository.findByIdAndActiveTrue(parentId).isEmpty()) {
                throw ProblemException.notFound("PARENT_FOLDER_NOT_FOUND");
            }
            requirePermission(principal, parentId, FolderPermissionType.WRITE);
        }

        Folder folder = new Folder();
        folder.setName(request.name().trim());
        folder.setDescription(request.description());
        folder.setParentId(parentId);
        folder.setAccessLevel(request.accessLevel() != null ? request.accessLevel() : FolderAccessLevel.PRIVATE);
        folder.setInheritPermissions(request.inheritPermissions() == null || request.inheritPermissions());
        folder.setCreatedBy(principal.userId());
        folder.setActive(true);
        Folder saved = folderRepository.save(folder);

        FolderPermission creatorEntry = new FolderPermission();
        creatorEntry.setFolderId(saved.getId());
        creatorEntry.setTarget(PrincipalRef.user(principal.userId()));
        creatorEntry.setPermissionType(FolderPermissionType.MANAGE);
        creatorEntry.setGrantedBy(principal.userId());
        creatorEntry.setGrantedAt(OffsetDateTime.now(clock));
        folderPermissionRepository.save(creatorEntry);

        audit(AuditAction.FOLDER_CREATE, saved.getId(), principal,
                parentId != null ? Map.of("parentId", parentId.toString()) : Map.of());
        log.info("Folder {} created under {} by {}", saved.getId(), parentId, principal.userId());
        return FolderResponse.from(saved, 0, 0);
    }

    @Transactional(readOnly = true)
    public FolderResponse getFolder(JwtAuthenticationPrincipal principal, UUID folderId) {
        Folder folder = loadActive(folderId);
        requirePermission(principal, folderId, FolderPermissionType.READ);
        return toResponse(folder);
    }

    /**
     * Active children the principal may read, by name.
     */
    @Transactional(readOnly = true)
    public List<FolderResponse> listChildren(JwtAuthenticationPrincipal principal, UUID folderId) {
        loadActive(folderId);
        requirePermission(principal, folderId, FolderPermissionType.READ);
        return folderRepository.findByParentIdAndActiveTrueOrderByNameAsc(folderId).stream()
                .filter(child -> authorizationGate.canAccessFolder(principal, child.getId(), FolderPermissionType.READ))
                .map(this::toResponse)
                .toList();
    }

    /**
     * Breadcrumb of a folder the principal may read: the folder and its ancestors, root first.
     */
    @Transactional(readOnly = true)
    public List<Folder> getHierarchy(JwtAuthenticationPrincipal principal, UUID folderId) {
        loadActive(folderId);
        requirePermission(principal, folderId, FolderPermissionType.READ);
        return getAncestorChain(folderId);
    }

    /**
     * The folder followed up to its root, returned root first with the folder itself last.
     *
     * @throws FolderHierarchyIntegrityException when a parent link is dangling or the chain loops
     */
    @Transactional(readOnly = true)
    public List<Folder> getAncestorChain(UUID folderId) {
        Folder current = loadActive(folderId);
        List<Folder> chain = new ArrayList<>();
        Set<UUID> visited = new HashSet<>();
        while (true) {
            if (!visited.add(current.getId())) {
                throw new FolderHierarchyIntegrityException(folderId,
                        "Folder chain of " + folderId + " loops at " + current.getId());
            }
            chain.add(current);
            if (current.isRoot()) {
                break;
            }
            UUID parentId = current.getParentId();
            UUID childId = current.getId();
            current = folderRepository.findById(parentId)
                    .orElseThrow(() -> new FolderHierarchyIntegrityException(childId,
                            "Folder " + childId + " points at missing parent " + parentId));
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Changes name, description and access level with WRITE. Changing {@code inheritPermissions}
     * alters who can reach the subtree and needs MANAGE.
     */
    public FolderResponse update(JwtAuthenticationPrincipal principal, UUID folderId, UpdateFolderRequest request) {
        Folder folder = loadActive(folderId);
        requirePermission(principal, folderId, FolderPermissionType.WRITE);

        if (request.inheritPermissions() != null && request.inheritPermissions() != folder.isInheritPermissions()) {
            requirePermission(principal, folderId, FolderPermissionType.MANAGE);
            folder.setInheritPermissions(request.inheritPermissions());
        }
        if (request.name() != null) {
            folder.setName(request.name().trim());
        }
        if (request.description() != null) {
            folder.setDescription(request.description());
        }
        if (request.accessLevel() != null) {
            folder.setAccessLevel(request.accessLevel());
        }

        audit(AuditAction.FOLDER_UPDATE, folderId, principal, Map.of());
        return toResponse(folder);
    }

    /**
     * Reparents a folder. Needs WRITE on the folder and on the new parent, or {@code manage_folders}
     * to move it to the top level. The folder and the new parent's ancestor chain stay row-locked until
     * commit, so two moves that could close a loop between them run one after the other.
     */
    public FolderResponse move(JwtAuthenticationPrincipal principal, UUID folderId, UUID newParentId) {
        lockMoveScope(folderId, newParentId);
        Folder folder = loadActive(folderId);
        requirePermission(principal, folderId, FolderPermissionType.WRITE);

        if (newParentId == null) {
            authorizationGate.requireSystemPermission(principal, SystemPermission.MANAGE_FOLDERS);
        } else {
            if (newParentId.equals(folderId)) {
                throw ProblemException.conflict("CIRCULAR_FOLDER_REFERENCE");
            }
            if (folderRepository.findByIdAndActiveTrue(newParentId).isEmpty()) {
                throw ProblemException.notFound("PARENT_FOLDER_NOT_FOUND");
            }
            requirePermission(principal, newParentId, FolderPermissionType.WRITE);
            boolean targetInsideSubtree = getAncestorChain(newParentId).stream()
                    .anyMatch(ancestor -> ancestor.getId().equals(folderId));
            if (targetInsideSubtree) {
                throw ProblemException.conflict("CIRCULAR_FOLDER_REFERENCE");
            }
        }

        UUID previousParentId = folder.getParentId();
        folder.setParentId(newParentId);
        audit(AuditAction.FOLDER_MOVE, folderId, principal, moveDetail(previousParentId, newParentId));
        log.info("Folder {} moved from {} to {} by {}", folderId, previousParentId, newParentId, principal.userId());
        return toResponse(folder);
    }

    private void lockMoveScope(UUID folderId, UUID newParentId) {
        Set<UUID> locked = new HashSet<>();
        Set<UUID> scope = moveScope(folderId, newParentId);
        // a chain read before the lock was granted may be stale; relock until it stops changing
        while (!locked.containsAll(scope)) {
            folderRepository.findAllByIdForUpdate(scope);
            locked.addAll(scope);
            scope = moveScope(folderId, newParentId);
        }
    }

    private Set<UUID> moveScope(UUID folderId, UUID newParentId) {
        Set<UUID> scope = new HashSet<>();
        scope.add(folderId);
        if (newParentId != null) {
            scope.addAll(folderRepository.findAncestorIds(newParentId));
        }
        return scope;
    }

    /**
     * Soft-deletes a folder. A folder with active subfolders or documents is only deactivated when
     * {@code deleteContents} is set, in which case the whole subtree, its documents and its ACL entries
     * go with it in this transaction.
     */
    public FolderDeactivationResponse deactivate(JwtAuthenticationPrincipal principal, UUID folderId, boolean deleteContents) {
        loadActive(folderId);
        requirePermission(principal, folderId, FolderPermissionType.DELETE);

        long subfolders = folderRepository.countByParentIdAndActiveTrue(folderId);
        long documents = documentRepository.countByFolderIdAndActiveTrue(folderId);
        if (!deleteContents && (subfolders > 0 || documents > 0)) {
            throw ProblemException.conflict("FOLDER_NOT_EMPTY");
        }

        List<UUID> affected = deleteContents ? folderRepository.findSubtreeIds(folderId) : List.of(folderId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        int documentsDeactivated = documentRepository.deactivateInFolders(affected, now);
        folderPermissionRepository.deactivateForFolders(affected, principal.userId(), now);
        int foldersDeactivated = folderRepository.deactivateAll(affected, now);

        audit(AuditAction.FOLDER_DEACTIVATE, folderId, principal, Map.of(
                "folders", foldersDeactivated,
                "documents", documentsDeactivated
        ));
        log.info("Folder {} deactivated by {} ({} folders, {} documents)",
                folderId, principal.userId(), foldersDeactivated, documentsDeactivated);
        return new FolderDeactivationResponse(folderId, foldersDeactivated, documentsDeactivated);
    }

    /**
     * Active folders on which the principal holds {@code permissionType}.
     */
    @Transactional(readOnly = true)
    public List<FolderResponse> listAccessible(JwtAuthenticationPrincipal principal, FolderPermissionType permissionType) {
        return permissionResolver.getUserAccessibleFolders(principal, permissionType).stream()
                .map(this::toResponse)
                .toList();
    }

    private Folder loadActive(UUID folderId) {
        return folderRepository.findByIdAndActiveTrue(folderId)
                .orElseThrow(() -> ProblemException.notFound("FOLDER_NOT_FOUND"));
    }

    private void requirePermission(JwtAuthenticationPrincipal principal, UUID folderId, FolderPermissionType required) {
        authorizationGate.requireFolderAccess(principal, folderId, required);
    }

    private FolderResponse toResponse(Folder folder) {
        return FolderResponse.from(
                folder,
                documentRepository.countByFolderIdAndActiveTrue(folder.getId()),
                folderRepository.countByParentIdAndActiveTrue(folder.getId())
        );
    }

    private void audit(AuditAction action, UUID folderId, JwtAuthenticationPrincipal principal, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(action, folderId.toString(), principal.userId(), detail));
    }

    private static Map<String, Object> moveDetail(UUID from, UUID to) {
        Map<String, Object> detail = new HashMap<>();
        detail.put("fromParentId", from != null ? from.toString() : null);
        detail.put("toParentId", to != null ? to.toString() : null);
        return detail;
    }
}
