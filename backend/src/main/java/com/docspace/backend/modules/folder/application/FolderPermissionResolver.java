package com.docspace.backend.modules.folder.application;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.auth.domain.SystemPermission;
import com.docspace.backend.modules.folder.domain.Folder;
import com.docspace.backend.modules.folder.domain.FolderHierarchyIntegrityException;
import com.docspace.backend.modules.folder.domain.FolderPermission;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderPermissionRepository;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether a principal holds a permission level on a folder.
 *
 * <p>Holders of {@code manage_folders} pass every check. Everyone else is matched against the folder's
 * active ACL entries, by user id and by department id with equal weight; any entry at or above the
 * required level allows. Without a match the walk moves to the parent, unless the current folder has
 * {@code inherit_permissions = false} or is a root. Nothing is cached between calls.
 */
@Service
@Transactional(readOnly = true)
public class FolderPermissionResolver {

    private final FolderRepository folderRepository;
    private final FolderPermissionRepository folderPermissionRepository;

    public FolderPermissionResolver(
            FolderRepository folderRepository,
            FolderPermissionRepository folderPermissionRepository
    ) {
        this.folderRepository = folderRepository;
        this.folderPermissionRepository = folderPermissionRepository;
    }

    /**
     * @throws ProblemException {@code FOLDER_NOT_FOUND} when the folder is missing or inactive
     * @throws FolderHierarchyIntegrityException when the parent chain is broken
     */
    public boolean hasPermission(JwtAuthenticationPrincipal principal, UUID folderId, FolderPermissionType required) {
        if (isOverride(principal)) {
            return true;
        }
        Folder start = folderRepository.findByIdAndActiveTrue(folderId)
                .orElseThrow(() -> ProblemException.notFound("FOLDER_NOT_FOUND"));
        return resolveFrom(principal, start, required);
    }

    /**
     * Every active folder the principal holds {@code required} on, ordered by name.
     */
    public List<Folder> getUserAccessibleFolders(JwtAuthenticationPrincipal principal, FolderPermissionType required) {
        List<Folder> candidates = folderRepository.findByActiveTrueOrderByNameAsc();
        if (isOverride(principal)) {
            return candidates;
        }
        return candidates.stream()
                .filter(folder -> resolveFrom(principal, folder, required))
                .toList();
    }

    public boolean isOverride(JwtAuthenticationPrincipal principal) {
        return principal.hasPermission(SystemPermission.MANAGE_FOLDERS);
    }

    private boolean resolveFrom(JwtAuthenticationPrincipal principal, Folder start, FolderPermissionType required) {
        Set<UUID> visited = new HashSet<>();
        Folder current = start;
        while (true) {
            if (!visited.add(current.getId())) {
                throw new FolderHierarchyIntegrityException(start.getId(),
                        "Folder chain of " + start.getId() + " loops at " + current.getId());
            }
            if (grantsAtLevel(principal, current.getId(), required)) {
                return true;
            }
            if (!current.isInheritPermissions() || current.isRoot()) {
                return false;
            }
            UUID parentId = current.getParentId();
            UUID childId = current.getId();
            current = folderRepository.findById(parentId)
                    .orElseThrow(() -> new FolderHierarchyIntegrityException(childId,
                            "Folder " + childId + " points at missing parent " + parentId));
        }
    }

    private boolean grantsAtLevel(JwtAuthenticationPrincipal principal, UUID folderId, FolderPermissionType required) {
        List<FolderPermission> entries = folderPermissionRepository.findActiveForPrincipal(
                folderId, principal.userId(), principal.departmentId());
        for (FolderPermission entry : entries) {
            if (entry.getPermissionType().implies(required)) {
                return true;
            }
        }
        return false;
    }
}
