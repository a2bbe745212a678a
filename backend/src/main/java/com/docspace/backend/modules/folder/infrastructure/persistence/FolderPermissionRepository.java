package com.docspace.backend.modules.folder.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.docspace.backend.modules.folder.domain.FolderPermission;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FolderPermissionRepository extends JpaRepository<FolderPermission, UUID> {

    /**
     * Active entries on one folder held by the user directly or by the user's department.
     */
    @Query("""
            select p from FolderPermission p
            where p.folderId = :folderId
              and p.active = true
              and (p.userId = :userId or p.departmentId = :departmentId)
            """)
    List<FolderPermission> findActiveForPrincipal(
            @Param("folderId") UUID folderId,
            @Param("userId") UUID userId,
            @Param("departmentId") UUID departmentId
    );

    List<FolderPermission> findByFolderIdAndActiveTrueOrderByGrantedAtAsc(UUID folderId);

    boolean existsByFolderIdAndUserIdAndPermissionTypeAndActiveTrue(
            UUID folderId, UUID userId, FolderPermissionType permissionType);

    boolean existsByFolderIdAndDepartmentIdAndPermissionTypeAndActiveTrue(
            UUID folderId, UUID departmentId, FolderPermissionType permissionType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update FolderPermission p
               set p.active = false,
                   p.revokedAt = :now,
                   p.revokedBy = :actorId
             where p.folderId in :folderIds
               and p.active = true
            """)
    int deactivateForFolders(
            @Param("folderIds") Collection<UUID> folderIds,
            @Param("actorId") UUID actorId,
            @Param("now") OffsetDateTime now
    );
}
