package com.docspace.backend.modules.folder.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.docspace.backend.modules.folder.domain.Folder;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FolderRepository extends JpaRepository<Folder, UUID> {

    Optional<Folder> findByIdAndActiveTrue(UUID id);

    List<Folder> findByParentIdAndActiveTrueOrderByNameAsc(UUID parentId);

    List<Folder> findByActiveTrueOrderByNameAsc();

    long countByParentIdAndActiveTrue(UUID parentId);

    /**
     * Ids of the active folders in the subtree rooted at {@code rootId}, the root included.
     * {@code UNION} keeps the recursion finite even on a corrupted, looping chain.
     */
    @Query(value = """
            WITH RECURSIVE subtree AS (
                SELECT f.id FROM folder f WHERE f.id = :rootId
                UNION
                SELECT child.id
                FROM folder child
                JOIN subtree s ON child.parent_id = s.id
                WHERE child.is_active = true
            )
            SELECT id FROM subtree
            """, nativeQuery = true)
    List<UUID> findSubtreeIds(@Param("rootId") UUID rootId);

    /**
     * Ids on the path from {@code folderId} up to its root, the folder included, active or not.
     */
    @Query(value = """
            WITH RECURSIVE ancestors AS (
                SELECT f.id, f.parent_id FROM folder f WHERE f.id = :folderId
                UNION
                SELECT parent.id, parent.parent_id
                FROM folder parent
                JOIN ancestors a ON parent.id = a.parent_id
            )
            SELECT id FROM ancestors
            """, nativeQuery = true)
    List<UUID> findAncestorIds(@Param("folderId") UUID folderId);

    /**
     * Row-locks the given folders, in id order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from Folder f where f.id in :ids order by f.id")
    List<Folder> findAllByIdForUpdate(@Param("ids") Collection<UUID> ids);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Folder f
               set f.active = false,
                   f.updatedAt = :now
             where f.id in :ids
               and f.active = true
            """)
    int deactivateAll(@Param("ids") Collection<UUID> ids, @Param("now") OffsetDateTime now);
}
