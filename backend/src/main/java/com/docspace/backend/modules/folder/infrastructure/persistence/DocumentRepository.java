package com.docspace.backend.modules.folder.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.UUID;

import com.docspace.backend.modules.folder.domain.Document;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DocumentRepository extends JpaRepository<Document, UUID> {

    long countByFolderIdAndActiveTrue(UUID folderId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Document d
               set d.active = false,
                   d.updatedAt = :now
             where d.folderId in :folderIds
               and d.active = true
            """)
    int deactivateInFolders(@Param("folderIds") Collection<UUID> folderIds, @Param("now") OffsetDateTime now);
}
