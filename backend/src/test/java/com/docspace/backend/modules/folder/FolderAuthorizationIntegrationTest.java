package com.docspace.backend.modules.folder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.audit.domain.AuditAction;
import com.docspace.backend.modules.audit.domain.AuditLog;
import com.docspace.backend.modules.audit.infrastructure.AuditLogRepository;
import com.docspace.backend.modules.folder.application.FolderGrantService;
import com.docspace.backend.modules.folder.application.FolderHierarchyService;
import com.docspace.backend.modules.folder.application.FolderPermissionResolver;
import com.docspace.backend.modules.folder.domain.Folder;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.infrastructure.persistence.FolderRepository;
import com.docspace.backend.modules.folder.presentation.dto.CreateFolderRequest;
import com.docspace.backend.modules.folder.presentation.dto.FolderDeactivationResponse;
import com.docspace.backend.modules.folder.presentation.dto.FolderResponse;
import com.docspace.backend.support.AbstractPostgresIntegrationTest;
import com.docspace.backend.support.InMemorySessionStoreConfig;
import com.docspace.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;

@SpringBootTest
@Import({InMemorySessionStoreConfig.class, TestUserFactory.class})
class FolderAuthorizationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private FolderHierarchyService folderHierarchyService;

    @Autowired
    private FolderGrantService folderGrantService;

    @Autowired
    private FolderPermissionResolver folderPermissionResolver;

    @Autowired
    private FolderRepository folderRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    private JwtAuthenticationPrincipal admin;
    private JwtAuthenticationPrincipal engineer;
    private UUID engineering;

    @BeforeEach
    void setUp() {
        admin = testUserFactory.principalIn("Administration");
        engineer = testUserFactory.principalIn("Engineering");
        engineering = testUserFactory.departmentId("Engineering");
    }

    @Test
    void seededAdministrationCarriesFolderOverride() {
        assertThat(admin.hasPermission("manage_folders")).isTrue();
        assertThat(engineer.hasPermission("manage_folders")).isFalse();
        assertThat(engineer.hasPermission("view_documents")).isTrue();
    }

    @Test
    void departmentGrantFlowsDownUntilInheritanceIsCut() {
        FolderResponse root = createRoot();
        folderGrantService.grant(admin, root.folderId(), null, engineering, FolderPermissionType.WRITE);

        FolderResponse drafts = folderHierarchyService.create(engineer,
                new CreateFolderRequest("Drafts", null, root.folderId(), null, null));
        FolderResponse q3 = folderHierarchyService.create(admin,
                new CreateFolderRequest("Q3", null, drafts.folderId(), null, false));
        JwtAuthenticationPrincipal colleague = testUserFactory.principalIn("Engineering");

        assertThat(folderPermissionResolver.hasPermission(colleague, drafts.folderId(), FolderPermissionType.WRITE)).isTrue();
        assertThat(folderPermissionResolver.hasPermission(colleague, q3.folderId(), FolderPermissionType.READ)).isFalse();
        assertThat(folderPermissionResolver.hasPermission(engineer, drafts.folderId(), FolderPermissionType.MANAGE)).isTrue();

        List<Folder> breadcrumb = folderHierarchyService.getHierarchy(admin, q3.folderId());
        assertThat(breadcrumb).extracting(Folder::getId)
                .containsExactly(root.folderId(), drafts.folderId(), q3.folderId());

        ProblemException circular = assertThrows(ProblemException.class,
                () -> folderHierarchyService.move(admin, root.folderId(), q3.folderId()));
        assertThat(circular.getCode()).isEqualTo("CIRCULAR_FOLDER_REFERENCE");

        assertThat(folderGrantService.revoke(admin, root.folderId(), null, engineering, null)).isEqualTo(1);
        assertThat(folderGrantService.revoke(admin, root.folderId(), null, engineering, null)).isZero();
        assertThat(folderPermissionResolver.hasPermission(colleague, drafts.folderId(), FolderPermissionType.READ)).isFalse();
    }

    @Test
    void duplicateGrantIsRejected() {
        FolderResponse root = createRoot();
        folderGrantService.grant(admin, root.folderId(), engineer.userId(), null, FolderPermissionType.READ);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> folderGrantService.grant(admin, root.folderId(), engineer.userId(), null, FolderPermissionType.READ));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ex.getCode()).isEqualTo("FOLDER_PERMISSION_EXISTS");
    }

    @Test
    void cascadeDeactivationRemovesSubtreeAndIsAudited() {
        FolderResponse root = createRoot();
        FolderResponse child = folderHierarchyService.create(admin,
                new CreateFolderRequest("Child", null, root.folderId(), null, null));
        FolderResponse grandchild = folderHierarchyService.create(admin,
                new CreateFolderRequest("Grandchild", null, child.folderId(), null, null));
        folderGrantService.grant(admin, root.folderId(), null, engineering, FolderPermissionType.READ);

        assertThat(folderRepository.findSubtreeIds(root.folderId()))
                .containsExactlyInAnyOrder(root.folderId(), child.folderId(), grandchild.folderId());

        ProblemException notEmpty = assertThrows(ProblemException.class,
                () -> folderHierarchyService.deactivate(admin, root.folderId(), false));
        assertThat(notEmpty.getCode()).isEqualTo("FOLDER_NOT_EMPTY");

        FolderDeactivationResponse result = folderHierarchyService.deactivate(admin, root.folderId(), true);
        assertThat(result.foldersDeactivated()).isEqualTo(3);

        ProblemException gone = assertThrows(ProblemException.class,
                () -> folderHierarchyService.getFolder(admin, grandchild.folderId()));
        assertThat(gone.getCode()).isEqualTo("FOLDER_NOT_FOUND");

        assertThat(auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc("FOLDER", root.folderId().toString()))
                .extracting(AuditLog::getAction)
                .contains(AuditAction.FOLDER_CREATE, AuditAction.FOLDER_PERMISSION_GRANT, AuditAction.FOLDER_DEACTIVATE);
    }

    @Test
    void opposingConcurrentMovesNeverCloseALoop() throws Exception {
        FolderResponse root = createRoot();
        FolderResponse a = folderHierarchyService.create(admin,
                new CreateFolderRequest("A", null, root.folderId(), null, null));
        FolderResponse b = folderHierarchyService.create(admin,
                new CreateFolderRequest("B", null, root.folderId(), null, null));

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> aUnderB = executor.submit(() -> moveOutcome(start, a.folderId(), b.folderId()));
            Future<String> bUnderA = executor.submit(() -> moveOutcome(start, b.folderId(), a.folderId()));
            start.countDown();

            assertThat(List.of(aUnderB.get(30, TimeUnit.SECONDS), bUnderA.get(30, TimeUnit.SECONDS)))
                    .containsExactlyInAnyOrder("moved", "CIRCULAR_FOLDER_REFERENCE");
        } finally {
            executor.shutdownNow();
        }

        assertThat(folderHierarchyService.getAncestorChain(a.folderId()).get(0).getId()).isEqualTo(root.folderId());
        assertThat(folderHierarchyService.getAncestorChain(b.folderId()).get(0).getId()).isEqualTo(root.folderId());
    }

    private String moveOutcome(CountDownLatch start, UUID folderId, UUID newParentId) throws InterruptedException {
        start.await();
        try {
            folderHierarchyService.move(admin, folderId, newParentId);
            return "moved";
        } catch (ProblemException ex) {
            return ex.getCode();
        }
    }

    private FolderResponse createRoot() {
        return folderHierarchyService.create(admin,
                new CreateFolderRequest("Root " + UUID.randomUUID(), "integration", null, null, null));
    }
}
