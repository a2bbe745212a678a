package com.docspace.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.docspace.backend.modules.auth.application.TokenSessionService;
import com.docspace.backend.modules.auth.domain.AppUser;
import com.docspace.backend.modules.auth.domain.Department;
import com.docspace.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.docspace.backend.modules.folder.application.FolderPermissionResolver;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AuthorizationGateTest {

    @Mock
    private TokenSessionService tokenSessionService;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private FolderPermissionResolver permissionResolver;

    private AuthorizationGate authorizationGate;
    private Department engineering;
    private AppUser user;

    @BeforeEach
    void setUp() {
        authorizationGate = new AuthorizationGate(tokenSessionService, appUserRepository, permissionResolver);
        engineering = TestEntities.department(UUID.randomUUID(), "Engineering");
        user = TestEntities.user(UUID.randomUUID(), "u1@example.com", engineering);
    }

    @Test
    void authenticateBuildsPrincipalFromCurrentDepartmentPermissions() {
        when(tokenSessionService.authenticate("token")).thenReturn(parsed(user.getId()));
        when(appUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(appUserRepository.findPermissionNames(user.getId())).thenReturn(List.of("view_documents", "manage_folders"));

        JwtAuthenticationPrincipal principal = authorizationGate.authenticate("token");

        assertThat(principal.userId()).isEqualTo(user.getId());
        assertThat(principal.departmentId()).isEqualTo(engineering.getId());
        assertThat(principal.hasPermission("manage_folders")).isTrue();
        assertThat(principal.hasPermission("delete_users")).isFalse();
    }

    @Test
    void authenticateRejectsDeactivatedUser() {
        user.setActive(false);
        when(tokenSessionService.authenticate("token")).thenReturn(parsed(user.getId()));
        when(appUserRepository.findById(user.getId())).thenReturn(Optional.of(user));

        ProblemException ex = assertThrows(ProblemException.class, () -> authorizationGate.authenticate("token"));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(ex.getCode()).isEqualTo("INVALID_ACCESS_TOKEN");
        verify(appUserRepository, never()).findPermissionNames(user.getId());
    }

    @Test
    void authenticatePropagatesTokenRejection() {
        when(tokenSessionService.authenticate("revoked"))
                .thenThrow(ProblemException.unauthorized("INVALID_ACCESS_TOKEN"));

        ProblemException ex = assertThrows(ProblemException.class, () -> authorizationGate.authenticate("revoked"));

        assertThat(ex.getCode()).isEqualTo("INVALID_ACCESS_TOKEN");
    }

    @Test
    void folderAccessDelegatesToResolver() {
        JwtAuthenticationPrincipal principal =
                new JwtAuthenticationPrincipal(user.getId(), user.getEmail(), engineering.getId(), List.of());
        UUID folderId = UUID.randomUUID();
        when(permissionResolver.hasPermission(principal, folderId, FolderPermissionType.WRITE)).thenReturn(false);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> authorizationGate.requireFolderAccess(principal, folderId, FolderPermissionType.WRITE));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(ex.getCode()).isEqualTo("FOLDER_ACCESS_DENIED");
    }

    @Test
    void systemPermissionIsCheckedAgainstPrincipal() {
        JwtAuthenticationPrincipal principal =
                new JwtAuthenticationPrincipal(user.getId(), user.getEmail(), engineering.getId(), List.of("view_documents"));

        authorizationGate.requireSystemPermission(principal, "view_documents");
        ProblemException ex = assertThrows(ProblemException.class,
                () -> authorizationGate.requireSystemPermission(principal, "manage_folders"));

        assertThat(ex.getCode()).isEqualTo("PERMISSION_REQUIRED");
    }

    private ParsedToken parsed(UUID userId) {
        OffsetDateTime now = OffsetDateTime.parse("2024-03-01T09:00:00Z");
        return new ParsedToken(userId, "u1@example.com", UUID.randomUUID().toString(), now, now.plusMinutes(15));
    }
}
