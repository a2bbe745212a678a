package com.docspace.backend.global.security;

import java.util.List;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.docspace.backend.modules.auth.application.TokenSessionService;
import com.docspace.backend.modules.auth.domain.AppUser;
import com.docspace.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.docspace.backend.modules.folder.application.FolderPermissionResolver;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single entry point turning a bearer token into a principal and a principal plus folder into an
 * allow or a {@code FORBIDDEN}.
 */
@Component
public class AuthorizationGate {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

    private final TokenSessionService tokenSessionService;
    private final AppUserRepository appUserRepository;
    private final FolderPermissionResolver permissionResolver;

    public AuthorizationGate(
            TokenSessionService tokenSessionService,
            AppUserRepository appUserRepository,
            FolderPermissionResolver permissionResolver
    ) {
        this.tokenSessionService = tokenSessionService;
        this.appUserRepository = appUserRepository;
        this.permissionResolver = permissionResolver;
    }

    /**
     * @throws ProblemException {@code UNAUTHORIZED} for a revoked, forged or expired token, or when the
     *                          user is gone or inactive
     */
    public JwtAuthenticationPrincipal authenticate(String bearerToken) {
        ParsedToken token = tokenSessionService.authenticate(bearerToken);
        AppUser user = appUserRepository.findById(token.userId())
                .filter(AppUser::isActive)
                .orElseThrow(() -> {
                    log.info("Access token of missing or inactive user {} rejected", token.userId());
                    return ProblemException.unauthorized("INVALID_ACCESS_TOKEN");
                });
        List<String> permissions = appUserRepository.findPermissionNames(user.getId());
        return new JwtAuthenticationPrincipal(user.getId(), user.getEmail(), user.getDepartmentId(), permissions);
    }

    public boolean canAccessFolder(JwtAuthenticationPrincipal principal, UUID folderId, FolderPermissionType required) {
        return permissionResolver.hasPermission(principal, folderId, required);
    }

    public void requireFolderAccess(JwtAuthenticationPrincipal principal, UUID folderId, FolderPermissionType required) {
        if (!canAccessFolder(principal, folderId, required)) {
            throw ProblemException.forbidden("FOLDER_ACCESS_DENIED");
        }
    }

    public void requireSystemPermission(JwtAuthenticationPrincipal principal, String permissionName) {
        if (!principal.hasPermission(permissionName)) {
            throw ProblemException.forbidden("PERMISSION_REQUIRED");
        }
    }
}
