package com.docspace.backend.modules.auth.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.modules.auth.domain.AppUser;
import com.docspace.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.docspace.backend.modules.auth.presentation.dto.ForgotPasswordResponse;
import com.docspace.backend.modules.auth.presentation.dto.LoginRequest;
import com.docspace.backend.modules.auth.presentation.dto.LoginResponse;
import com.docspace.backend.modules.auth.presentation.dto.RegisterRequest;
import com.docspace.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.docspace.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final CredentialService credentialService;
    private final TokenSessionService tokenSessionService;
    private final AppUserRepository appUserRepository;
    private final boolean exposeResetToken;

    public AuthService(
            CredentialService credentialService,
            TokenSessionService tokenSessionService,
            AppUserRepository appUserRepository,
            @Value("${app.auth.expose-reset-token:false}") boolean exposeResetToken
    ) {
        this.credentialService = credentialService;
        this.tokenSessionService = tokenSessionService;
        this.appUserRepository = appUserRepository;
        this.exposeResetToken = exposeResetToken;
    }

    public LoginResponse register(RegisterRequest request) {
        AppUser user = credentialService.register(
                request.email(),
                request.password(),
                request.firstName(),
                request.lastName(),
                request.departmentId()
        );
        TokenPairResponse tokens = tokenSessionService.issue(user.getId(), user.getEmail());
        return new LoginResponse(tokens, buildUserProfile(user));
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = credentialService.verify(request.email(), request.password());
        TokenPairResponse tokens = tokenSessionService.issue(user.getId(), user.getEmail());
        log.info("User {} logged in", user.getId());
        return new LoginResponse(tokens, buildUserProfile(user));
    }

    public TokenPairResponse refresh(String refreshToken) {
        return tokenSessionService.refresh(refreshToken);
    }

    public void logout(String accessToken, String refreshToken) {
        tokenSessionService.logout(accessToken, refreshToken);
    }

    public ForgotPasswordResponse forgotPassword(String email) {
        Optional<String> token = credentialService.requestPasswordReset(email);
        String exposed = exposeResetToken ? token.orElse(null) : null;
        return new ForgotPasswordResponse(ForgotPasswordResponse.GENERIC_MESSAGE, exposed);
    }

    public void resetPassword(String token, String newPassword) {
        credentialService.resetPassword(token, newPassword);
    }

    public void changePassword(UUID userId, String currentPassword, String newPassword) {
        credentialService.changePassword(userId, currentPassword, newPassword);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findWithDepartmentById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        return buildUserProfile(user);
    }

    private UserProfileResponse buildUserProfile(AppUser user) {
        List<String> permissions = appUserRepository.findPermissionNames(user.getId());
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getDepartmentId(),
                user.getDepartment() != null ? user.getDepartment().getName() : null,
                permissions,
                user.getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
