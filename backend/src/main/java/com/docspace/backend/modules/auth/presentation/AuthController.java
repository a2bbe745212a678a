package com.docspace.backend.modules.auth.presentation;

import com.docspace.backend.global.security.BearerTokens;
import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.auth.application.AuthService;
import com.docspace.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.docspace.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.docspace.backend.modules.auth.presentation.dto.ForgotPasswordResponse;
import com.docspace.backend.modules.auth.presentation.dto.LoginRequest;
import com.docspace.backend.modules.auth.presentation.dto.LoginResponse;
import com.docspace.backend.modules.auth.presentation.dto.LogoutRequest;
import com.docspace.backend.modules.auth.presentation.dto.RefreshRequest;
import com.docspace.backend.modules.auth.presentation.dto.RegisterRequest;
import com.docspace.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.docspace.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register", description = "Creates an account and signs it in.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "400", description = "Unknown department"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping("/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(summary = "Login")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @Operation(summary = "Rotate tokens", description = "Exchanges the current refresh token for a new pair.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair"),
            @ApiResponse(responseCode = "401", description = "Refresh token invalid, expired or already used")
    })
    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken()));
    }

    @Operation(summary = "Logout", description = "Always succeeds.")
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) LogoutRequest request
    ) {
        String refreshToken = request != null ? request.refreshToken() : null;
        authService.logout(BearerTokens.extract(authorization), refreshToken);
        return ResponseEntity.ok().build();
    }

    @Operation(summary = "Request a password reset")
    @PostMapping("/forgot-password")
    public ResponseEntity<ForgotPasswordResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(authService.forgotPassword(request.email()));
    }

    @Operation(summary = "Reset password with a reset token")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password replaced"),
            @ApiResponse(responseCode = "400", description = "Reset token invalid or expired")
    })
    @PostMapping("/reset-password")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request.token(), request.newPassword());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Change own password")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Current password incorrect")
    })
    @PostMapping("/change-password")
    public ResponseEntity<Void> changePassword(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        authService.changePassword(principal.userId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }
}
