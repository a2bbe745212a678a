package com.docspace.backend.modules.folder.presentation;

import java.util.List;
import java.util.UUID;

import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.folder.application.FolderGrantService;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.presentation.dto.FolderPermissionResponse;
import com.docspace.backend.modules.folder.presentation.dto.GrantFolderPermissionRequest;
import com.docspace.backend.modules.folder.presentation.dto.RevokeFolderPermissionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/folders/{folderId}/permissions")
public class FolderPermissionController {

    private final FolderGrantService folderGrantService;

    public FolderPermissionController(FolderGrantService folderGrantService) {
        this.folderGrantService = folderGrantService;
    }

    @GetMapping
    public ResponseEntity<List<FolderPermissionResponse>> list(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId
    ) {
        List<FolderPermissionResponse> entries = folderGrantService.listPermissions(principal, folderId).stream()
                .map(FolderPermissionResponse::from)
                .toList();
        return ResponseEntity.ok(entries);
    }

    @Operation(summary = "Grant folder permission", description = "Requires manage on the folder.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Entry created"),
            @ApiResponse(responseCode = "400", description = "Both or neither of userId and departmentId given"),
            @ApiResponse(responseCode = "403", description = "Caller lacks manage on the folder"),
            @ApiResponse(responseCode = "409", description = "Identical active entry exists")
    })
    @PostMapping
    public ResponseEntity<FolderPermissionResponse> grant(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId,
            @Valid @RequestBody GrantFolderPermissionRequest request
    ) {
        FolderPermissionResponse created = FolderPermissionResponse.from(folderGrantService.grant(
                principal,
                folderId,
                request.userId(),
                request.departmentId(),
                request.permissionType()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Revoke folder permissions", description = "Filters are ANDed; revoking nothing succeeds.")
    @DeleteMapping
    public ResponseEntity<RevokeFolderPermissionResponse> revoke(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId,
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "departmentId", required = false) UUID departmentId,
            @RequestParam(name = "permissionType", required = false) String permissionType
    ) {
        FolderPermissionType type = permissionType != null ? FolderController.parsePermission(permissionType) : null;
        int revoked = folderGrantService.revoke(principal, folderId, userId, departmentId, type);
        return ResponseEntity.ok(new RevokeFolderPermissionResponse(folderId, revoked));
    }
}
