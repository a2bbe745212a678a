package com.docspace.backend.modules.folder.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.global.security.JwtAuthenticationPrincipal;
import com.docspace.backend.modules.folder.application.FolderHierarchyService;
import com.docspace.backend.modules.folder.domain.FolderPermissionType;
import com.docspace.backend.modules.folder.presentation.dto.CreateFolderRequest;
import com.docspace.backend.modules.folder.presentation.dto.FolderBreadcrumbResponse;
import com.docspace.backend.modules.folder.presentation.dto.FolderDeactivationResponse;
import com.docspace.backend.modules.folder.presentation.dto.FolderResponse;
import com.docspace.backend.modules.folder.presentation.dto.MoveFolderRequest;
import com.docspace.backend.modules.folder.presentation.dto.UpdateFolderRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/folders")
public class FolderController {

    private final FolderHierarchyService folderHierarchyService;

    public FolderController(FolderHierarchyService folderHierarchyService) {
        this.folderHierarchyService = folderHierarchyService;
    }

    @Operation(summary = "Create folder", description = "Top-level folders need manage_folders; others need write on the parent.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Folder created"),
            @ApiResponse(responseCode = "403", description = "Insufficient access"),
            @ApiResponse(responseCode = "404", description = "Parent folder not found")
    })
    @PostMapping
    public ResponseEntity<FolderResponse> create(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateFolderRequest request
    ) {
        FolderResponse created = folderHierarchyService.create(principal, request);
        return ResponseEntity.created(URI.create("/folders/" + created.folderId())).body(created);
    }

    @Operation(summary = "Folders the caller can access at a level")
    @GetMapping("/accessible")
    public ResponseEntity<List<FolderResponse>> accessible(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "permission", defaultValue = "read") String permission
    ) {
        return ResponseEntity.ok(folderHierarchyService.listAccessible(principal, parsePermission(permission)));
    }

    @GetMapping("/{folderId}")
    public ResponseEntity<FolderResponse> get(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId
    ) {
        return ResponseEntity.ok(folderHierarchyService.getFolder(principal, folderId));
    }

    @PatchMapping("/{folderId}")
    public ResponseEntity<FolderResponse> update(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId,
            @Valid @RequestBody UpdateFolderRequest request
    ) {
        return ResponseEntity.ok(folderHierarchyService.update(principal, folderId, request));
    }

    @Operation(summary = "Move folder")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Folder moved"),
            @ApiResponse(responseCode = "409", description = "Target is the folder itself or one of its descendants")
    })
    @PostMapping("/{folderId}/move")
    public ResponseEntity<FolderResponse> move(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId,
            @RequestBody MoveFolderRequest request
    ) {
        return ResponseEntity.ok(folderHierarchyService.move(principal, folderId, request.parentId()));
    }

    @Operation(summary = "Deactivate folder")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Folder deactivated"),
            @ApiResponse(responseCode = "409", description = "Folder not empty and deleteContents not set")
    })
    @DeleteMapping("/{folderId}")
    public ResponseEntity<FolderDeactivationResponse> deactivate(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId,
            @RequestParam(name = "deleteContents", defaultValue = "false") boolean deleteContents
    ) {
        return ResponseEntity.ok(folderHierarchyService.deactivate(principal, folderId, deleteContents));
    }

    @GetMapping("/{folderId}/children")
    public ResponseEntity<List<FolderResponse>> children(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId
    ) {
        return ResponseEntity.ok(folderHierarchyService.listChildren(principal, folderId));
    }

    @Operation(summary = "Breadcrumb", description = "The folder and its ancestors, root first.")
    @GetMapping("/{folderId}/hierarchy")
    public ResponseEntity<List<FolderBreadcrumbResponse>> hierarchy(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID folderId
    ) {
        List<FolderBreadcrumbResponse> chain = folderHierarchyService.getHierarchy(principal, folderId).stream()
                .map(FolderBreadcrumbResponse::from)
                .toList();
        return ResponseEntity.ok(chain);
    }

    static FolderPermissionType parsePermission(String value) {
        try {
            return FolderPermissionType.fromValue(value);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_PERMISSION_TYPE");
        }
    }
}
