package com.docspace.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.docspace.backend.global.web.RequestIdFilter;
import com.docspace.backend.modules.audit.domain.AuditAction;
import com.docspace.backend.modules.audit.domain.AuditLog;
import com.docspace.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Folder and ACL mutations are written here inside the caller's transaction, so an entry exists
 * exactly when the change it describes was committed.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        Map<String, Object> detail = command.detail() == null || command.detail().isEmpty()
                ? null
                : new LinkedHashMap<>(command.detail());
        AuditLog entry = new AuditLog(
                command.action(),
                command.resourceKey(),
                command.actorUserId(),
                RequestIdFilter.currentRequestId(),
                detail,
                OffsetDateTime.now(clock)
        );
        auditLogRepository.save(entry);
        log.debug("Audit {} on {} {} by {}", command.action(), command.action().resourceType(),
                command.resourceKey(), command.actorUserId());
    }

    public record AuditLogCommand(
            AuditAction action,
            String resourceKey,
            UUID actorUserId,
            Map<String, Object> detail
    ) {
    }
}
