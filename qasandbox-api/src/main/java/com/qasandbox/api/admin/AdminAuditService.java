package com.qasandbox.api.admin;

import com.qasandbox.api.tracing.RequestContext;
import com.qasandbox.domain.access.Principal;
import com.qasandbox.infrastructure.audit.AuditLogEntity;
import com.qasandbox.infrastructure.audit.AuditLogRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class AdminAuditService {

  private final AuditLogRepository audits;

  public AdminAuditService(AuditLogRepository audits) {
    this.audits = audits;
  }

  public void log(Principal actor, String action, String targetType, String targetId) {
    audits.save(new AuditLogEntity(
        actor.role().value(),
        actor.id(),
        action,
        targetType,
        targetId,
        RequestContext.requestId(),
        Instant.now()
    ));
  }
}
