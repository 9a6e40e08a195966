package com.qasandbox.infrastructure.audit;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(
    name = "audit_log",
    indexes = {
        @Index(name = "ix_audit_log_created_at", columnList = "created_at"),
        @Index(name = "ix_audit_log_actor", columnList = "actor_id"),
        @Index(name = "ix_audit_log_target", columnList = "target_type,target_id")
    }
)
public class AuditLogEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Column(name = "actor_role", nullable = false, length = 20)
  private String actorRole;

  @Column(name = "actor_id")
  private Long actorId;

  @Column(name = "action", nullable = false, length = 64)
  private String action;

  @Column(name = "target_type", nullable = false, length = 32)
  private String targetType;

  @Column(name = "target_id", length = 64)
  private String targetId;

  @Column(name = "request_id", length = 128)
  private String requestId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected AuditLogEntity() {}

  public AuditLogEntity(String actorRole, Long actorId, String action,
                        String targetType, String targetId, String requestId, Instant createdAt) {
    this.actorRole = actorRole;
    this.actorId = actorId;
    this.action = action;
    this.targetType = targetType;
    this.targetId = targetId;
    this.requestId = requestId;
    this.createdAt = createdAt;
  }

  public Long getId() { return id; }
  public String getActorRole() { return actorRole; }
  public Long getActorId() { return actorId; }
  public String getAction() { return action; }
  public String getTargetType() { return targetType; }
  public String getTargetId() { return targetId; }
  public String getRequestId() { return requestId; }
  public Instant getCreatedAt() { return createdAt; }
}
