package io.b2mash.s3manager.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit event persisted to the {@code audit_events} table. No {@code @Version}, no
 * {@code updatedAt}, no setters.
 *
 * @see AuditEventRecord
 */
@Entity
@Table(name = "audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "action", nullable = false, length = 100)
  private String action;

  @Column(name = "resource", nullable = false, length = 50)
  private String resource;

  @Column(name = "resource_id", length = 1024)
  private String resourceId;

  @Column(name = "actor_id")
  private String actorId;

  @Column(name = "success", nullable = false)
  private boolean success;

  @Column(name = "error", length = 1000)
  private String error;

  @Column(name = "source", nullable = false, length = 30)
  private String source;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @Convert(converter = JsonMapConverter.class)
  @Column(name = "details")
  private Map<String, Object> details;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  /** Protected no-arg constructor required by JPA. */
  protected AuditEvent() {}

  /**
   * Creates an immutable audit event from the given record. Sets {@code occurredAt} to the current
   * instant.
   */
  public AuditEvent(AuditEventRecord record) {
    this.action = record.action();
    this.resource = record.resource();
    this.resourceId = record.resourceId();
    this.actorId = record.actorId();
    this.success = record.success();
    this.error = record.error();
    this.source = record.source();
    this.ipAddress = record.ipAddress();
    this.userAgent = record.userAgent();
    this.details = record.details();
    this.occurredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getAction() {
    return action;
  }

  public String getResource() {
    return resource;
  }

  public String getResourceId() {
    return resourceId;
  }

  public String getActorId() {
    return actorId;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getError() {
    return error;
  }

  public String getSource() {
    return source;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
