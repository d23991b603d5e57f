package io.b2mash.s3manager.audit;

/**
 * Sink for security-relevant and mutating operations. Callers hand over an {@link
 * AuditEventRecord} and move on: implementations must never throw, so an unavailable sink can not
 * fail or mask the operation being audited.
 */
public interface AuditService {

  /**
   * Records a single audit event.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);
}
