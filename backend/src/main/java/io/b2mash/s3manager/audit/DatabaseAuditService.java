package io.b2mash.s3manager.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link AuditService}. Delegates persistence to {@link
 * AuditEventRepository}.
 *
 * <p>Transaction semantics: every event is written in its own transaction (REQUIRES_NEW) and any
 * failure, including one raised at commit, is logged and dropped.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final TransactionTemplate requiresNew;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void log(AuditEventRecord record) {
    try {
      requiresNew.executeWithoutResult(tx -> auditEventRepository.save(new AuditEvent(record)));
      log.debug(
          "Recorded audit event: action={}, resource={}/{}, actor={}, success={}",
          record.action(),
          record.resource(),
          record.resourceId(),
          record.actorId(),
          record.success());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record audit event: action={}, resource={}/{}, reason={}",
          record.action(),
          record.resource(),
          record.resourceId(),
          e.getMessage());
    }
  }
}
