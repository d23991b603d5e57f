package io.b2mash.s3manager.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  @Query("SELECT e FROM AuditEvent e WHERE e.action = :action ORDER BY e.occurredAt DESC")
  List<AuditEvent> findByActionOrderByOccurredAtDesc(@Param("action") String action);
}
