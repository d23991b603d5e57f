package io.b2mash.s3manager.audit;

import java.util.Map;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)} for recording audit events.
 * Constructed by {@link AuditEventBuilder} which auto-populates actor and request metadata.
 *
 * @param action what happened, following the {@code {resource}.{verb}} convention (e.g. {@code
 *     file.upload}, {@code config.delete})
 * @param resource the kind of resource being audited ({@code file}, {@code config})
 * @param resourceId id or logical key of the affected resource; nullable
 * @param actorId subject of the acting caller; null for system-initiated events
 * @param success whether the operation succeeded
 * @param error failure message; null on success
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details structured context (filename, size, stage, part number); nullable
 */
public record AuditEventRecord(
    String action,
    String resource,
    String resourceId,
    String actorId,
    boolean success,
    String error,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
