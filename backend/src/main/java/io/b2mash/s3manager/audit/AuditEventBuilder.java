package io.b2mash.s3manager.audit;

import io.b2mash.s3manager.security.Caller;
import io.b2mash.s3manager.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.web.ErrorResponse;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source, IP address,
 * and user agent from the current request context when available.
 *
 * <p>Required fields: {@code action} and {@code resource}. A record is successful unless {@link
 * #failure(Throwable)} or {@link #success(boolean)} says otherwise.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .action("config.create")
 *     .resource("config")
 *     .resourceId(config.getId())
 *     .details(Map.of("name", config.getDisplayName()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;
  private static final int MAX_ERROR_LENGTH = 1000;

  private String action;
  private String resource;
  private String resourceId;
  private String actorId;
  private boolean success = true;
  private String error;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditEventBuilder resource(String resource) {
    this.resource = resource;
    return this;
  }

  public AuditEventBuilder resourceId(String resourceId) {
    this.resourceId = resourceId;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder success(boolean success) {
    this.success = success;
    return this;
  }

  /**
   * Marks the event as failed and records the failure. For {@link ErrorResponse}s the problem
   * detail is recorded instead of the exception message.
   */
  public AuditEventBuilder failure(Throwable cause) {
    this.success = false;
    String message = cause.getMessage();
    if (cause instanceof ErrorResponse errorResponse
        && errorResponse.getBody().getDetail() != null) {
      message = errorResponse.getBody().getDetail();
    }
    this.error = message != null ? message : cause.getClass().getName();
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}, auto-populating fields from the current request context
   * where not explicitly set:
   *
   * <ul>
   *   <li>{@code actorId} from the authenticated token subject
   *   <li>{@code source} = "API" if in HTTP request context, "INTERNAL" otherwise
   *   <li>{@code ipAddress} via {@link ClientIpResolver}
   *   <li>{@code userAgent} from {@code User-Agent} header (truncated to 500 chars)
   * </ul>
   */
  public AuditEventRecord build() {
    String resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      Caller caller = Caller.currentOrNull();
      resolvedActorId = caller != null ? caller.userId() : null;
    }

    HttpServletRequest request = resolveHttpRequest();
    String source = request != null ? "API" : "INTERNAL";

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = ClientIpResolver.resolve(request);
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    String resolvedError = error;
    if (resolvedError != null && resolvedError.length() > MAX_ERROR_LENGTH) {
      resolvedError = resolvedError.substring(0, MAX_ERROR_LENGTH);
    }

    return new AuditEventRecord(
        action,
        resource,
        resourceId,
        resolvedActorId,
        success,
        resolvedError,
        source,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
