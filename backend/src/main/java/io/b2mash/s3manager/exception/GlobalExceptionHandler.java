package io.b2mash.s3manager.exception;

import io.b2mash.s3manager.audit.AuditEventBuilder;
import io.b2mash.s3manager.audit.AuditService;
import io.b2mash.s3manager.storage.BackendOperationException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps failures to problem responses. Domain {@code ErrorResponseException}s and oversized
 * multipart uploads (413) are answered by the inherited handlers; the methods here add logging and
 * auditing for the cases that need it.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    auditAccessDenied(request, "insufficient_role");

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    String reason = ex.getBody().getDetail();
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        reason);

    auditAccessDenied(request, reason != null ? reason : "forbidden");

    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(BackendOperationException.class)
  public ResponseEntity<ProblemDetail> handleBackendOperation(
      BackendOperationException ex, HttpServletRequest request) {
    if (ex.getStatusCode().is5xxServerError()) {
      log.error(
          "Storage operation failed: path={}, stage={}, detail={}",
          request.getRequestURI(),
          ex.getStage().wireName(),
          ex.getBody().getDetail(),
          ex);
    } else {
      log.warn(
          "Storage operation rejected: path={}, stage={}, detail={}",
          request.getRequestURI(),
          ex.getStage().wireName(),
          ex.getBody().getDetail());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private void auditAccessDenied(HttpServletRequest request, String reason) {
    auditService.log(
        AuditEventBuilder.builder()
            .action("security.access_denied")
            .resource("security")
            .resourceId(request.getRequestURI())
            .success(false)
            .details(
                Map.of(
                    "path", request.getRequestURI(),
                    "method", request.getMethod(),
                    "reason", reason))
            .build());
  }
}
