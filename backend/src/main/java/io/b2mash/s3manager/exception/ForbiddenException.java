package io.b2mash.s3manager.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The caller is authenticated but does not own the storage configuration they addressed. The
 * problem body carries the configuration id under {@code configId}.
 */
public class ForbiddenException extends ErrorResponseException {

  private final String configId;

  private ForbiddenException(String configId) {
    super(HttpStatus.FORBIDDEN, createProblem(configId), null);
    this.configId = configId;
  }

  public static ForbiddenException forConfig(String configId) {
    return new ForbiddenException(configId);
  }

  public String getConfigId() {
    return configId;
  }

  private static ProblemDetail createProblem(String configId) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("You do not have access to storage configuration " + configId);
    problem.setProperty("configId", configId);
    return problem;
  }
}
