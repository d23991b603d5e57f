package io.b2mash.s3manager.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an operation needs a storage configuration and the owner has none. */
public class NoConfigurationException extends ErrorResponseException {

  public NoConfigurationException(String ownerId) {
    super(HttpStatus.NOT_FOUND, createProblem(ownerId), null);
  }

  private static ProblemDetail createProblem(String ownerId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("No storage configuration");
    problem.setDetail("No storage configurations found for owner " + ownerId);
    return problem;
  }
}
