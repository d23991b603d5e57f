package io.b2mash.s3manager.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A storage configuration is too malformed to build a backend client from. */
public class ClientCreationException extends ErrorResponseException {

  public ClientCreationException(String detail) {
    this(detail, null);
  }

  public ClientCreationException(String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Failed to create storage client");
    problem.setDetail(detail);
    return problem;
  }
}
