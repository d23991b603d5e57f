package io.b2mash.s3manager.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an owner tries to delete the only storage configuration they have. */
public class LastConfigurationException extends ErrorResponseException {

  public LastConfigurationException(String configId) {
    super(HttpStatus.CONFLICT, createProblem(configId), null);
  }

  private static ProblemDetail createProblem(String configId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Cannot delete the last configuration");
    problem.setDetail(
        "Storage configuration " + configId + " is the only one left. Create another first.");
    problem.setProperty("configId", configId);
    return problem;
  }
}
