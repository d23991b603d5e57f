package io.b2mash.s3manager.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A request the server cannot act on as given: a blank filename, an unreadable upload, an unknown
 * exchange format or a configuration that fails validation. When several checks fail at once each
 * message is listed under {@code problems}.
 */
public class InvalidStateException extends ErrorResponseException {

  private final List<String> problems;

  public InvalidStateException(String title, String detail) {
    this(title, List.of(detail));
  }

  public InvalidStateException(String title, List<String> problems) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, problems), null);
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }

  private static ProblemDetail createProblem(String title, List<String> problems) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(String.join("; ", problems));
    if (problems.size() > 1) {
      problem.setProperty("problems", List.copyOf(problems));
    }
    return problem;
  }
}
