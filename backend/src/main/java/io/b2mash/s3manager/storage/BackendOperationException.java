package io.b2mash.s3manager.storage;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A call to the storage backend failed. Carries the {@link TransferStage} it failed at, and the
 * part number when the failure happened inside a multipart upload.
 */
public class BackendOperationException extends ErrorResponseException {

  private final TransferStage stage;
  private final Integer partNumber;

  public BackendOperationException(TransferStage stage, String detail, Throwable cause) {
    this(stage, HttpStatus.INTERNAL_SERVER_ERROR, detail, null, cause);
  }

  public BackendOperationException(
      TransferStage stage, HttpStatus status, String detail, Throwable cause) {
    this(stage, status, detail, null, cause);
  }

  private BackendOperationException(
      TransferStage stage, HttpStatus status, String detail, Integer partNumber, Throwable cause) {
    super(status, createProblem(status, stage, detail, partNumber), cause);
    this.stage = stage;
    this.partNumber = partNumber;
  }

  public static BackendOperationException forPart(
      TransferStage stage, int partNumber, String detail, Throwable cause) {
    return new BackendOperationException(
        stage, HttpStatus.INTERNAL_SERVER_ERROR, detail, partNumber, cause);
  }

  public TransferStage getStage() {
    return stage;
  }

  /** Part number of a failed multipart step, or null. */
  public Integer getPartNumber() {
    return partNumber;
  }

  private static ProblemDetail createProblem(
      HttpStatus status, TransferStage stage, String detail, Integer partNumber) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle("Storage operation failed");
    problem.setDetail(detail);
    problem.setProperty("stage", stage.wireName());
    if (partNumber != null) {
      problem.setProperty("partNumber", partNumber);
    }
    return problem;
  }
}
