package io.b2mash.s3manager.storage;

/**
 * Lifecycle of one multipart upload:
 *
 * <pre>
 * IDLE -> INITIATED -> (PART_UPLOADING -> PART_UPLOADED)* -> COMPLETING -> COMPLETED
 *                 any non-terminal state after INITIATED -> ABORTING -> ABORTED
 * </pre>
 */
public enum MultipartState {
  IDLE,
  INITIATED,
  PART_UPLOADING,
  PART_UPLOADED,
  COMPLETING,
  COMPLETED,
  ABORTING,
  ABORTED;

  public boolean isTerminal() {
    return this == COMPLETED || this == ABORTED;
  }
}
