package io.b2mash.s3manager.storage;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CompletedPart;

/**
 * One in-flight multipart upload against a single bucket and key. Parts are sent strictly in order
 * and each acknowledged part is recorded with its ETag for completion. Not thread-safe, and never
 * persisted: a session lives for the duration of one upload call.
 */
public class MultipartUploadSession {

  private static final Logger log = LoggerFactory.getLogger(MultipartUploadSession.class);

  private final S3Client client;
  private final String bucket;
  private final String key;
  private final List<CompletedPart> completedParts = new ArrayList<>();

  private MultipartState state = MultipartState.IDLE;
  private String uploadId;
  private int nextPartNumber = 1;

  public MultipartUploadSession(S3Client client, String bucket, String key) {
    this.client = client;
    this.bucket = bucket;
    this.key = key;
  }

  /** Asks the backend for an upload id. */
  public void initiate(String contentType) {
    requireState(EnumSet.of(MultipartState.IDLE), "initiate");
    try {
      var response =
          client.createMultipartUpload(
              r -> r.bucket(bucket).key(key).contentType(contentType));
      uploadId = response.uploadId();
    } catch (SdkException e) {
      throw new BackendOperationException(
          TransferStage.INITIATE, "Failed to initiate multipart upload: " + e.getMessage(), e);
    }
    state = MultipartState.INITIATED;
    log.debug("Multipart upload initiated: bucket={}, key={}, uploadId={}", bucket, key, uploadId);
  }

  /** Uploads the first {@code length} bytes of {@code buffer} as the next part. */
  public void uploadPart(byte[] buffer, int length) {
    requireState(
        EnumSet.of(MultipartState.INITIATED, MultipartState.PART_UPLOADED), "upload part");
    state = MultipartState.PART_UPLOADING;
    int partNumber = nextPartNumber;
    try {
      var response =
          client.uploadPart(
              r ->
                  r.bucket(bucket)
                      .key(key)
                      .uploadId(uploadId)
                      .partNumber(partNumber)
                      .contentLength((long) length),
              RequestBody.fromInputStream(new ByteArrayInputStream(buffer, 0, length), length));
      completedParts.add(
          CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());
    } catch (SdkException e) {
      throw BackendOperationException.forPart(
          TransferStage.UPLOAD_PART,
          partNumber,
          "Failed to upload part " + partNumber + ": " + e.getMessage(),
          e);
    }
    nextPartNumber++;
    state = MultipartState.PART_UPLOADED;
  }

  /** Assembles the uploaded parts into the final object. */
  public void complete() {
    requireState(EnumSet.of(MultipartState.PART_UPLOADED), "complete");
    state = MultipartState.COMPLETING;
    try {
      client.completeMultipartUpload(
          r ->
              r.bucket(bucket)
                  .key(key)
                  .uploadId(uploadId)
                  .multipartUpload(m -> m.parts(List.copyOf(completedParts))));
    } catch (SdkException e) {
      throw new BackendOperationException(
          TransferStage.COMPLETE, "Failed to complete multipart upload: " + e.getMessage(), e);
    }
    state = MultipartState.COMPLETED;
  }

  /**
   * Aborts the upload after {@code cause} ended it. A failing abort is logged and attached to the
   * cause as suppressed; it never replaces it. Does nothing before initiation or after a terminal
   * state.
   */
  public void abort(Throwable cause) {
    if (state == MultipartState.IDLE || state.isTerminal()) {
      return;
    }
    state = MultipartState.ABORTING;
    try {
      client.abortMultipartUpload(r -> r.bucket(bucket).key(key).uploadId(uploadId));
      log.warn(
          "Multipart upload aborted: key={}, uploadId={}, partsUploaded={}, reason={}",
          key,
          uploadId,
          completedParts.size(),
          cause.getMessage());
    } catch (SdkException e) {
      log.warn(
          "Failed to abort multipart upload: key={}, uploadId={}, reason={}",
          key,
          uploadId,
          e.getMessage());
      cause.addSuppressed(e);
    }
    state = MultipartState.ABORTED;
  }

  public MultipartState getState() {
    return state;
  }

  public String getUploadId() {
    return uploadId;
  }

  public int getPartCount() {
    return completedParts.size();
  }

  /** Part number the next {@link #uploadPart} call will use. */
  public int getNextPartNumber() {
    return nextPartNumber;
  }

  public List<CompletedPart> getCompletedParts() {
    return List.copyOf(completedParts);
  }

  private void requireState(EnumSet<MultipartState> allowed, String operation) {
    if (!allowed.contains(state)) {
      throw new IllegalStateException(
          "Cannot " + operation + " a multipart upload in state " + state);
    }
  }
}
