package io.b2mash.s3manager.storage;

import com.fasterxml.jackson.annotation.JsonValue;

/** The backend call an object operation was at when it succeeded or failed. */
public enum TransferStage {
  /** Looking up the configuration and its client, before any backend call. */
  RESOLVE("resolve"),
  CONNECT("connect"),
  LIST("list"),
  PUT("put"),
  INITIATE("initiate"),
  READ_PART("read-part"),
  UPLOAD_PART("upload-part"),
  COMPLETE("complete"),
  GET("get"),
  DELETE("delete");

  private final String wireName;

  TransferStage(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
