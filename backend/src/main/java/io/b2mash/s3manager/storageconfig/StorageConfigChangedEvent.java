package io.b2mash.s3manager.storageconfig;

/** Published after an update or delete of a configuration has been committed. */
public record StorageConfigChangedEvent(String configId, ChangeType changeType) {

  public enum ChangeType {
    UPDATED,
    DELETED
  }
}
