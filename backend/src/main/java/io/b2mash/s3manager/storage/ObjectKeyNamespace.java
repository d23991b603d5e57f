package io.b2mash.s3manager.storage;

import io.b2mash.s3manager.exception.InvalidStateException;

/**
 * Maps an owner's logical filenames to backend keys under {@code users/{ownerId}/} and back. Owners
 * never see the prefix.
 */
public final class ObjectKeyNamespace {

  private ObjectKeyNamespace() {}

  public static String prefixFor(String ownerId) {
    return "users/" + ownerId + "/";
  }

  public static String keyFor(String ownerId, String filename) {
    if (filename == null || filename.isBlank()) {
      throw new InvalidStateException("Invalid filename", "A filename is required");
    }
    return prefixFor(ownerId) + filename;
  }

  /**
   * Strips the owner's prefix from a backend key. Returns an empty string for the prefix itself and
   * for keys outside the owner's namespace.
   */
  public static String logicalName(String ownerId, String key) {
    String prefix = prefixFor(ownerId);
    if (key == null || !key.startsWith(prefix)) {
      return "";
    }
    return key.substring(prefix.length());
  }
}
