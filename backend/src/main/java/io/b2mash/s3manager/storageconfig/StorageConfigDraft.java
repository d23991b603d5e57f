package io.b2mash.s3manager.storageconfig;

import java.util.ArrayList;
import java.util.List;

/**
 * The mutable content of a storage configuration, before the registry assigns identity, ownership
 * and timestamps.
 */
public record StorageConfigDraft(
    String displayName,
    BackendKind backendKind,
    String accessKeyId,
    String secretAccessKey,
    String region,
    String bucketName,
    String endpointUrl,
    boolean useTls) {

  /**
   * Returns the reasons this draft can not back a usable configuration, or an empty list. Endpoint
   * syntax is checked later, when a client is built.
   */
  public List<String> problems() {
    var problems = new ArrayList<String>();
    if (isBlank(displayName)) {
      problems.add("name is required");
    }
    if (backendKind == null) {
      problems.add("storage type is required");
    }
    if (isBlank(accessKeyId)) {
      problems.add("access key is required");
    }
    if (isBlank(secretAccessKey)) {
      problems.add("secret key is required");
    }
    if (isBlank(bucketName)) {
      problems.add("bucket name is required");
    }
    if (backendKind != null && backendKind.requiresEndpoint() && isBlank(endpointUrl)) {
      problems.add("endpoint URL is required for self-hosted storage");
    }
    if (backendKind == BackendKind.CLOUD && isBlank(region)) {
      problems.add("region is required for cloud storage");
    }
    return problems;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
