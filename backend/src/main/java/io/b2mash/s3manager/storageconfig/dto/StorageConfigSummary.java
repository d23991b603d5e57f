package io.b2mash.s3manager.storageconfig.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.s3manager.storageconfig.BackendKind;
import io.b2mash.s3manager.storageconfig.StorageConfig;
import java.time.Instant;

/**
 * List view of a configuration. Credentials are cut down to a four-character prefix, or masked
 * entirely when they are not longer than that.
 */
public record StorageConfigSummary(
    String id,
    String name,
    BackendKind storageType,
    String accessKeyId,
    String secretAccessKey,
    String region,
    String bucketName,
    String endpointUrl,
    boolean useTls,
    @JsonProperty("isDefault") boolean isDefault,
    Instant createdAt,
    Instant updatedAt) {

  static final int VISIBLE_PREFIX = 4;
  static final String MASK = "****";

  public static StorageConfigSummary from(StorageConfig config) {
    return new StorageConfigSummary(
        config.getId(),
        config.getDisplayName(),
        config.getBackendKind(),
        redact(config.getAccessKeyId()),
        redact(config.getSecretAccessKey()),
        config.getRegion(),
        config.getBucketName(),
        config.getEndpointUrl(),
        config.isUseTls(),
        config.isDefault(),
        config.getCreatedAt(),
        config.getUpdatedAt());
  }

  public static String redact(String value) {
    if (value == null || value.length() <= VISIBLE_PREFIX) {
      return MASK;
    }
    return value.substring(0, VISIBLE_PREFIX) + MASK;
  }
}
