package io.b2mash.s3manager.storageconfig.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.s3manager.storageconfig.BackendKind;
import io.b2mash.s3manager.storageconfig.StorageConfig;
import java.time.Instant;

/** Full view of a configuration, secret included. Only returned to the owner or an admin. */
public record StorageConfigResponse(
    String id,
    String ownerId,
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

  public static StorageConfigResponse from(StorageConfig config) {
    return new StorageConfigResponse(
        config.getId(),
        config.getOwnerId(),
        config.getDisplayName(),
        config.getBackendKind(),
        config.getAccessKeyId(),
        config.getSecretAccessKey(),
        config.getRegion(),
        config.getBucketName(),
        config.getEndpointUrl(),
        config.isUseTls(),
        config.isDefault(),
        config.getCreatedAt(),
        config.getUpdatedAt());
  }
}
