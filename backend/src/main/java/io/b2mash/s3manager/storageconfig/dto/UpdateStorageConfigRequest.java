package io.b2mash.s3manager.storageconfig.dto;

import io.b2mash.s3manager.storageconfig.BackendKind;
import io.b2mash.s3manager.storageconfig.StorageConfigPatch;
import jakarta.validation.constraints.Size;

/** Every field is optional. An omitted or empty secret keeps the stored one. */
public record UpdateStorageConfigRequest(
    @Size(max = 255) String name,
    BackendKind storageType,
    @Size(max = 255) String accessKeyId,
    @Size(max = 512) String secretAccessKey,
    @Size(max = 64) String region,
    @Size(max = 255) String bucketName,
    @Size(max = 1024) String endpointUrl,
    Boolean useTls) {

  public StorageConfigPatch toPatch() {
    return new StorageConfigPatch(
        name,
        storageType,
        accessKeyId,
        secretAccessKey,
        region,
        bucketName,
        endpointUrl,
        useTls);
  }
}
