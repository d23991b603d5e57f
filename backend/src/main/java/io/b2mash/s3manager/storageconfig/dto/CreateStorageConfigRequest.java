package io.b2mash.s3manager.storageconfig.dto;

import io.b2mash.s3manager.storageconfig.BackendKind;
import io.b2mash.s3manager.storageconfig.StorageConfigDraft;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateStorageConfigRequest(
    @NotBlank @Size(max = 255) String name,
    @NotNull(message = "storageType is required") BackendKind storageType,
    @NotBlank @Size(max = 255) String accessKeyId,
    @NotBlank @Size(max = 512) String secretAccessKey,
    @Size(max = 64) String region,
    @NotBlank @Size(max = 255) String bucketName,
    @Size(max = 1024) String endpointUrl,
    boolean useTls) {

  public StorageConfigDraft toDraft() {
    return new StorageConfigDraft(
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
