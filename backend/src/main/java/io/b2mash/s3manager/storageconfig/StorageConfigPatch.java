package io.b2mash.s3manager.storageconfig;

/**
 * Partial update of a storage configuration. A null field leaves the stored value unchanged, which
 * is how callers keep the secret key without re-sending it.
 */
public record StorageConfigPatch(
    String displayName,
    BackendKind backendKind,
    String accessKeyId,
    String secretAccessKey,
    String region,
    String bucketName,
    String endpointUrl,
    Boolean useTls) {}
