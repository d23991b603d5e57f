package io.b2mash.s3manager.storage;

import io.b2mash.s3manager.storageconfig.StorageConfig;
import software.amazon.awssdk.services.s3.S3Client;

/** Source of backend clients bound to a single storage configuration. */
public interface StorageClientProvider {

  /**
   * Returns a shared client for a stored configuration. The provider owns it; callers must not
   * close it.
   *
   * @throws io.b2mash.s3manager.exception.ClientCreationException if the configuration is malformed
   */
  S3Client clientFor(StorageConfig config);

  /**
   * Builds a fresh, uncached client. The caller owns it and must close it. Used for configurations
   * that have not been stored yet.
   *
   * @throws io.b2mash.s3manager.exception.ClientCreationException if the configuration is malformed
   */
  S3Client openClient(StorageConfig config);
}
