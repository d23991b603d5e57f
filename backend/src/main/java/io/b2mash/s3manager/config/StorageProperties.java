package io.b2mash.s3manager.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under {@code storage.*}.
 *
 * @param encryptionKey Base64-encoded 256-bit AES key protecting stored secret access keys
 * @param clientCache bounds of the backend client cache
 */
@ConfigurationProperties("storage")
public record StorageProperties(String encryptionKey, @DefaultValue ClientCache clientCache) {

  public record ClientCache(
      @DefaultValue("256") long maximumSize,
      @DefaultValue("30m") Duration expireAfterAccess) {}
}
