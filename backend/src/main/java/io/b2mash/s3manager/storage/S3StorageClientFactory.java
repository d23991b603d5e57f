package io.b2mash.s3manager.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.b2mash.s3manager.config.StorageProperties;
import io.b2mash.s3manager.exception.ClientCreationException;
import io.b2mash.s3manager.storageconfig.StorageConfig;
import io.b2mash.s3manager.storageconfig.StorageConfigChangedEvent;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.checksums.RequestChecksumCalculation;
import software.amazon.awssdk.core.checksums.ResponseChecksumValidation;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

/**
 * Builds AWS SDK clients from storage configurations.
 *
 * <p>Self-hosted backends get an endpoint override with path-style addressing; the scheme follows
 * the configuration's TLS flag and the region defaults to {@value #DEFAULT_REGION}. Cloud backends
 * use virtual-hosted addressing against the configured region. Shared clients are cached per
 * configuration id and credential fingerprint, and are closed when evicted or when their
 * configuration changes.
 */
@Component
public class S3StorageClientFactory implements StorageClientProvider {

  private static final Logger log = LoggerFactory.getLogger(S3StorageClientFactory.class);

  static final String DEFAULT_REGION = "us-east-1";

  private final Cache<String, S3Client> clients;

  public S3StorageClientFactory(StorageProperties properties) {
    var cacheSettings = properties.clientCache();
    this.clients =
        Caffeine.newBuilder()
            .maximumSize(cacheSettings.maximumSize())
            .expireAfterAccess(cacheSettings.expireAfterAccess())
            .executor(Runnable::run)
            .removalListener(
                (String key, S3Client client, RemovalCause cause) -> {
                  if (client != null) {
                    log.debug("Closing storage client: key={}, cause={}", key, cause);
                    client.close();
                  }
                })
            .build();
  }

  @Override
  public S3Client clientFor(StorageConfig config) {
    return clients.get(cacheKey(config), key -> openClient(config));
  }

  @Override
  public S3Client openClient(StorageConfig config) {
    requireText(config.getAccessKeyId(), "access key is required");
    requireText(config.getSecretAccessKey(), "secret key is required");
    requireText(config.getBucketName(), "bucket name is required");
    if (config.getBackendKind() == null) {
      throw new ClientCreationException("storage type is required");
    }

    var builder =
        S3Client.builder()
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(
                        config.getAccessKeyId(), config.getSecretAccessKey())))
            .requestChecksumCalculation(RequestChecksumCalculation.WHEN_REQUIRED)
            .responseChecksumValidation(ResponseChecksumValidation.WHEN_REQUIRED);

    if (config.getBackendKind().requiresEndpoint()) {
      builder
          .region(Region.of(hasText(config.getRegion()) ? config.getRegion() : DEFAULT_REGION))
          .endpointOverride(resolveEndpoint(config.getEndpointUrl(), config.isUseTls()))
          .serviceConfiguration(
              S3Configuration.builder()
                  .pathStyleAccessEnabled(config.getBackendKind().pathStyle())
                  .build());
    } else {
      requireText(config.getRegion(), "region is required for cloud storage");
      builder.region(Region.of(config.getRegion()));
    }

    try {
      return builder.build();
    } catch (SdkException | IllegalArgumentException e) {
      throw new ClientCreationException(e.getMessage(), e);
    }
  }

  @EventListener
  public void onConfigChanged(StorageConfigChangedEvent event) {
    String prefix = event.configId() + ":";
    var stale = clients.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    if (!stale.isEmpty()) {
      clients.invalidateAll(stale);
      log.debug(
          "Evicted storage clients: configId={}, change={}, count={}",
          event.configId(),
          event.changeType(),
          stale.size());
    }
  }

  @PreDestroy
  void closeAll() {
    clients.invalidateAll();
    clients.cleanUp();
  }

  long cachedClientCount() {
    clients.cleanUp();
    return clients.estimatedSize();
  }

  /**
   * Turns the configured endpoint into a base URI. A missing scheme is filled in, and an explicit
   * one is replaced, according to {@code useTls}.
   */
  static URI resolveEndpoint(String endpointUrl, boolean useTls) {
    if (!hasText(endpointUrl)) {
      throw new ClientCreationException("endpoint URL is required for self-hosted storage");
    }
    String scheme = useTls ? "https" : "http";
    String raw = endpointUrl.trim();
    int separator = raw.indexOf("://");
    if (separator >= 0) {
      String given = raw.substring(0, separator).toLowerCase(Locale.ROOT);
      if (!given.equals("http") && !given.equals("https")) {
        throw new ClientCreationException("Unsupported endpoint scheme: " + given);
      }
      raw = raw.substring(separator + 3);
    }
    try {
      var uri = new URI(scheme + "://" + raw);
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new ClientCreationException("Endpoint URL has no host: " + endpointUrl);
      }
      if (uri.getQuery() != null || uri.getFragment() != null) {
        throw new ClientCreationException("Endpoint URL must be a base URL: " + endpointUrl);
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new ClientCreationException("Malformed endpoint URL: " + endpointUrl, e);
    }
  }

  static String cacheKey(StorageConfig config) {
    return config.getId() + ":" + fingerprint(config);
  }

  private static String fingerprint(StorageConfig config) {
    String material =
        String.join(
            "\n",
            String.valueOf(config.getBackendKind()),
            String.valueOf(config.getAccessKeyId()),
            String.valueOf(config.getSecretAccessKey()),
            String.valueOf(config.getRegion()),
            String.valueOf(config.getBucketName()),
            String.valueOf(config.getEndpointUrl()),
            String.valueOf(config.isUseTls()));
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static void requireText(String value, String problem) {
    if (!hasText(value)) {
      throw new ClientCreationException(problem);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
