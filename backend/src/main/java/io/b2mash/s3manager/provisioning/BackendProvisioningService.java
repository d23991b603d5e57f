package io.b2mash.s3manager.provisioning;

import io.b2mash.s3manager.storage.StorageClientProvider;
import io.b2mash.s3manager.storageconfig.BackendKind;
import io.b2mash.s3manager.storageconfig.StorageConfig;
import io.b2mash.s3manager.storageconfig.StorageConfigDraft;
import io.b2mash.s3manager.storageconfig.StorageConfigService;
import java.security.SecureRandom;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.BucketAlreadyExistsException;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;

/**
 * Gives an owner a ready-made configuration on the self-hosted backend: a dedicated user, a policy
 * limited to one bucket, the bucket itself, and a stored configuration that becomes the owner's
 * default.
 *
 * <p>Names derive from the first eight characters of the owner id, so provisioning the same owner
 * twice targets the same user and bucket with a fresh secret.
 */
@Service
public class BackendProvisioningService {

  private static final Logger log = LoggerFactory.getLogger(BackendProvisioningService.class);

  private static final String SECRET_ALPHABET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  static final int SECRET_LENGTH = 32;
  private static final int SUFFIX_LENGTH = 8;

  private static final String POLICY_TEMPLATE =
      """
      {
        "Version": "2012-10-17",
        "Statement": [
          {
            "Effect": "Allow",
            "Action": ["s3:GetObject", "s3:PutObject", "s3:DeleteObject", "s3:ListBucket"],
            "Resource": ["arn:aws:s3:::%1$s", "arn:aws:s3:::%1$s/*"]
          }
        ]
      }
      """;

  private final AdminBackendConfig adminBackendConfig;
  private final BackendUserAdmin backendUserAdmin;
  private final StorageClientProvider clientProvider;
  private final StorageConfigService storageConfigService;
  private final SecureRandom secureRandom = new SecureRandom();

  public BackendProvisioningService(
      AdminBackendConfig adminBackendConfig,
      BackendUserAdmin backendUserAdmin,
      StorageClientProvider clientProvider,
      StorageConfigService storageConfigService) {
    this.adminBackendConfig = adminBackendConfig;
    this.backendUserAdmin = backendUserAdmin;
    this.clientProvider = clientProvider;
    this.storageConfigService = storageConfigService;
  }

  public StorageConfig provision(String ownerId, String username) {
    String suffix =
        ownerId.length() > SUFFIX_LENGTH ? ownerId.substring(0, SUFFIX_LENGTH) : ownerId;
    String accessKey = "s3mgr_" + suffix;
    String bucket = bucketName(suffix);
    String policyName = "s3mgr-policy-" + suffix;
    String secretKey = randomSecret();

    log.info("Provisioning backend storage: owner={}, bucket={}", ownerId, bucket);
    backendUserAdmin.createUser(accessKey, secretKey);
    backendUserAdmin.createPolicy(policyName, POLICY_TEMPLATE.formatted(bucket));
    backendUserAdmin.attachPolicy(accessKey, policyName);
    createBucket(ownerId, bucket);

    var draft =
        new StorageConfigDraft(
            "MinIO Default (" + username + ")",
            BackendKind.SELF_HOSTED,
            accessKey,
            secretKey,
            adminBackendConfig.region(),
            bucket,
            adminBackendConfig.endpoint(),
            adminBackendConfig.useTls());
    return storageConfigService.createAsDefault(ownerId, draft);
  }

  private void createBucket(String ownerId, String bucket) {
    var adminDraft =
        new StorageConfigDraft(
            "admin",
            BackendKind.SELF_HOSTED,
            adminBackendConfig.accessKey(),
            adminBackendConfig.secretKey(),
            adminBackendConfig.region(),
            bucket,
            adminBackendConfig.endpoint(),
            adminBackendConfig.useTls());
    try (var client = clientProvider.openClient(new StorageConfig(ownerId, adminDraft))) {
      client.createBucket(r -> r.bucket(bucket));
      log.info("Created bucket: {}", bucket);
    } catch (BucketAlreadyOwnedByYouException | BucketAlreadyExistsException e) {
      log.warn("Bucket already exists: {}", bucket);
    } catch (SdkException e) {
      log.warn(
          "Failed to create bucket with admin credentials: bucket={}, reason={}",
          bucket,
          e.getMessage());
    }
  }

  /** Bucket names allow only lower-case letters, digits and hyphens here. */
  static String bucketName(String suffix) {
    String sanitized = suffix.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
    return "s3mgr-" + sanitized;
  }

  private String randomSecret() {
    var secret = new StringBuilder(SECRET_LENGTH);
    for (int i = 0; i < SECRET_LENGTH; i++) {
      secret.append(SECRET_ALPHABET.charAt(secureRandom.nextInt(SECRET_ALPHABET.length())));
    }
    return secret.toString();
  }
}
