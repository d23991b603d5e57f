package io.b2mash.s3manager.provisioning;

import io.minio.admin.MinioAdminClient;
import io.minio.admin.UserInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link BackendUserAdmin} backed by the MinIO admin API. Failures are logged and tolerated, so a
 * user or policy left over from an earlier run does not block provisioning.
 */
@Component
public class MinioBackendUserAdmin implements BackendUserAdmin {

  private static final Logger log = LoggerFactory.getLogger(MinioBackendUserAdmin.class);

  private final MinioAdminClient adminClient;

  public MinioBackendUserAdmin(AdminBackendConfig adminBackendConfig) {
    this.adminClient =
        MinioAdminClient.builder()
            .endpoint(adminBackendConfig.adminUrl())
            .credentials(adminBackendConfig.accessKey(), adminBackendConfig.secretKey())
            .build();
  }

  @Override
  public void createUser(String accessKey, String secretKey) {
    try {
      adminClient.addUser(accessKey, UserInfo.Status.ENABLED, secretKey, null, null);
      log.info("Created backend user: accessKey={}", accessKey);
    } catch (Exception e) {
      log.warn(
          "Failed to create backend user (may already exist): accessKey={}, reason={}",
          accessKey,
          e.getMessage());
    }
  }

  @Override
  public void createPolicy(String policyName, String policyDocument) {
    try {
      adminClient.addCannedPolicy(policyName, policyDocument);
      log.info("Created backend policy: name={}", policyName);
    } catch (Exception e) {
      log.warn(
          "Failed to create backend policy (may already exist): name={}, reason={}",
          policyName,
          e.getMessage());
    }
  }

  @Override
  public void attachPolicy(String accessKey, String policyName) {
    try {
      adminClient.setPolicy(accessKey, false, policyName);
    } catch (Exception e) {
      log.warn(
          "Failed to attach backend policy: accessKey={}, policy={}, reason={}",
          accessKey,
          policyName,
          e.getMessage());
    }
  }
}
