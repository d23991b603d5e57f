package io.b2mash.s3manager.provisioning;

/**
 * User and policy administration on a self-hosted backend. Implementations treat "already exists"
 * as success and must not throw for it.
 */
public interface BackendUserAdmin {

  void createUser(String accessKey, String secretKey);

  void createPolicy(String policyName, String policyDocument);

  void attachPolicy(String accessKey, String policyName);
}
