package io.b2mash.s3manager.provisioning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Administrative access to the self-hosted backend used for auto-provisioning, bound once from
 * {@code storage.admin-backend.*}.
 *
 * @param adminUrl base URL of the backend's admin API
 * @param accessKey admin access key
 * @param secretKey admin secret key
 * @param endpoint endpoint written into provisioned configurations
 * @param region region written into provisioned configurations
 * @param useTls TLS flag written into provisioned configurations
 */
@ConfigurationProperties("storage.admin-backend")
public record AdminBackendConfig(
    @DefaultValue("http://localhost:9000") String adminUrl,
    @DefaultValue("minioadmin") String accessKey,
    @DefaultValue("minioadmin") String secretKey,
    @DefaultValue("localhost:9000") String endpoint,
    @DefaultValue("us-east-1") String region,
    @DefaultValue("false") boolean useTls) {}
