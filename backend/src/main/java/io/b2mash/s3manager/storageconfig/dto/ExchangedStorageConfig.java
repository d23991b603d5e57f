package io.b2mash.s3manager.storageconfig.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.b2mash.s3manager.storageconfig.StorageConfig;
import java.util.Map;

/**
 * One configuration in the admin export/import format, secret included. Column order is fixed for
 * CSV files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
  "id",
  "user_id",
  "name",
  "access_key",
  "secret_key",
  "region",
  "bucket_name",
  "endpoint_url",
  "use_ssl",
  "storage_type",
  "is_default",
  "created_at",
  "updated_at"
})
public record ExchangedStorageConfig(
    @JsonProperty("id") String id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("name") String name,
    @JsonProperty("access_key") String accessKey,
    @JsonProperty("secret_key") String secretKey,
    @JsonProperty("region") String region,
    @JsonProperty("bucket_name") String bucketName,
    @JsonProperty("endpoint_url") String endpointUrl,
    @JsonProperty("use_ssl") Boolean useSsl,
    @JsonProperty("storage_type") String storageType,
    @JsonProperty("is_default") Boolean isDefault,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt) {

  public static ExchangedStorageConfig from(StorageConfig config) {
    return new ExchangedStorageConfig(
        config.getId(),
        config.getOwnerId(),
        config.getDisplayName(),
        config.getAccessKeyId(),
        config.getSecretAccessKey(),
        config.getRegion(),
        config.getBucketName(),
        config.getEndpointUrl(),
        config.isUseTls(),
        config.getBackendKind().wireName(),
        config.isDefault(),
        config.getCreatedAt().toString(),
        config.getUpdatedAt().toString());
  }

  /** Reads a CSV row keyed by header name. Missing columns become null. */
  public static ExchangedStorageConfig fromCsvRow(Map<String, String> row) {
    return new ExchangedStorageConfig(
        row.get("id"),
        row.get("user_id"),
        row.get("name"),
        row.get("access_key"),
        row.get("secret_key"),
        row.get("region"),
        row.get("bucket_name"),
        row.get("endpoint_url"),
        parseFlag(row.get("use_ssl")),
        row.get("storage_type"),
        parseFlag(row.get("is_default")),
        row.get("created_at"),
        row.get("updated_at"));
  }

  private static Boolean parseFlag(String value) {
    return value == null || value.isBlank() ? null : Boolean.parseBoolean(value.trim());
  }
}
