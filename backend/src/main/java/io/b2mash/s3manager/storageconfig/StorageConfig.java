package io.b2mash.s3manager.storageconfig;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One tenant's binding to one bucket of an object-storage backend. The secret access key is
 * encrypted at rest.
 */
@Entity
@Table(name = "storage_configs")
public class StorageConfig {

  @Id
  @Column(name = "id", nullable = false, updatable = false, length = 64)
  private String id;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private String ownerId;

  @Column(name = "display_name", nullable = false)
  private String displayName;

  @Enumerated(EnumType.STRING)
  @Column(name = "backend_kind", nullable = false, length = 20)
  private BackendKind backendKind;

  @Column(name = "access_key_id", nullable = false)
  private String accessKeyId;

  @Convert(converter = EncryptedStringConverter.class)
  @Column(name = "secret_access_key", nullable = false, length = 1024)
  private String secretAccessKey;

  @Column(name = "region", length = 64)
  private String region;

  @Column(name = "bucket_name", nullable = false)
  private String bucketName;

  @Column(name = "endpoint_url", length = 1024)
  private String endpointUrl;

  @Column(name = "use_tls", nullable = false)
  private boolean useTls;

  @Column(name = "is_default", nullable = false)
  private boolean isDefault;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected StorageConfig() {}

  public StorageConfig(String ownerId, StorageConfigDraft draft) {
    this(UUID.randomUUID().toString(), ownerId, draft, Instant.now());
  }

  /** Restores a record with a known id and creation time, as carried by an import file. */
  public StorageConfig(String id, String ownerId, StorageConfigDraft draft, Instant createdAt) {
    this.id = id;
    this.ownerId = ownerId;
    this.createdAt = createdAt;
    apply(draft);
  }

  /** Replaces every mutable field. Identity, owner, creation time and the default flag are kept. */
  public void apply(StorageConfigDraft draft) {
    this.displayName = draft.displayName();
    this.backendKind = draft.backendKind();
    this.accessKeyId = draft.accessKeyId();
    this.secretAccessKey = draft.secretAccessKey();
    this.region = draft.region();
    this.bucketName = draft.bucketName();
    this.endpointUrl = draft.endpointUrl();
    this.useTls = draft.useTls();
    this.updatedAt = Instant.now();
  }

  /** Field-merges a patch over the current values. */
  public StorageConfigDraft merge(StorageConfigPatch patch) {
    return new StorageConfigDraft(
        patch.displayName() != null ? patch.displayName() : displayName,
        patch.backendKind() != null ? patch.backendKind() : backendKind,
        patch.accessKeyId() != null ? patch.accessKeyId() : accessKeyId,
        patch.secretAccessKey() != null && !patch.secretAccessKey().isEmpty()
            ? patch.secretAccessKey()
            : secretAccessKey,
        patch.region() != null ? patch.region() : region,
        patch.bucketName() != null ? patch.bucketName() : bucketName,
        patch.endpointUrl() != null ? patch.endpointUrl() : endpointUrl,
        patch.useTls() != null ? patch.useTls() : useTls);
  }

  /**
   * Returns a detached copy with the patch applied, for validating an update before it is stored.
   */
  public StorageConfig preview(StorageConfigPatch patch) {
    var copy = new StorageConfig(id, ownerId, merge(patch), createdAt);
    copy.isDefault = isDefault;
    return copy;
  }

  public StorageConfigDraft toDraft() {
    return new StorageConfigDraft(
        displayName,
        backendKind,
        accessKeyId,
        secretAccessKey,
        region,
        bucketName,
        endpointUrl,
        useTls);
  }

  public void markDefault() {
    if (!isDefault) {
      this.isDefault = true;
      this.updatedAt = Instant.now();
    }
  }

  public void clearDefault() {
    if (isDefault) {
      this.isDefault = false;
      this.updatedAt = Instant.now();
    }
  }

  public boolean isOwnedBy(String userId) {
    return ownerId.equals(userId);
  }

  public String getId() {
    return id;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public BackendKind getBackendKind() {
    return backendKind;
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public String getSecretAccessKey() {
    return secretAccessKey;
  }

  public String getRegion() {
    return region;
  }

  public String getBucketName() {
    return bucketName;
  }

  public String getEndpointUrl() {
    return endpointUrl;
  }

  public boolean isUseTls() {
    return useTls;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
