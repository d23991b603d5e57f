package io.b2mash.s3manager.storageconfig;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class StorageConfigTest {

  private static final Instant CREATED = Instant.parse("2024-01-15T10:00:00Z");

  private StorageConfig stored() {
    var config =
        new StorageConfig(
            "cfg-1",
            "owner_1",
            new StorageConfigDraft(
                "MinIO",
                BackendKind.SELF_HOSTED,
                "AKIA1234",
                "original-secret",
                "us-east-1",
                "bucket",
                "localhost:9000",
                false),
            CREATED);
    config.markDefault();
    return config;
  }

  @Test
  void merge_keepsSecretWhenPatchOmitsIt() {
    var config = stored();

    var merged =
        config.merge(new StorageConfigPatch("Renamed", null, null, null, null, null, null, null));

    assertThat(merged.displayName()).isEqualTo("Renamed");
    assertThat(merged.secretAccessKey()).isEqualTo("original-secret");
    assertThat(merged.bucketName()).isEqualTo("bucket");
  }

  @Test
  void merge_treatsEmptySecretAsUnchanged() {
    var merged =
        stored().merge(new StorageConfigPatch(null, null, null, "", null, null, null, true));

    assertThat(merged.secretAccessKey()).isEqualTo("original-secret");
    assertThat(merged.useTls()).isTrue();
  }

  @Test
  void preview_isDetachedAndKeepsIdentity() {
    var config = stored();

    var preview =
        config.preview(new StorageConfigPatch(null, null, null, "rotated", null, null, null, null));

    assertThat(preview).isNotSameAs(config);
    assertThat(preview.getId()).isEqualTo("cfg-1");
    assertThat(preview.getOwnerId()).isEqualTo("owner_1");
    assertThat(preview.getCreatedAt()).isEqualTo(CREATED);
    assertThat(preview.isDefault()).isTrue();
    assertThat(preview.getSecretAccessKey()).isEqualTo("rotated");
    assertThat(config.getSecretAccessKey()).isEqualTo("original-secret");
  }

  @Test
  void apply_neverChangesIdentityOrDefaultFlag() {
    var config = stored();

    config.apply(
        new StorageConfigDraft(
            "AWS", BackendKind.CLOUD, "AKIA9999", "new", "eu-west-1", "other", null, true));

    assertThat(config.getId()).isEqualTo("cfg-1");
    assertThat(config.getOwnerId()).isEqualTo("owner_1");
    assertThat(config.getCreatedAt()).isEqualTo(CREATED);
    assertThat(config.isDefault()).isTrue();
    assertThat(config.getBackendKind()).isEqualTo(BackendKind.CLOUD);
  }
}
