package io.b2mash.s3manager.storageconfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BackendKindTest {

  @Test
  void fromWireName_acceptsAliasesCaseInsensitively() {
    assertThat(BackendKind.fromWireName("aws")).isEqualTo(BackendKind.CLOUD);
    assertThat(BackendKind.fromWireName("S3")).isEqualTo(BackendKind.CLOUD);
    assertThat(BackendKind.fromWireName(" MinIO ")).isEqualTo(BackendKind.SELF_HOSTED);
    assertThat(BackendKind.fromWireName("self-hosted")).isEqualTo(BackendKind.SELF_HOSTED);
  }

  @Test
  void fromWireName_rejectsUnknownKinds() {
    assertThatThrownBy(() -> BackendKind.fromWireName("gcs"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BackendKind.fromWireName(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void addressingFollowsKind() {
    assertThat(BackendKind.SELF_HOSTED.pathStyle()).isTrue();
    assertThat(BackendKind.SELF_HOSTED.requiresEndpoint()).isTrue();
    assertThat(BackendKind.CLOUD.pathStyle()).isFalse();
    assertThat(BackendKind.CLOUD.requiresEndpoint()).isFalse();
    assertThat(BackendKind.CLOUD.wireName()).isEqualTo("aws");
  }
}
