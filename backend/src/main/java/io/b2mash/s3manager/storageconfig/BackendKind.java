package io.b2mash.s3manager.storageconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The family of object-storage service a configuration points at. Each kind fixes how the bucket is
 * addressed and whether the configuration's TLS flag is honoured.
 */
public enum BackendKind {

  /** Public cloud S3: virtual-hosted addressing, regional endpoint, always HTTPS. */
  CLOUD("aws", false, false),

  /** S3-compatible server (MinIO and friends): path-style addressing against an explicit URL. */
  SELF_HOSTED("minio", true, true);

  private final String wireName;
  private final boolean pathStyle;
  private final boolean selfAddressed;

  BackendKind(String wireName, boolean pathStyle, boolean selfAddressed) {
    this.wireName = wireName;
    this.pathStyle = pathStyle;
    this.selfAddressed = selfAddressed;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Whether the bucket goes into the URL path rather than the host name. */
  public boolean pathStyle() {
    return pathStyle;
  }

  /**
   * Whether the configuration must carry its own endpoint URL. Only these kinds honour the {@code
   * useTls} flag; cloud endpoints are always reached over HTTPS.
   */
  public boolean requiresEndpoint() {
    return selfAddressed;
  }

  /**
   * Parses the external name used in requests and import files. Accepts {@code aws}/{@code cloud}
   * and {@code minio}/{@code self-hosted}, case-insensitively.
   */
  @JsonCreator
  public static BackendKind fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Backend kind must not be blank");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "aws", "cloud", "s3" -> CLOUD;
      case "minio", "self-hosted", "self_hosted", "selfhosted" -> SELF_HOSTED;
      default -> throw new IllegalArgumentException("Unknown backend kind: " + value);
    };
  }
}
