package io.b2mash.s3manager.storageconfig;

import io.b2mash.s3manager.exception.InvalidStateException;
import java.util.Locale;

public enum ExchangeFormat {
  CSV,
  JSON;

  /** Parses the {@code format} query parameter. Defaults to CSV when absent. */
  public static ExchangeFormat fromParameter(String value) {
    if (value == null || value.isBlank()) {
      return CSV;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "csv" -> CSV;
      case "json" -> JSON;
      default -> throw new InvalidStateException(
          "Unsupported format", "Format must be csv or json, got: " + value);
    };
  }
}
