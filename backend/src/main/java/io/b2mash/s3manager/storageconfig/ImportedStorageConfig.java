package io.b2mash.s3manager.storageconfig;

import java.time.Instant;

/** A record read from an import file that passed the acceptance check. */
public record ImportedStorageConfig(
    String id, StorageConfigDraft draft, boolean isDefault, Instant createdAt) {}
