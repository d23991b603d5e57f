package io.b2mash.s3manager.storage.dto;

import java.time.Instant;

/**
 * An object in the caller's namespace. {@code key} is the logical filename; {@code fullKey} is the
 * backend key including the owner prefix.
 */
public record StoredObject(String key, String fullKey, long size, Instant lastModified) {}
