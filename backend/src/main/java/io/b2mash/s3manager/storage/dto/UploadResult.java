package io.b2mash.s3manager.storage.dto;

/**
 * Outcome of an upload.
 *
 * @param key the logical filename the object was stored under
 * @param size bytes written
 * @param multipart whether the multipart protocol was used
 * @param parts number of parts, 1 for a single put
 */
public record UploadResult(String key, long size, boolean multipart, int parts) {}
