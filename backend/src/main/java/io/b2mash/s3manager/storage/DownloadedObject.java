package io.b2mash.s3manager.storage;

import java.io.InputStream;

/**
 * An object body being streamed from the backend. The caller must close {@code body}.
 *
 * @param contentType as reported by the backend, or null
 * @param contentLength as reported by the backend, or null
 */
public record DownloadedObject(
    String filename, String contentType, Long contentLength, InputStream body) {}
