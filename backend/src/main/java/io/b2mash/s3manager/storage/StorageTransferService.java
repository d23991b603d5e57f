package io.b2mash.s3manager.storage;

import io.b2mash.s3manager.audit.AuditEventBuilder;
import io.b2mash.s3manager.audit.AuditService;
import io.b2mash.s3manager.storage.dto.ObjectPage;
import io.b2mash.s3manager.storage.dto.StoredObject;
import io.b2mash.s3manager.storage.dto.UploadResult;
import io.b2mash.s3manager.storageconfig.StorageConfig;
import io.b2mash.s3manager.storageconfig.StorageConfigService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Object operations under an owner's key namespace, against the configuration the owner names or
 * their default one.
 *
 * <p>Uploads of {@value #MULTIPART_THRESHOLD} bytes or more go through the multipart protocol in
 * {@value #PART_SIZE}-byte parts, uploaded one after another so only one part buffer is held at a
 * time. Any failure after initiation aborts the session before the error is rethrown.
 */
@Service
public class StorageTransferService {

  private static final Logger log = LoggerFactory.getLogger(StorageTransferService.class);

  public static final int MULTIPART_THRESHOLD = 5 * 1024 * 1024;
  public static final int PART_SIZE = 5 * 1024 * 1024;

  static final int DEFAULT_PAGE_SIZE = 10;
  static final int MAX_PAGE_SIZE = 100;

  private final StorageConfigService storageConfigService;
  private final StorageClientProvider clientProvider;
  private final AuditService auditService;

  public StorageTransferService(
      StorageConfigService storageConfigService,
      StorageClientProvider clientProvider,
      AuditService auditService) {
    this.storageConfigService = storageConfigService;
    this.clientProvider = clientProvider;
    this.auditService = auditService;
  }

  /**
   * Lists the owner's objects and returns one page of them. Out-of-range page numbers and sizes are
   * clamped; a page past the end is empty.
   */
  public ObjectPage list(String ownerId, String configId, int page, int pageSize) {
    int safePage = Math.max(page, 1);
    int safePageSize = pageSize < 1 || pageSize > MAX_PAGE_SIZE ? DEFAULT_PAGE_SIZE : pageSize;

    var config = storageConfigService.resolve(ownerId, configId);
    var client = clientProvider.clientFor(config);
    String prefix = ObjectKeyNamespace.prefixFor(ownerId);

    var files = new ArrayList<StoredObject>();
    try {
      String continuationToken = null;
      do {
        var request =
            ListObjectsV2Request.builder()
                .bucket(config.getBucketName())
                .prefix(prefix)
                .continuationToken(continuationToken)
                .build();
        var response = client.listObjectsV2(request);
        for (var object : response.contents()) {
          String name = ObjectKeyNamespace.logicalName(ownerId, object.key());
          if (name.isEmpty()) {
            continue;
          }
          files.add(
              new StoredObject(
                  name,
                  object.key(),
                  object.size() != null ? object.size() : 0L,
                  object.lastModified()));
        }
        continuationToken =
            Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      } while (continuationToken != null);
    } catch (SdkException e) {
      throw new BackendOperationException(
          TransferStage.LIST, "Failed to list files: " + e.getMessage(), e);
    }

    int total = files.size();
    int start = (int) Math.min((long) (safePage - 1) * safePageSize, total);
    int end = (int) Math.min((long) start + safePageSize, total);
    return new ObjectPage(
        List.copyOf(files.subList(start, end)),
        total,
        safePage,
        safePageSize,
        config.getId(),
        config.getDisplayName());
  }

  /**
   * Stores {@code content} under the owner's namespace. {@code size} picks the strategy: a single
   * put below the multipart threshold, the multipart protocol at or above it.
   */
  public UploadResult upload(
      String ownerId,
      String configId,
      String filename,
      InputStream content,
      long size,
      String contentType) {
    var details = new LinkedHashMap<String, Object>();
    details.put("filename", filename);
    details.put("size", size);

    var target = resolveTarget("file.upload", ownerId, configId, filename, details);
    String key = target.key();
    var config = target.config();
    var client = target.client();
    try {
      UploadResult result;
      if (size >= MULTIPART_THRESHOLD) {
        result = uploadMultipart(client, config, key, filename, content, contentType);
        details.put("stage", TransferStage.COMPLETE.wireName());
      } else {
        result = putObject(client, config, key, filename, content, size, contentType);
        details.put("stage", TransferStage.PUT.wireName());
      }
      details.put("parts", result.parts());
      auditFile("file.upload", key, details, null);
      log.info(
          "Uploaded file: key={}, size={}, multipart={}, parts={}",
          key,
          result.size(),
          result.multipart(),
          result.parts());
      return result;
    } catch (BackendOperationException e) {
      details.put("stage", e.getStage().wireName());
      if (e.getPartNumber() != null) {
        details.put("part_number", e.getPartNumber());
      }
      auditFile("file.upload", key, details, e);
      throw e;
    }
  }

  private UploadResult putObject(
      S3Client client,
      StorageConfig config,
      String key,
      String filename,
      InputStream content,
      long size,
      String contentType) {
    try {
      client.putObject(
          r -> r.bucket(config.getBucketName()).key(key).contentType(contentType),
          RequestBody.fromInputStream(content, size));
    } catch (SdkException | UncheckedIOException e) {
      throw new BackendOperationException(
          TransferStage.PUT, "Failed to upload file: " + e.getMessage(), e);
    }
    return new UploadResult(filename, size, false, 1);
  }

  private UploadResult uploadMultipart(
      S3Client client,
      StorageConfig config,
      String key,
      String filename,
      InputStream content,
      String contentType) {
    var session = new MultipartUploadSession(client, config.getBucketName(), key);
    session.initiate(contentType);

    long uploaded = 0;
    try {
      byte[] buffer = new byte[PART_SIZE];
      while (true) {
        int read = readPart(content, buffer, session.getNextPartNumber());
        if (read == 0) {
          break;
        }
        session.uploadPart(buffer, read);
        uploaded += read;
        if (read < PART_SIZE) {
          break;
        }
      }
      if (session.getPartCount() == 0) {
        throw BackendOperationException.forPart(
            TransferStage.READ_PART, 1, "Upload stream contained no data", null);
      }
      session.complete();
    } catch (RuntimeException e) {
      session.abort(e);
      throw e;
    }
    return new UploadResult(filename, uploaded, true, session.getPartCount());
  }

  private static int readPart(InputStream content, byte[] buffer, int partNumber) {
    try {
      return content.readNBytes(buffer, 0, buffer.length);
    } catch (IOException e) {
      throw BackendOperationException.forPart(
          TransferStage.READ_PART,
          partNumber,
          "Failed to read file part " + partNumber + ": " + e.getMessage(),
          e);
    }
  }

  /**
   * Opens the object for streaming. A missing object fails with 404 rather than a generic backend
   * error.
   */
  public DownloadedObject download(String ownerId, String configId, String filename) {
    var details = new LinkedHashMap<String, Object>();
    details.put("filename", filename);

    var target = resolveTarget("file.download", ownerId, configId, filename, details);
    String key = target.key();
    var config = target.config();
    var client = target.client();
    details.put("stage", TransferStage.GET.wireName());
    try {
      var stream = client.getObject(r -> r.bucket(config.getBucketName()).key(key));
      var response = stream.response();
      details.put("size", response.contentLength() != null ? response.contentLength() : 0L);
      auditFile("file.download", key, details, null);
      return new DownloadedObject(
          filename, response.contentType(), response.contentLength(), stream);
    } catch (NoSuchKeyException e) {
      var failure =
          new BackendOperationException(
              TransferStage.GET, HttpStatus.NOT_FOUND, "File not found: " + filename, e);
      auditFile("file.download", key, details, failure);
      throw failure;
    } catch (S3Exception e) {
      var failure =
          e.statusCode() == HttpStatus.NOT_FOUND.value()
              ? new BackendOperationException(
                  TransferStage.GET, HttpStatus.NOT_FOUND, "File not found: " + filename, e)
              : new BackendOperationException(
                  TransferStage.GET, "Failed to download file: " + e.getMessage(), e);
      auditFile("file.download", key, details, failure);
      throw failure;
    } catch (SdkException e) {
      var failure =
          new BackendOperationException(
              TransferStage.GET, "Failed to download file: " + e.getMessage(), e);
      auditFile("file.download", key, details, failure);
      throw failure;
    }
  }

  /** Deletes the object. Deleting a key that does not exist succeeds. */
  public void delete(String ownerId, String configId, String filename) {
    var details = new LinkedHashMap<String, Object>();
    details.put("filename", filename);

    var target = resolveTarget("file.delete", ownerId, configId, filename, details);
    String key = target.key();
    var config = target.config();
    var client = target.client();
    details.put("stage", TransferStage.DELETE.wireName());
    try {
      client.deleteObject(r -> r.bucket(config.getBucketName()).key(key));
    } catch (SdkException e) {
      var failure =
          new BackendOperationException(
              TransferStage.DELETE, "Failed to delete file: " + e.getMessage(), e);
      auditFile("file.delete", key, details, failure);
      throw failure;
    }
    auditFile("file.delete", key, details, null);
    log.info("Deleted file: key={}", key);
  }

  /**
   * Checks that the configuration's credentials can list its bucket. Used before a configuration is
   * stored or changed, so a failure is reported as a bad request.
   */
  public void verifyConnectivity(StorageConfig config) {
    try (var client = clientProvider.openClient(config)) {
      client.listObjectsV2(r -> r.bucket(config.getBucketName()).maxKeys(1));
    } catch (SdkException e) {
      log.warn(
          "Storage connectivity check failed: bucket={}, reason={}",
          config.getBucketName(),
          e.getMessage());
      throw new BackendOperationException(
          TransferStage.CONNECT,
          HttpStatus.BAD_REQUEST,
          "Failed to connect to storage: " + e.getMessage(),
          e);
    }
  }

  /**
   * Computes the key and resolves the configuration and client for a file operation. A failure
   * here is audited under {@code action} with stage {@code resolve} before it is rethrown.
   */
  private TransferTarget resolveTarget(
      String action,
      String ownerId,
      String configId,
      String filename,
      Map<String, Object> details) {
    String key = null;
    try {
      key = ObjectKeyNamespace.keyFor(ownerId, filename);
      var config = storageConfigService.resolve(ownerId, configId);
      details.put("config_id", config.getId());
      return new TransferTarget(key, config, clientProvider.clientFor(config));
    } catch (RuntimeException e) {
      details.put("stage", TransferStage.RESOLVE.wireName());
      if (configId != null) {
        details.putIfAbsent("config_id", configId);
      }
      auditFile(action, key != null ? key : ObjectKeyNamespace.prefixFor(ownerId), details, e);
      throw e;
    }
  }

  private record TransferTarget(String key, StorageConfig config, S3Client client) {}

  private void auditFile(
      String action, String key, Map<String, Object> details, RuntimeException failure) {
    var builder =
        AuditEventBuilder.builder()
            .action(action)
            .resource("file")
            .resourceId(key)
            .details(Map.copyOf(details));
    if (failure != null) {
      builder.failure(failure);
    }
    auditService.log(builder.build());
  }
}
