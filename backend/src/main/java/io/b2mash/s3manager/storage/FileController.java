package io.b2mash.s3manager.storage;

import io.b2mash.s3manager.exception.InvalidStateException;
import io.b2mash.s3manager.security.Caller;
import io.b2mash.s3manager.storage.dto.ObjectPage;
import io.b2mash.s3manager.storage.dto.UploadResult;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/files")
public class FileController {

  private final StorageTransferService storageTransferService;

  public FileController(StorageTransferService storageTransferService) {
    this.storageTransferService = storageTransferService;
  }

  @GetMapping
  public ResponseEntity<ObjectPage> list(
      JwtAuthenticationToken auth,
      @RequestParam(required = false) String configId,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "10") int pageSize) {
    return ResponseEntity.ok(
        storageTransferService.list(Caller.from(auth).userId(), configId, page, pageSize));
  }

  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResult> upload(
      JwtAuthenticationToken auth,
      @RequestParam("file") MultipartFile file,
      @RequestParam(required = false) String configId) {
    try (InputStream content = file.getInputStream()) {
      return ResponseEntity.ok(
          storageTransferService.upload(
              Caller.from(auth).userId(),
              configId,
              file.getOriginalFilename(),
              content,
              file.getSize(),
              file.getContentType()));
    } catch (IOException e) {
      throw new InvalidStateException("File unreadable", "Could not read the uploaded file");
    }
  }

  @GetMapping("/download/{filename}")
  public ResponseEntity<InputStreamResource> download(
      JwtAuthenticationToken auth,
      @PathVariable String filename,
      @RequestParam(required = false) String configId) {
    var object = storageTransferService.download(Caller.from(auth).userId(), configId, filename);

    var headers = new HttpHeaders();
    headers.setContentDisposition(ContentDisposition.attachment().filename(filename).build());
    headers.setContentType(
        object.contentType() != null
            ? MediaType.parseMediaType(object.contentType())
            : MediaType.APPLICATION_OCTET_STREAM);
    if (object.contentLength() != null) {
      headers.setContentLength(object.contentLength());
    }
    return ResponseEntity.ok().headers(headers).body(new InputStreamResource(object.body()));
  }

  @DeleteMapping("/{filename}")
  public ResponseEntity<Void> delete(
      JwtAuthenticationToken auth,
      @PathVariable String filename,
      @RequestParam(required = false) String configId) {
    storageTransferService.delete(Caller.from(auth).userId(), configId, filename);
    return ResponseEntity.noContent().build();
  }
}
