package io.b2mash.s3manager.storageconfig;

import io.b2mash.s3manager.exception.InvalidStateException;
import io.b2mash.s3manager.storageconfig.dto.ImportResult;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/admin/configs")
@PreAuthorize("hasRole('ADMIN')")
public class StorageConfigAdminController {

  private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

  private final StorageConfigExchangeService exchangeService;

  public StorageConfigAdminController(StorageConfigExchangeService exchangeService) {
    this.exchangeService = exchangeService;
  }

  @GetMapping("/export")
  public ResponseEntity<byte[]> export(@RequestParam(required = false) String format) {
    var exchangeFormat = ExchangeFormat.fromParameter(format);
    byte[] body = exchangeService.export(exchangeFormat);
    String filename = exchangeFormat == ExchangeFormat.JSON ? "configs.json" : "configs.csv";
    return ResponseEntity.ok()
        .contentType(
            exchangeFormat == ExchangeFormat.JSON ? MediaType.APPLICATION_JSON : TEXT_CSV)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(body);
  }

  @PostMapping("/import")
  public ResponseEntity<ImportResult> importConfigs(
      @RequestParam(required = false) String format, @RequestParam("file") MultipartFile file) {
    var exchangeFormat = ExchangeFormat.fromParameter(format);
    try (InputStream input = file.getInputStream()) {
      return ResponseEntity.ok(exchangeService.importConfigs(input, exchangeFormat));
    } catch (IOException e) {
      throw new InvalidStateException("Invalid import file", "Could not read uploaded file");
    }
  }
}
