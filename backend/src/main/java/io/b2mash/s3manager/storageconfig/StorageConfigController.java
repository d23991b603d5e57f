package io.b2mash.s3manager.storageconfig;

import io.b2mash.s3manager.security.Caller;
import io.b2mash.s3manager.storageconfig.dto.CreateStorageConfigRequest;
import io.b2mash.s3manager.storageconfig.dto.StorageConfigResponse;
import io.b2mash.s3manager.storageconfig.dto.StorageConfigSummary;
import io.b2mash.s3manager.storageconfig.dto.UpdateStorageConfigRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/configs")
public class StorageConfigController {

  private final StorageConfigService storageConfigService;
  private final StorageConfigOrchestrationService orchestrationService;

  public StorageConfigController(
      StorageConfigService storageConfigService,
      StorageConfigOrchestrationService orchestrationService) {
    this.storageConfigService = storageConfigService;
    this.orchestrationService = orchestrationService;
  }

  @GetMapping
  public ResponseEntity<List<StorageConfigSummary>> list(JwtAuthenticationToken auth) {
    return ResponseEntity.ok(storageConfigService.list(Caller.from(auth).userId()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<StorageConfigResponse> get(
      JwtAuthenticationToken auth, @PathVariable String id) {
    return ResponseEntity.ok(
        StorageConfigResponse.from(storageConfigService.get(Caller.from(auth), id)));
  }

  @PostMapping
  public ResponseEntity<StorageConfigSummary> create(
      JwtAuthenticationToken auth, @Valid @RequestBody CreateStorageConfigRequest request) {
    var config = orchestrationService.create(Caller.from(auth).userId(), request.toDraft());
    return ResponseEntity.created(URI.create("/api/configs/" + config.getId()))
        .body(StorageConfigSummary.from(config));
  }

  @PutMapping("/{id}")
  public ResponseEntity<StorageConfigSummary> update(
      JwtAuthenticationToken auth,
      @PathVariable String id,
      @Valid @RequestBody UpdateStorageConfigRequest request) {
    var config = orchestrationService.update(Caller.from(auth).userId(), id, request.toPatch());
    return ResponseEntity.ok(StorageConfigSummary.from(config));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(JwtAuthenticationToken auth, @PathVariable String id) {
    storageConfigService.delete(Caller.from(auth).userId(), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/default")
  public ResponseEntity<StorageConfigSummary> setDefault(
      JwtAuthenticationToken auth, @PathVariable String id) {
    var config = storageConfigService.setDefault(Caller.from(auth).userId(), id);
    return ResponseEntity.ok(StorageConfigSummary.from(config));
  }
}
