package io.b2mash.s3manager.provisioning;

import io.b2mash.s3manager.security.Caller;
import io.b2mash.s3manager.storageconfig.dto.StorageConfigResponse;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProvisioningController {

  private final BackendProvisioningService provisioningService;

  public ProvisioningController(BackendProvisioningService provisioningService) {
    this.provisioningService = provisioningService;
  }

  /** Returns the full configuration: the generated secret is only ever shown here and on get. */
  @PostMapping("/api/configs/provision")
  public ResponseEntity<StorageConfigResponse> provision(
      JwtAuthenticationToken auth, @Valid @RequestBody ProvisionRequest request) {
    var config = provisioningService.provision(Caller.from(auth).userId(), request.username());
    return ResponseEntity.created(URI.create("/api/configs/" + config.getId()))
        .body(StorageConfigResponse.from(config));
  }
}
