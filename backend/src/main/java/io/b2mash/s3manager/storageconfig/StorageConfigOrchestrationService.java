package io.b2mash.s3manager.storageconfig;

import io.b2mash.s3manager.storage.StorageTransferService;
import org.springframework.stereotype.Service;

/**
 * Create and update as exposed to tenants: the candidate configuration must reach its bucket before
 * the registry stores it.
 */
@Service
public class StorageConfigOrchestrationService {

  private final StorageConfigService storageConfigService;
  private final StorageTransferService storageTransferService;

  public StorageConfigOrchestrationService(
      StorageConfigService storageConfigService, StorageTransferService storageTransferService) {
    this.storageConfigService = storageConfigService;
    this.storageTransferService = storageTransferService;
  }

  public StorageConfig create(String ownerId, StorageConfigDraft draft) {
    StorageConfigService.requireAcceptable(draft);
    storageTransferService.verifyConnectivity(new StorageConfig(ownerId, draft));
    return storageConfigService.create(ownerId, draft);
  }

  public StorageConfig update(String ownerId, String id, StorageConfigPatch patch) {
    var candidate = storageConfigService.preview(ownerId, id, patch);
    storageTransferService.verifyConnectivity(candidate);
    return storageConfigService.update(ownerId, id, patch);
  }
}
