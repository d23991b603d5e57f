package io.b2mash.s3manager.storageconfig;

import io.b2mash.s3manager.audit.AuditEventBuilder;
import io.b2mash.s3manager.audit.AuditService;
import io.b2mash.s3manager.exception.ForbiddenException;
import io.b2mash.s3manager.exception.InvalidStateException;
import io.b2mash.s3manager.exception.LastConfigurationException;
import io.b2mash.s3manager.exception.NoConfigurationException;
import io.b2mash.s3manager.exception.ResourceNotFoundException;
import io.b2mash.s3manager.security.Caller;
import io.b2mash.s3manager.storageconfig.StorageConfigChangedEvent.ChangeType;
import io.b2mash.s3manager.storageconfig.dto.StorageConfigSummary;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Per-owner registry of storage configurations.
 *
 * <p>Every owner with at least one configuration has exactly one default. Writes for one owner run
 * under that owner's {@link OwnerLocks lock}, which is held until the transaction has committed,
 * and inside the transaction the owner's rows are selected {@code FOR UPDATE}. Readers therefore
 * never see zero or two defaults.
 *
 * <p>The registry does no backend I/O; connectivity is checked by {@link
 * StorageConfigOrchestrationService} before it calls in. Audit events are written after the
 * registry transaction has ended.
 */
@Service
public class StorageConfigService {

  private static final Logger log = LoggerFactory.getLogger(StorageConfigService.class);

  private static final String RESOURCE = "Storage configuration";

  private final StorageConfigRepository repository;
  private final OwnerLocks ownerLocks;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate readOnlyTemplate;

  public StorageConfigService(
      StorageConfigRepository repository,
      OwnerLocks ownerLocks,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.ownerLocks = ownerLocks;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTemplate.setReadOnly(true);
  }

  /** Creates a configuration. The owner's first configuration becomes the default. */
  public StorageConfig create(String ownerId, StorageConfigDraft draft) {
    return create(ownerId, draft, false, "config.create");
  }

  /** Creates a configuration and makes it the owner's default in the same critical section. */
  public StorageConfig createAsDefault(String ownerId, StorageConfigDraft draft) {
    return create(ownerId, draft, true, "config.provision");
  }

  private StorageConfig create(
      String ownerId, StorageConfigDraft draft, boolean makeDefault, String action) {
    requireAcceptable(draft);
    var created =
        audited(
            action,
            null,
            Map.of("name", draft.displayName(), "bucket", draft.bucketName()),
            () ->
                ownerLocks.withLock(
                    ownerId,
                    () ->
                        transactionTemplate.execute(
                            tx -> {
                              var existing = repository.lockByOwner(ownerId);
                              var config = new StorageConfig(ownerId, draft);
                              if (existing.isEmpty() || makeDefault) {
                                existing.forEach(StorageConfig::clearDefault);
                                repository.saveAll(existing);
                                config.markDefault();
                              }
                              return repository.save(config);
                            })));

    log.info(
        "Created storage config: id={}, owner={}, kind={}, bucket={}, default={}",
        created.getId(),
        ownerId,
        created.getBackendKind(),
        created.getBucketName(),
        created.isDefault());
    return created;
  }

  /**
   * Returns the full record, secret included, to its owner or to an administrator.
   *
   * @throws ResourceNotFoundException if no configuration has this id
   * @throws ForbiddenException if the caller neither owns it nor is an administrator
   */
  public StorageConfig get(Caller caller, String id) {
    var config =
        readOnlyTemplate.execute(
            tx ->
                repository
                    .findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id)));
    if (!config.isOwnedBy(caller.userId()) && !caller.admin()) {
      throw ForbiddenException.forConfig(id);
    }
    return config;
  }

  /** Lists the owner's configurations with credentials redacted. */
  public List<StorageConfigSummary> list(String ownerId) {
    return readOnlyTemplate.execute(
        tx -> repository.findByOwner(ownerId).stream().map(StorageConfigSummary::from).toList());
  }

  /**
   * Returns the configuration as it would look after the patch, without storing anything. Used to
   * validate connectivity before {@link #update}.
   */
  public StorageConfig preview(String ownerId, String id, StorageConfigPatch patch) {
    var current = readOnlyTemplate.execute(tx -> findOwned(ownerId, id));
    var candidate = current.preview(patch);
    requireAcceptable(candidate.toDraft());
    return candidate;
  }

  /**
   * Merges the patch into the stored record. Id, owner, creation time and the default flag are
   * never taken from the patch.
   */
  public StorageConfig update(String ownerId, String id, StorageConfigPatch patch) {
    var updated =
        audited(
            "config.update",
            id,
            Map.of(),
            () ->
                ownerLocks.withLock(
                    ownerId,
                    () ->
                        transactionTemplate.execute(
                            tx -> {
                              repository.lockByOwner(ownerId);
                              var config = findOwned(ownerId, id);
                              var merged = config.merge(patch);
                              requireAcceptable(merged);
                              config.apply(merged);
                              return repository.save(config);
                            })));

    eventPublisher.publishEvent(new StorageConfigChangedEvent(id, ChangeType.UPDATED));
    log.info("Updated storage config: id={}, owner={}", id, ownerId);
    return updated;
  }

  /** Makes the target the owner's only default. */
  public StorageConfig setDefault(String ownerId, String id) {
    var target =
        audited(
            "config.set_default",
            id,
            Map.of(),
            () ->
                ownerLocks.withLock(
                    ownerId,
                    () ->
                        transactionTemplate.execute(
                            tx -> {
                              var configs = repository.lockByOwner(ownerId);
                              var selected =
                                  configs.stream()
                                      .filter(c -> c.getId().equals(id))
                                      .findFirst()
                                      .orElseThrow(() -> missingOrForeign(ownerId, id));
                              for (var config : configs) {
                                if (config != selected) {
                                  config.clearDefault();
                                }
                              }
                              selected.markDefault();
                              repository.saveAll(configs);
                              return selected;
                            })));

    log.info("Default storage config switched: owner={}, id={}", ownerId, id);
    return target;
  }

  /**
   * Deletes a configuration. If it was the default, the earliest-created remaining configuration is
   * promoted in the same transaction.
   *
   * @throws LastConfigurationException if it is the owner's only configuration
   */
  public void delete(String ownerId, String id) {
    String promoted =
        audited(
            "config.delete",
            id,
            Map.of(),
            () ->
                ownerLocks.withLock(
                    ownerId,
                    () ->
                        transactionTemplate.execute(
                            tx -> {
                              var configs = repository.lockByOwner(ownerId);
                              var target =
                                  configs.stream()
                                      .filter(c -> c.getId().equals(id))
                                      .findFirst()
                                      .orElseThrow(() -> missingOrForeign(ownerId, id));
                              if (configs.size() == 1) {
                                log.warn(
                                    "Refused to delete last storage config: owner={}, id={}",
                                    ownerId,
                                    id);
                                throw new LastConfigurationException(id);
                              }
                              repository.delete(target);
                              var remaining =
                                  configs.stream().filter(c -> c != target).toList();
                              if (remaining.stream().noneMatch(StorageConfig::isDefault)) {
                                var replacement = remaining.get(0);
                                replacement.markDefault();
                                repository.save(replacement);
                                return replacement.getId();
                              }
                              return "";
                            })));

    eventPublisher.publishEvent(new StorageConfigChangedEvent(id, ChangeType.DELETED));
    if (promoted.isEmpty()) {
      log.info("Deleted storage config: id={}, owner={}", id, ownerId);
    } else {
      log.info(
          "Deleted storage config: id={}, owner={}, promotedDefault={}", id, ownerId, promoted);
    }
  }

  /**
   * Returns the owner's default configuration. If no record is flagged, the earliest-created one
   * is returned instead.
   *
   * @throws NoConfigurationException if the owner has no configurations
   */
  public StorageConfig getDefault(String ownerId) {
    return readOnlyTemplate.execute(
        tx -> {
          var configs = repository.findByOwner(ownerId);
          if (configs.isEmpty()) {
            throw new NoConfigurationException(ownerId);
          }
          return configs.stream()
              .filter(StorageConfig::isDefault)
              .findFirst()
              .orElseGet(
                  () -> {
                    log.warn("No default storage config flagged: owner={}", ownerId);
                    return configs.get(0);
                  });
        });
  }

  /** Resolves the configuration for an operation: the given one if set, else the default. */
  public StorageConfig resolve(String ownerId, String configId) {
    if (configId == null || configId.isBlank()) {
      return getDefault(ownerId);
    }
    return readOnlyTemplate.execute(
        tx ->
            repository
                .findByIdAndOwner(configId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, configId)));
  }

  /**
   * Upserts imported records for one owner and then normalizes the owner's set to a single
   * default: the earliest-created flagged record wins, otherwise the earliest-created record is
   * promoted. Records whose id already belongs to another owner are skipped. Overwritten records
   * are announced as updated once the import has committed, so cached clients are rebuilt.
   *
   * @return the number of records written
   */
  public int importRecords(String ownerId, List<ImportedStorageConfig> records) {
    var overwritten = new ArrayList<String>();
    int written =
        ownerLocks.withLock(
            ownerId,
            () ->
                transactionTemplate.execute(
                    tx -> {
                      int count = 0;
                      for (var record : records) {
                        var existing = repository.findById(record.id());
                        if (existing.isPresent() && !existing.get().isOwnedBy(ownerId)) {
                          log.warn(
                              "Skipped imported storage config owned by another user: id={}",
                              record.id());
                          continue;
                        }
                        StorageConfig config;
                        if (existing.isPresent()) {
                          config = existing.get();
                          config.apply(record.draft());
                          overwritten.add(config.getId());
                        } else {
                          config =
                              new StorageConfig(
                                  record.id(), ownerId, record.draft(), record.createdAt());
                        }
                        if (record.isDefault()) {
                          config.markDefault();
                        } else {
                          config.clearDefault();
                        }
                        repository.save(config);
                        count++;
                      }
                      repository.flush();
                      normalizeDefaults(repository.lockByOwner(ownerId));
                      return count;
                    }));

    for (String id : overwritten) {
      eventPublisher.publishEvent(new StorageConfigChangedEvent(id, ChangeType.UPDATED));
    }
    return written;
  }

  private void normalizeDefaults(List<StorageConfig> configs) {
    if (configs.isEmpty()) {
      return;
    }
    var keep =
        configs.stream().filter(StorageConfig::isDefault).findFirst().orElse(configs.get(0));
    for (var config : configs) {
      if (config == keep) {
        config.markDefault();
      } else {
        config.clearDefault();
      }
    }
    repository.saveAll(configs);
  }

  private StorageConfig findOwned(String ownerId, String id) {
    var config =
        repository.findById(id).orElseThrow(() -> new ResourceNotFoundException(RESOURCE, id));
    if (!config.isOwnedBy(ownerId)) {
      throw ForbiddenException.forConfig(id);
    }
    return config;
  }

  private RuntimeException missingOrForeign(String ownerId, String id) {
    if (repository.existsById(id)) {
      return ForbiddenException.forConfig(id);
    }
    return new ResourceNotFoundException(RESOURCE, id);
  }

  static void requireAcceptable(StorageConfigDraft draft) {
    var problems = draft.problems();
    if (!problems.isEmpty()) {
      throw new InvalidStateException("Invalid storage configuration", problems);
    }
  }

  private <T> T audited(
      String action, String resourceId, Map<String, Object> details, Supplier<T> work) {
    try {
      T result = work.get();
      var enriched = new HashMap<>(details);
      String id = resourceId;
      if (result instanceof StorageConfig config) {
        id = config.getId();
        enriched.put("default", config.isDefault());
      }
      auditService.log(
          AuditEventBuilder.builder()
              .action(action)
              .resource("config")
              .resourceId(id)
              .details(enriched)
              .build());
      return result;
    } catch (RuntimeException e) {
      auditService.log(
          AuditEventBuilder.builder()
              .action(action)
              .resource("config")
              .resourceId(resourceId)
              .details(details)
              .failure(e)
              .build());
      throw e;
    }
  }
}
