package io.b2mash.s3manager.storageconfig;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.b2mash.s3manager.audit.AuditEventBuilder;
import io.b2mash.s3manager.audit.AuditService;
import io.b2mash.s3manager.exception.InvalidStateException;
import io.b2mash.s3manager.storageconfig.dto.ExchangedStorageConfig;
import io.b2mash.s3manager.storageconfig.dto.ImportResult;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Administrative bulk export and import of every owner's configurations, as CSV or JSON. Exported
 * records include secrets so that a file can be imported again elsewhere.
 */
@Service
public class StorageConfigExchangeService {

  private static final Logger log = LoggerFactory.getLogger(StorageConfigExchangeService.class);

  private static final TypeReference<List<ExchangedStorageConfig>> RECORD_LIST =
      new TypeReference<>() {};

  private final StorageConfigRepository repository;
  private final StorageConfigService storageConfigService;
  private final AuditService auditService;
  private final ObjectMapper objectMapper;
  private final CsvMapper csvMapper = new CsvMapper();

  public StorageConfigExchangeService(
      StorageConfigRepository repository,
      StorageConfigService storageConfigService,
      AuditService auditService,
      ObjectMapper objectMapper) {
    this.repository = repository;
    this.storageConfigService = storageConfigService;
    this.auditService = auditService;
    this.objectMapper = objectMapper;
  }

  public byte[] export(ExchangeFormat format) {
    List<ExchangedStorageConfig> records =
        repository.findAllForExport().stream().map(ExchangedStorageConfig::from).toList();
    byte[] body;
    try {
      body =
          switch (format) {
            case JSON -> objectMapper.writeValueAsBytes(records);
            case CSV ->
                csvMapper
                    .writer(csvMapper.schemaFor(ExchangedStorageConfig.class).withHeader())
                    .writeValueAsBytes(records);
          };
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialize configuration export", e);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .action("config.export")
            .resource("config")
            .details(Map.of("format", format.name().toLowerCase(), "count", records.size()))
            .build());
    log.info("Exported storage configs: format={}, count={}", format, records.size());
    return body;
  }

  /**
   * Upserts the records in {@code input} by id. Records that fail the acceptance check, or whose id
   * belongs to a different owner, are skipped and counted.
   */
  public ImportResult importConfigs(InputStream input, ExchangeFormat format) {
    List<ExchangedStorageConfig> records;
    try {
      records = read(input, format);
    } catch (IOException | RuntimeException e) {
      auditService.log(
          AuditEventBuilder.builder()
              .action("config.import")
              .resource("config")
              .details(Map.of("format", format.name().toLowerCase(), "stage", "decode"))
              .failure(e)
              .build());
      throw new InvalidStateException(
          "Invalid import file", "Could not read " + format.name() + " input: " + e.getMessage());
    }

    var byOwner = new LinkedHashMap<String, List<ImportedStorageConfig>>();
    int skipped = 0;
    for (var record : records) {
      try {
        var accepted = accept(record);
        byOwner.computeIfAbsent(record.userId(), k -> new ArrayList<>()).add(accepted);
      } catch (IllegalArgumentException e) {
        log.warn("Skipped imported storage config: id={}, reason={}", record.id(), e.getMessage());
        skipped++;
      }
    }

    int imported = 0;
    for (var entry : byOwner.entrySet()) {
      int written = storageConfigService.importRecords(entry.getKey(), entry.getValue());
      imported += written;
      skipped += entry.getValue().size() - written;
    }

    auditService.log(
        AuditEventBuilder.builder()
            .action("config.import")
            .resource("config")
            .details(
                Map.of(
                    "format", format.name().toLowerCase(),
                    "imported", imported,
                    "skipped", skipped,
                    "owners", byOwner.size()))
            .build());
    log.info(
        "Imported storage configs: format={}, imported={}, skipped={}", format, imported, skipped);
    return new ImportResult(imported, skipped);
  }

  private List<ExchangedStorageConfig> read(InputStream input, ExchangeFormat format)
      throws IOException {
    if (format == ExchangeFormat.JSON) {
      return objectMapper.readValue(input, RECORD_LIST);
    }
    var rows = new ArrayList<ExchangedStorageConfig>();
    try (MappingIterator<Map<String, String>> iterator =
        csvMapper
            .readerForMapOf(String.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(input)) {
      while (iterator.hasNext()) {
        rows.add(ExchangedStorageConfig.fromCsvRow(iterator.next()));
      }
    }
    return rows;
  }

  private static ImportedStorageConfig accept(ExchangedStorageConfig record) {
    if (record.userId() == null || record.userId().isBlank()) {
      throw new IllegalArgumentException("user_id is required");
    }
    var draft =
        new StorageConfigDraft(
            record.name(),
            BackendKind.fromWireName(record.storageType()),
            record.accessKey(),
            record.secretKey(),
            record.region(),
            record.bucketName(),
            record.endpointUrl(),
            Boolean.TRUE.equals(record.useSsl()));
    var problems = draft.problems();
    if (!problems.isEmpty()) {
      throw new IllegalArgumentException(String.join("; ", problems));
    }
    String id =
        record.id() == null || record.id().isBlank() ? UUID.randomUUID().toString() : record.id();
    return new ImportedStorageConfig(
        id, draft, Boolean.TRUE.equals(record.isDefault()), parseInstant(record.createdAt()));
  }

  private static Instant parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return Instant.now();
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException e) {
      return Instant.now();
    }
  }
}
