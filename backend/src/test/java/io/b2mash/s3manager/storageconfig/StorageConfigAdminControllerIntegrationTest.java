package io.b2mash.s3manager.storageconfig;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.s3manager.testutil.InMemoryS3Client;
import io.b2mash.s3manager.testutil.InMemoryStorageConfiguration;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(InMemoryStorageConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class StorageConfigAdminControllerIntegrationTest {

  private static final String BUCKET = "xchg-it-bucket";
  private static final String OWNER = "user_xchg_owner";
  private static final String CSV_HEADER =
      "id,user_id,name,access_key,secret_key,region,bucket_name,endpoint_url,use_ssl,"
          + "storage_type,is_default,created_at,updated_at";

  @Autowired private MockMvc mockMvc;
  @Autowired private InMemoryS3Client inMemoryS3Client;

  private String ownerConfigId;

  @BeforeAll
  void setUp() throws Exception {
    inMemoryS3Client.ensureBucket(BUCKET);
    var result =
        mockMvc
            .perform(
                post("/api/configs")
                    .with(userJwt(OWNER))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "name": "Exported",
                          "storageType": "minio",
                          "accessKeyId": "AKIAEXPORT",
                          "secretAccessKey": "exportSecret99",
                          "bucketName": "%s",
                          "endpointUrl": "localhost:9000",
                          "useTls": false
                        }
                        """
                            .formatted(BUCKET)))
            .andExpect(status().isCreated())
            .andReturn();
    ownerConfigId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  // --- Access ---

  @Test
  void export_byNonAdmin_returns403() throws Exception {
    mockMvc
        .perform(get("/api/admin/configs/export").with(userJwt(OWNER)))
        .andExpect(status().isForbidden());
  }

  @Test
  void import_byNonAdmin_returns403() throws Exception {
    mockMvc
        .perform(
            multipart("/api/admin/configs/import")
                .file(csvFile(CSV_HEADER + "\n"))
                .with(userJwt(OWNER)))
        .andExpect(status().isForbidden());
  }

  // --- Export ---

  @Test
  void exportJson_includesSecrets() throws Exception {
    mockMvc
        .perform(get("/api/admin/configs/export").param("format", "json").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(
            header()
                .string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"configs.json\""))
        .andExpect(
            jsonPath("$[?(@.id == '%s')].secret_key".formatted(ownerConfigId))
                .value(hasItem("exportSecret99")))
        .andExpect(
            jsonPath("$[?(@.id == '%s')].storage_type".formatted(ownerConfigId))
                .value(hasItem("minio")));
  }

  @Test
  void exportCsv_isTheDefaultFormat() throws Exception {
    mockMvc
        .perform(get("/api/admin/configs/export").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andExpect(content().string(startsWith("id,user_id,name,access_key,secret_key")));
  }

  @Test
  void export_withUnknownFormat_returns400() throws Exception {
    mockMvc
        .perform(get("/api/admin/configs/export").param("format", "xml").with(adminJwt()))
        .andExpect(status().isBadRequest());
  }

  // --- Import ---

  @Test
  void importCsv_skipsInvalidRowsAndKeepsSingleDefault() throws Exception {
    String importOwner = "user_xchg_import";
    String csv =
        CSV_HEADER
            + "\n"
            + "xchg-imp-1,user_xchg_import,First,AKIAIMPORT1,secretOne,us-east-1,bucket-a,"
            + "localhost:9000,false,minio,true,2024-01-01T00:00:00Z,\n"
            + "xchg-imp-2,user_xchg_import,Second,AKIAIMPORT2,secretTwo,us-east-1,bucket-b,"
            + "localhost:9000,false,minio,true,2024-02-01T00:00:00Z,\n"
            + "xchg-imp-3,user_xchg_import,Broken,,secretThree,us-east-1,bucket-c,"
            + "localhost:9000,false,minio,false,2024-03-01T00:00:00Z,\n";

    mockMvc
        .perform(
            multipart("/api/admin/configs/import")
                .file(csvFile(csv))
                .param("format", "csv")
                .with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.imported").value(2))
        .andExpect(jsonPath("$.skipped").value(1));

    mockMvc
        .perform(get("/api/configs/xchg-imp-1").with(userJwt(importOwner)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isDefault").value(true))
        .andExpect(jsonPath("$.secretAccessKey").value("secretOne"));
    mockMvc
        .perform(get("/api/configs/xchg-imp-2").with(userJwt(importOwner)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isDefault").value(false));
    mockMvc
        .perform(get("/api/configs/xchg-imp-3").with(userJwt(importOwner)))
        .andExpect(status().isNotFound());
  }

  @Test
  void importJson_skipsRecordOwnedByAnotherUser() throws Exception {
    String json =
        """
        [
          {
            "id": "%s",
            "user_id": "user_xchg_thief",
            "name": "Stolen",
            "access_key": "AKIATHIEF",
            "secret_key": "thiefSecret",
            "bucket_name": "%s",
            "endpoint_url": "localhost:9000",
            "use_ssl": false,
            "storage_type": "minio",
            "is_default": true
          }
        ]
        """
            .formatted(ownerConfigId, BUCKET);

    mockMvc
        .perform(
            multipart("/api/admin/configs/import")
                .file(
                    new MockMultipartFile(
                        "file",
                        "configs.json",
                        MediaType.APPLICATION_JSON_VALUE,
                        json.getBytes(StandardCharsets.UTF_8)))
                .param("format", "json")
                .with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.imported").value(0))
        .andExpect(jsonPath("$.skipped").value(1));

    mockMvc
        .perform(get("/api/configs/" + ownerConfigId).with(userJwt(OWNER)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Exported"))
        .andExpect(jsonPath("$.secretAccessKey").value("exportSecret99"));
  }

  @Test
  void importJson_withMalformedFile_returns400() throws Exception {
    mockMvc
        .perform(
            multipart("/api/admin/configs/import")
                .file(
                    new MockMultipartFile(
                        "file",
                        "configs.json",
                        MediaType.APPLICATION_JSON_VALUE,
                        "{ not json".getBytes(StandardCharsets.UTF_8)))
                .param("format", "json")
                .with(adminJwt()))
        .andExpect(status().isBadRequest());
  }

  // --- Helpers ---

  private static MockMultipartFile csvFile(String body) {
    return new MockMultipartFile(
        "file", "configs.csv", "text/csv", body.getBytes(StandardCharsets.UTF_8));
  }

  private JwtRequestPostProcessor userJwt(String subject) {
    return jwt()
        .jwt(j -> j.subject(subject))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_USER")));
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject("user_xchg_admin").claim("roles", List.of("admin")))
        .authorities(
            List.of(
                new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_ADMIN")));
  }
}
