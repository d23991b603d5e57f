package io.b2mash.s3manager.storageconfig;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.s3manager.testutil.InMemoryS3Client;
import io.b2mash.s3manager.testutil.InMemoryStorageConfiguration;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(InMemoryStorageConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class StorageConfigControllerIntegrationTest {

  private static final String BUCKET = "cfg-it-bucket";

  @Autowired private MockMvc mockMvc;
  @Autowired private InMemoryS3Client inMemoryS3Client;

  @BeforeAll
  void setUp() {
    inMemoryS3Client.ensureBucket(BUCKET);
  }

  // --- Create and list ---

  @Test
  void firstConfigBecomesDefault_laterOnesDoNot() throws Exception {
    var owner = userJwt("user_cfg_first");
    var firstId = createConfig(owner, "Primary");
    var secondId = createConfig(owner, "Secondary");

    mockMvc
        .perform(get("/api/configs").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)));
    mockMvc
        .perform(get("/api/configs/" + firstId).with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isDefault").value(true));
    mockMvc
        .perform(get("/api/configs/" + secondId).with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isDefault").value(false));
  }

  @Test
  void createAndList_redactCredentials() throws Exception {
    var owner = userJwt("user_cfg_redact");

    mockMvc
        .perform(
            post("/api/configs")
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content(configJson("Redacted", BUCKET)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.accessKeyId").value("AKIA****"))
        .andExpect(jsonPath("$.secretAccessKey").value("wJal****"))
        .andExpect(jsonPath("$.storageType").value("minio"));

    mockMvc
        .perform(get("/api/configs").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].accessKeyId").value("AKIA****"))
        .andExpect(jsonPath("$[0].secretAccessKey").value("wJal****"))
        .andExpect(jsonPath("$[0].bucketName").value(BUCKET));
  }

  @Test
  void list_showsOnlyCallersConfigs() throws Exception {
    createConfig(userJwt("user_cfg_list_a"), "Mine");

    mockMvc
        .perform(get("/api/configs").with(userJwt("user_cfg_list_b")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  // --- Get ---

  @Test
  void get_returnsFullSecretToOwner() throws Exception {
    var owner = userJwt("user_cfg_get");
    var id = createConfig(owner, "Full View");

    mockMvc
        .perform(get("/api/configs/" + id).with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ownerId").value("user_cfg_get"))
        .andExpect(jsonPath("$.accessKeyId").value("AKIAEXAMPLE"))
        .andExpect(jsonPath("$.secretAccessKey").value("wJalrXUtnFEMI"));
  }

  @Test
  void get_byOtherUser_returns403() throws Exception {
    var id = createConfig(userJwt("user_cfg_private"), "Private");

    mockMvc
        .perform(get("/api/configs/" + id).with(userJwt("user_cfg_snoop")))
        .andExpect(status().isForbidden());
  }

  @Test
  void get_byAdmin_returnsAnyConfig() throws Exception {
    var id = createConfig(userJwt("user_cfg_admin_view"), "Admin Visible");

    mockMvc
        .perform(get("/api/configs/" + id).with(adminJwt("user_cfg_admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.secretAccessKey").value("wJalrXUtnFEMI"));
  }

  @Test
  void get_unknownId_returns404() throws Exception {
    mockMvc
        .perform(get("/api/configs/does-not-exist").with(userJwt("user_cfg_unknown")))
        .andExpect(status().isNotFound());
  }

  @Test
  void unauthenticatedRequest_returns401() throws Exception {
    mockMvc.perform(get("/api/configs")).andExpect(status().isUnauthorized());
  }

  // --- Update ---

  @Test
  void update_withoutSecret_keepsStoredSecret() throws Exception {
    var owner = userJwt("user_cfg_update");
    var id = createConfig(owner, "Before");

    mockMvc
        .perform(
            put("/api/configs/" + id)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"After\", \"secretAccessKey\": \"\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("After"));

    mockMvc
        .perform(get("/api/configs/" + id).with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("After"))
        .andExpect(jsonPath("$.secretAccessKey").value("wJalrXUtnFEMI"));
  }

  @Test
  void update_otherUsersConfig_returns403() throws Exception {
    var id = createConfig(userJwt("user_cfg_update_owner"), "Not Yours");

    mockMvc
        .perform(
            put("/api/configs/" + id)
                .with(userJwt("user_cfg_update_intruder"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Hijacked\"}"))
        .andExpect(status().isForbidden());
  }

  // --- Default handling ---

  @Test
  void setDefault_switchesDefault() throws Exception {
    var owner = userJwt("user_cfg_switch");
    var firstId = createConfig(owner, "One");
    var secondId = createConfig(owner, "Two");

    mockMvc
        .perform(post("/api/configs/" + secondId + "/default").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isDefault").value(true));

    mockMvc
        .perform(get("/api/configs/" + firstId).with(owner))
        .andExpect(jsonPath("$.isDefault").value(false));
  }

  @Test
  void delete_lastConfig_returns409() throws Exception {
    var owner = userJwt("user_cfg_last");
    var id = createConfig(owner, "Only");

    mockMvc
        .perform(delete("/api/configs/" + id).with(owner))
        .andExpect(status().isConflict());

    mockMvc.perform(get("/api/configs/" + id).with(owner)).andExpect(status().isOk());
  }

  @Test
  void delete_default_promotesRemainingConfig() throws Exception {
    var owner = userJwt("user_cfg_promote");
    var firstId = createConfig(owner, "Default");
    var secondId = createConfig(owner, "Backup");

    mockMvc
        .perform(delete("/api/configs/" + firstId).with(owner))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/configs").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(secondId))
        .andExpect(jsonPath("$[0].isDefault").value(true));
  }

  // --- Validation and connectivity ---

  @Test
  void create_withUnreachableBucket_returns400WithConnectStage() throws Exception {
    var owner = userJwt("user_cfg_unreachable");

    mockMvc
        .perform(
            post("/api/configs")
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content(configJson("Broken", "cfg-it-missing-bucket")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.stage").value("connect"));

    mockMvc
        .perform(get("/api/configs").with(owner))
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void create_withMissingFields_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/configs")
                .with(userJwt("user_cfg_invalid"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"\", \"storageType\": \"minio\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void create_selfHostedWithoutEndpoint_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/configs")
                .with(userJwt("user_cfg_no_endpoint"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "No Endpoint",
                      "storageType": "minio",
                      "accessKeyId": "AKIAEXAMPLE",
                      "secretAccessKey": "wJalrXUtnFEMI",
                      "bucketName": "%s",
                      "useTls": false
                    }
                    """
                        .formatted(BUCKET)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void create_withUnknownStorageType_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/configs")
                .with(userJwt("user_cfg_bad_type"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(configJson("Bad Type", BUCKET).replace("\"minio\"", "\"ftp\"")))
        .andExpect(status().isBadRequest());
  }

  // --- Helpers ---

  private String createConfig(JwtRequestPostProcessor jwt, String name) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/configs")
                    .with(jwt)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(configJson(name, BUCKET)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private static String configJson(String name, String bucket) {
    return """
        {
          "name": "%s",
          "storageType": "minio",
          "accessKeyId": "AKIAEXAMPLE",
          "secretAccessKey": "wJalrXUtnFEMI",
          "bucketName": "%s",
          "endpointUrl": "localhost:9000",
          "useTls": false
        }
        """
        .formatted(name, bucket);
  }

  private JwtRequestPostProcessor userJwt(String subject) {
    return jwt()
        .jwt(j -> j.subject(subject))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_USER")));
  }

  private JwtRequestPostProcessor adminJwt(String subject) {
    return jwt()
        .jwt(j -> j.subject(subject).claim("roles", List.of("admin")))
        .authorities(
            List.of(
                new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_ADMIN")));
  }
}
