package com.monsoonfire.notification.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.monsoonfire.notification.api.DeviceTokenController;
import com.monsoonfire.notification.api.NotificationAdminController;
import com.monsoonfire.notification.repository.DeadLetterRepository;
import com.monsoonfire.notification.repository.NotificationJobRepository;
import com.monsoonfire.notification.service.DeliveryMetricsAggregationService;
import com.monsoonfire.notification.service.DeviceTokenService;
import com.monsoonfire.notification.service.NotificationDrillService;
import com.monsoonfire.notification.service.NotificationJobProcessor;
import com.monsoonfire.notification.service.storage.ReservationStoragePolicyService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({DeviceTokenController.class, NotificationAdminController.class})
@AutoConfigureMockMvc
@Import(NotificationSecurityConfig.class)
@EnableConfigurationProperties(NotificationInternalApiProperties.class)
@TestPropertySource(properties = "notification.security.token=test-internal-token")
class NotificationSecurityConfigTest {

  private static final String REGISTER_BODY =
      """
      {"token": "abc 123", "environment": "sandbox"}
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DeviceTokenService deviceTokenService;
  @MockitoBean private DeadLetterRepository deadLetterRepository;
  @MockitoBean private NotificationJobRepository jobRepository;
  @MockitoBean private NotificationJobProcessor jobProcessor;
  @MockitoBean private ReservationStoragePolicyService storagePolicyService;
  @MockitoBean private NotificationDrillService drillService;
  @MockitoBean private DeliveryMetricsAggregationService metricsAggregationService;

  @Test
  void registerRejectsWithoutInternalToken() throws Exception {
    mockMvc
        .perform(
            post("/v1/device-tokens/register")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REGISTER_BODY))
        .andExpect(status().isForbidden());

    verifyNoInteractions(deviceTokenService);
  }

  @Test
  void registerRejectsWrongInternalToken() throws Exception {
    mockMvc
        .perform(
            post("/v1/device-tokens/register")
                .header("X-Internal-Token", "wrong-token")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REGISTER_BODY))
        .andExpect(status().isForbidden());
  }

  @Test
  void registerRejectsWhenForwardedUserIdMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/device-tokens/register")
                .header("X-Internal-Token", "test-internal-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REGISTER_BODY))
        .andExpect(status().isForbidden());
  }

  @Test
  void registerUsesForwardedUserAsOwner() throws Exception {
    when(deviceTokenService.register(eq("user-1"), any(DeviceTokenService.Registration.class)))
        .thenReturn("hash-1");

    mockMvc
        .perform(
            post("/v1/device-tokens/register")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REGISTER_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tokenHash").value("hash-1"));
  }

  @Test
  void registerMapsServiceRejectionToBadRequest() throws Exception {
    when(deviceTokenService.register(eq("user-1"), any(DeviceTokenService.Registration.class)))
        .thenThrow(new IllegalArgumentException("environment must be sandbox or production"));

    mockMvc
        .perform(
            post("/v1/device-tokens/register")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(REGISTER_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("environment must be sandbox or production"));
  }

  @Test
  void registerRejectsBlankTokenBeforeReachingService() throws Exception {
    mockMvc
        .perform(
            post("/v1/device-tokens/register")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\": \" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

    verifyNoInteractions(deviceTokenService);
  }

  @Test
  void adminEndpointRequiresAdminRole() throws Exception {
    mockMvc
        .perform(
            get("/admin/notifications/dead-letters")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "user-1"))
        .andExpect(status().isForbidden());

    verifyNoInteractions(deadLetterRepository);
  }

  @Test
  void adminEndpointAllowsForwardedAdminRole() throws Exception {
    when(deadLetterRepository.findRecent(50)).thenReturn(List.of());

    mockMvc
        .perform(
            get("/admin/notifications/dead-letters")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "staff-1")
                .header("X-User-Roles", "USER, ADMIN"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isArray());
  }

  @Test
  void deadLetterLimitOutOfRangeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            get("/admin/notifications/dead-letters")
                .param("limit", "500")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "staff-1")
                .header("X-User-Roles", "ADMIN"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void unknownJobIsNotFound() throws Exception {
    when(jobRepository.findById("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/admin/notifications/jobs/missing")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "staff-1")
                .header("X-User-Roles", "ROLE_ADMIN"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void manualProcessDueReportsProcessedCount() throws Exception {
    when(jobProcessor.processDueJobs()).thenReturn(3);

    mockMvc
        .perform(
            post("/admin/notifications/jobs/process-due")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", "staff-1")
                .header("X-User-Roles", "ADMIN"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.processed").value(3));
  }
}
