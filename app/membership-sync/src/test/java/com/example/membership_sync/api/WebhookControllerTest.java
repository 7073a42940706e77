package com.example.membership_sync.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.membership_sync.model.ReconciliationOutcome;
import com.example.membership_sync.service.MembershipReconciliationException;
import com.example.membership_sync.service.PlatformIntegrationException;
import com.example.membership_sync.service.PlatformOperation;
import com.example.membership_sync.service.ReconciliationStep;
import com.example.membership_sync.service.SyncConfigurationException;
import com.example.membership_sync.service.SyncMetrics;
import com.example.membership_sync.service.WebhookPayloadException;
import com.example.membership_sync.service.WebhookProcessingService;
import com.example.membership_sync.service.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WebhookController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(WebhookApiExceptionHandler.class)
class WebhookControllerTest {

  private static final String BODY =
      """
      {"eventKey":"frontegg.user.signedUp","user":{"id":"user-1","email":"alice@acme.io"}}
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private WebhookSignatureVerifier signatureVerifier;
  @MockitoBean private WebhookProcessingService processingService;
  @MockitoBean private SyncMetrics syncMetrics;

  @BeforeEach
  void setUp() {
    when(signatureVerifier.headerName()).thenReturn("x-webhook-secret");
    when(signatureVerifier.verify(any())).thenReturn(false);
    when(signatureVerifier.verify("good-secret")).thenReturn(true);
  }

  @Test
  void missingSignatureReturns401WithoutProcessing() throws Exception {
    mockMvc
        .perform(post("/webhooks/identity").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("INVALID_SIGNATURE"));

    verifyNoInteractions(processingService);
    verify(syncMetrics).recordWebhookError("INVALID_SIGNATURE");
  }

  @Test
  void wrongSignatureWithMalformedBodyStillReturns401() throws Exception {
    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "bad-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isUnauthorized());

    verifyNoInteractions(processingService);
  }

  @Test
  void appliedOutcomeReturns200() throws Exception {
    when(processingService.process(anyString()))
        .thenReturn(ReconciliationOutcome.applied("user reconciled into tenant Acme"));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("APPLIED"))
        .andExpect(jsonPath("$.message").value("user reconciled into tenant Acme"));

    verify(syncMetrics).recordWebhookOutcome("APPLIED");
  }

  @Test
  void acknowledgedOutcomeReturns200() throws Exception {
    when(processingService.process(anyString()))
        .thenReturn(ReconciliationOutcome.acknowledged("event has no usable email"));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("ACKNOWLEDGED_NO_ACTION"));
  }

  @Test
  void ignoredOutcomeReturns204WithoutBody() throws Exception {
    when(processingService.process(anyString()))
        .thenReturn(ReconciliationOutcome.ignored("event kind is not actionable"));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isNoContent())
        .andExpect(content().string(""));
  }

  @Test
  void malformedPayloadReturns400() throws Exception {
    when(processingService.process(anyString()))
        .thenThrow(new WebhookPayloadException("request body is not valid JSON"));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));
  }

  @Test
  void missingConfigurationReturns500() throws Exception {
    when(processingService.process(anyString()))
        .thenThrow(new SyncConfigurationException("default source tenant is not configured"));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("CONFIGURATION_MISSING"))
        .andExpect(jsonPath("$.message").value("default source tenant is not configured"));
  }

  @Test
  void reconciliationFailureReturns500WithPlatformCode() throws Exception {
    when(processingService.process(anyString()))
        .thenThrow(
            new MembershipReconciliationException(
                ReconciliationStep.REMOVE_FROM_SOURCE_TENANT,
                true,
                new PlatformIntegrationException(
                    PlatformOperation.REMOVE_USER_FROM_TENANT,
                    PlatformIntegrationException.Reason.TIMEOUT,
                    "remove_user_from_tenant request timeout")));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("PLATFORM_TIMEOUT"));

    verify(syncMetrics).recordWebhookOutcome("FAILED");
  }

  @Test
  void unexpectedFailureReturnsGenericMessage() throws Exception {
    when(processingService.process(anyString())).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(
            post("/webhooks/identity")
                .header("x-webhook-secret", "good-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("Internal error"));
  }
}
