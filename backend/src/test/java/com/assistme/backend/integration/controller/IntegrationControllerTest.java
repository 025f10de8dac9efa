package com.assistme.backend.integration.controller;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.assistme.backend.integration.api.ConnectResponse;
import com.assistme.backend.integration.api.EmailListQuery;
import com.assistme.backend.integration.api.EmailListResponse;
import com.assistme.backend.integration.api.IntegrationSummary;
import com.assistme.backend.integration.api.IntegrationUpdateRequest;
import com.assistme.backend.integration.domain.IntegrationStatus;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.provider.ProviderDescriptor;
import com.assistme.backend.integration.security.OwnerIdentityResolver;
import com.assistme.backend.integration.service.CallbackOutcome;
import com.assistme.backend.integration.service.IntegrationEmailService;
import com.assistme.backend.integration.service.IntegrationErrorCode;
import com.assistme.backend.integration.service.IntegrationException;
import com.assistme.backend.integration.service.IntegrationManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IntegrationController.class)
@Import(OwnerIdentityResolver.class)
class IntegrationControllerTest {

  private static final UUID OWNER = UUID.fromString("7d1c4a52-2f5e-4c44-9a53-0f3f3cb3c001");
  private static final UUID INTEGRATION_ID =
      UUID.fromString("b3f1a7e0-8d55-4d1e-9a2b-6c1d2e3f4a5b");

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockBean private IntegrationManager integrationManager;
  @MockBean private IntegrationEmailService emailService;

  @Test
  void listsAvailableProviders() throws Exception {
    given(integrationManager.listAvailableProviders())
        .willReturn(List.of(new ProviderDescriptor("gmail", "Gmail", "Read emails")));

    mockMvc
        .perform(get("/api/integrations/available"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].provider_type", equalTo("gmail")))
        .andExpect(jsonPath("$[0].name", equalTo("Gmail")));
  }

  @Test
  void listsOwnerIntegrations() throws Exception {
    given(integrationManager.list(OWNER)).willReturn(List.of(summary()));

    mockMvc
        .perform(get("/api/integrations").header("X-Owner-Id", OWNER.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].id", equalTo(INTEGRATION_ID.toString())))
        .andExpect(jsonPath("$.items[0].provider_type", equalTo("gmail")))
        .andExpect(jsonPath("$.items[0].status", equalTo("active")));
  }

  @Test
  void requiresOwnerHeader() throws Exception {
    mockMvc.perform(get("/api/integrations")).andExpect(status().isUnauthorized());
    mockMvc
        .perform(get("/api/integrations").header("X-Owner-Id", "not-a-uuid"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(integrationManager);
  }

  @Test
  void connectReturnsAuthorizationUrl() throws Exception {
    given(integrationManager.connect(OWNER, "gmail", "https://app.example/cb", null))
        .willReturn(new ConnectResponse("https://accounts.example/auth?state=S1", "S1"));

    mockMvc
        .perform(
            post("/api/integrations/gmail/connect")
                .header("X-Owner-Id", OWNER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"redirect_uri\":\"https://app.example/cb\"}"))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath("$.authorization_url", equalTo("https://accounts.example/auth?state=S1")))
        .andExpect(jsonPath("$.state", equalTo("S1")));
  }

  @Test
  void connectUnknownProviderIsBadRequest() throws Exception {
    given(integrationManager.connect(OWNER, "dropbox", "https://app.example/cb", null))
        .willThrow(IntegrationException.unknownProvider("dropbox"));

    mockMvc
        .perform(
            post("/api/integrations/dropbox/connect")
                .header("X-Owner-Id", OWNER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"redirect_uri\":\"https://app.example/cb\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code", equalTo("UNKNOWN_PROVIDER")))
        .andExpect(jsonPath("$.detail", equalTo("Unknown provider: dropbox")));
  }

  @Test
  void connectValidatesBody() throws Exception {
    mockMvc
        .perform(
            post("/api/integrations/gmail/connect")
                .header("X-Owner-Id", OWNER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title", equalTo("Validation failed")));
  }

  @Test
  void callbackRedirectsWithIntegrationId() throws Exception {
    given(integrationManager.completeCallback("S1", "abc", null))
        .willReturn(CallbackOutcome.success("https://app.example/cb", summary()));

    mockMvc
        .perform(get("/api/integrations/callback").param("state", "S1").param("code", "abc"))
        .andExpect(status().isFound())
        .andExpect(
            header()
                .string(
                    "Location",
                    "https://app.example/cb?status=success&integration_id=" + INTEGRATION_ID));
  }

  @Test
  void callbackRedirectsWithReasonOnProviderError() throws Exception {
    given(integrationManager.completeCallback("S1", null, "access_denied"))
        .willReturn(
            CallbackOutcome.failure(
                "https://app.example/cb?tab=1",
                new IntegrationException(IntegrationErrorCode.TOKEN_EXCHANGE_FAILED)));

    mockMvc
        .perform(
            get("/api/integrations/callback").param("state", "S1").param("error", "access_denied"))
        .andExpect(status().isFound())
        .andExpect(
            header()
                .string(
                    "Location",
                    "https://app.example/cb?tab=1&status=error&reason=token_exchange_failed"));
  }

  @Test
  void callbackWithInvalidStateIsBadRequest() throws Exception {
    given(integrationManager.completeCallback(eq("S1"), eq("abc"), any()))
        .willThrow(new IntegrationException(IntegrationErrorCode.INVALID_OR_EXPIRED_STATE));

    mockMvc
        .perform(get("/api/integrations/callback").param("state", "S1").param("code", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code", equalTo("INVALID_OR_EXPIRED_STATE")));
  }

  @Test
  void disconnectReturnsNoContent() throws Exception {
    mockMvc
        .perform(
            delete("/api/integrations/{id}", INTEGRATION_ID).header("X-Owner-Id", OWNER.toString()))
        .andExpect(status().isNoContent());

    verify(integrationManager).disconnect(OWNER, INTEGRATION_ID);
  }

  @Test
  void disconnectOfForeignIntegrationIsNotFound() throws Exception {
    willThrow(IntegrationException.notFound())
        .given(integrationManager)
        .disconnect(OWNER, INTEGRATION_ID);

    mockMvc
        .perform(
            delete("/api/integrations/{id}", INTEGRATION_ID).header("X-Owner-Id", OWNER.toString()))
        .andExpect(status().isNotFound());
  }

  @Test
  void patchUpdatesIntegration() throws Exception {
    given(
            integrationManager.update(
                OWNER,
                INTEGRATION_ID,
                new IntegrationUpdateRequest(IntegrationStatus.DISCONNECTED, null)))
        .willReturn(summary());

    mockMvc
        .perform(
            patch("/api/integrations/{id}", INTEGRATION_ID)
                .header("X-Owner-Id", OWNER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"disconnected\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id", equalTo(INTEGRATION_ID.toString())));
  }

  @Test
  void executeWrapsResultInEnvelope() throws Exception {
    given(integrationManager.execute(eq(OWNER), eq(INTEGRATION_ID), eq("list_emails"), any()))
        .willReturn(objectMapper.readTree("[{\"id\":\"m1\"}]"));

    mockMvc
        .perform(
            post("/api/integrations/{id}/execute", INTEGRATION_ID)
                .header("X-Owner-Id", OWNER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"list_emails\",\"params\":{\"max_results\":10}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success", equalTo(true)))
        .andExpect(jsonPath("$.data[0].id", equalTo("m1")))
        .andExpect(jsonPath("$.error", nullValue()));
  }

  @Test
  void executeFailureCarriesPublicMessageOnly() throws Exception {
    given(integrationManager.execute(eq(OWNER), eq(INTEGRATION_ID), eq("list_emails"), any()))
        .willThrow(new IntegrationException(IntegrationErrorCode.INTEGRATION_EXPIRED));

    mockMvc
        .perform(
            post("/api/integrations/{id}/execute", INTEGRATION_ID)
                .header("X-Owner-Id", OWNER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"list_emails\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.success", equalTo(false)))
        .andExpect(
            jsonPath(
                "$.error", equalTo(IntegrationErrorCode.INTEGRATION_EXPIRED.defaultMessage())));
  }

  @Test
  void emailsPassesQueryParameters() throws Exception {
    given(
            emailService.listEmails(
                OWNER,
                INTEGRATION_ID,
                new EmailListQuery(null, "unread", List.of("INBOX"), 5, null)))
        .willReturn(new EmailListResponse(objectMapper.readTree("[]"), "p2"));

    mockMvc
        .perform(
            get("/api/integrations/{id}/emails", INTEGRATION_ID)
                .header("X-Owner-Id", OWNER.toString())
                .param("filter", "unread")
                .param("label_ids", "INBOX")
                .param("max_results", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.next_page_token", equalTo("p2")));
  }

  @Test
  void emailsRejectsOverlongQuery() throws Exception {
    mockMvc
        .perform(
            get("/api/integrations/{id}/emails", INTEGRATION_ID)
                .header("X-Owner-Id", OWNER.toString())
                .param("query", "a".repeat(EmailListQuery.MAX_QUERY_LENGTH + 1))
                .param("filter", "unread"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title", equalTo("Validation failed")))
        .andExpect(jsonPath("$.detail", equalTo("query is too long")));

    verifyNoInteractions(emailService);
  }

  @Test
  void callbackRedirectsWhenConnectionCannotBeStored() throws Exception {
    given(integrationManager.completeCallback("S1", "abc", null))
        .willReturn(
            CallbackOutcome.failure(
                "https://app.example/settings",
                new IntegrationException(IntegrationErrorCode.CONNECTION_NOT_STORED)));

    mockMvc
        .perform(get("/api/integrations/callback").param("state", "S1").param("code", "abc"))
        .andExpect(status().isFound())
        .andExpect(
            header()
                .string(
                    "Location",
                    "https://app.example/settings?status=error&reason=connection_not_stored"));
  }

  private IntegrationSummary summary() {
    Instant created = Instant.parse("2026-03-01T10:00:00Z");
    return new IntegrationSummary(
        INTEGRATION_ID, ProviderType.GMAIL, IntegrationStatus.ACTIVE, Map.of(), created, created);
  }
}
