package com.assistme.backend.integration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.assistme.backend.integration.api.EmailListQuery;
import com.assistme.backend.integration.api.EmailListResponse;
import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.persistence.IntegrationRepository;
import com.assistme.backend.integration.provider.ActionParams;
import com.assistme.backend.integration.provider.gmail.GmailIntegrationProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class IntegrationEmailServiceTest {

  @Mock private IntegrationRepository integrationRepository;
  @Mock private IntegrationManager integrationManager;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final UUID owner = UUID.randomUUID();

  private IntegrationEmailService service;

  @BeforeEach
  void setUp() {
    service = new IntegrationEmailService(integrationRepository, integrationManager, objectMapper);
  }

  @Test
  void mergesStoredDefaultsWithRequestOverrides() {
    Integration gmail = integration(ProviderType.GMAIL);
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("query", "from:boss@example.com");
    config.put("label_ids", List.of("INBOX"));
    config.put("max_results", 5);
    gmail.setConfig(config);
    given(integrationRepository.findByIdAndOwnerId(gmail.getId(), owner))
        .willReturn(Optional.of(gmail));
    ObjectNode page = objectMapper.createObjectNode();
    page.putArray("items").addObject().put("id", "m1");
    page.put("next_page_token", "p2");
    given(
            integrationManager.execute(
                eq(owner),
                eq(gmail.getId()),
                eq(GmailIntegrationProvider.LIST_EMAILS_PAGINATED),
                any(JsonNode.class)))
        .willReturn(page);

    EmailListResponse response =
        service.listEmails(
            owner, gmail.getId(), new EmailListQuery(null, "unread", null, 20, "p1"));

    ArgumentCaptor<JsonNode> params = ArgumentCaptor.forClass(JsonNode.class);
    verify(integrationManager)
        .execute(eq(owner), eq(gmail.getId()), eq("list_emails_paginated"), params.capture());
    assertThat(params.getValue().path("query").asText()).isEqualTo("is:unread from:boss@example.com");
    assertThat(params.getValue().path("label_ids").get(0).asText()).isEqualTo("INBOX");
    assertThat(params.getValue().path("max_results").asInt()).isEqualTo(20);
    assertThat(params.getValue().path("page_token").asText()).isEqualTo("p1");
    assertThat(response.items()).hasSize(1);
    assertThat(response.nextPageToken()).isEqualTo("p2");
  }

  @Test
  void tasksFilterMapsToLabelQuery() {
    ObjectNode params =
        service.buildParams(Map.of(), new EmailListQuery(null, "tasks", null, null, null));

    assertThat(params.path("query").asText()).isEqualTo("label:tasks");
    assertThat(params.has("max_results")).isFalse();
  }

  @Test
  void fullLengthQueryWithFilterStaysWithinListLimit() {
    String query = "a".repeat(EmailListQuery.MAX_QUERY_LENGTH);

    ObjectNode params =
        service.buildParams(Map.of(), new EmailListQuery(query, "unread", null, null, null));

    assertThat(params.path("query").asText()).isEqualTo("is:unread " + query);
    assertThat(ActionParams.of(params).text("query", EmailListQuery.MAX_QUERY_LENGTH + 32))
        .contains("is:unread " + query);
  }

  @Test
  void rejectsOverlongCallerQuery() {
    String query = "a".repeat(EmailListQuery.MAX_QUERY_LENGTH + 1);

    assertThatThrownBy(
            () -> service.buildParams(Map.of(), new EmailListQuery(query, null, null, null, null)))
        .isInstanceOfSatisfying(
            IntegrationException.class,
            ex -> assertThat(ex.code()).isEqualTo(IntegrationErrorCode.INVALID_PARAMS));
  }

  @Test
  void rejectsUnknownFilter() {
    assertThatThrownBy(
            () -> service.buildParams(Map.of(), new EmailListQuery(null, "starred", null, null, null)))
        .isInstanceOfSatisfying(
            IntegrationException.class,
            ex -> assertThat(ex.code()).isEqualTo(IntegrationErrorCode.INVALID_PARAMS));
  }

  @Test
  void microsoftIsNotImplemented() {
    Integration microsoft = integration(ProviderType.MICROSOFT);
    given(integrationRepository.findByIdAndOwnerId(microsoft.getId(), owner))
        .willReturn(Optional.of(microsoft));

    assertThatThrownBy(() -> service.listEmails(owner, microsoft.getId(), null))
        .isInstanceOfSatisfying(
            IntegrationException.class,
            ex -> assertThat(ex.code()).isEqualTo(IntegrationErrorCode.PROVIDER_NOT_IMPLEMENTED));
    verify(integrationManager, never()).execute(any(), any(), any(), any());
  }

  @Test
  void nonEmailProviderIsRejected() {
    Integration slack = integration(ProviderType.SLACK);
    given(integrationRepository.findByIdAndOwnerId(slack.getId(), owner))
        .willReturn(Optional.of(slack));

    assertThatThrownBy(() -> service.listEmails(owner, slack.getId(), null))
        .isInstanceOfSatisfying(
            IntegrationException.class,
            ex -> assertThat(ex.code()).isEqualTo(IntegrationErrorCode.INVALID_PARAMS));
  }

  @Test
  void foreignIntegrationIsNotFound() {
    UUID id = UUID.randomUUID();
    given(integrationRepository.findByIdAndOwnerId(id, owner)).willReturn(Optional.empty());

    assertThatThrownBy(() -> service.listEmails(owner, id, null))
        .isInstanceOfSatisfying(
            IntegrationException.class,
            ex -> assertThat(ex.code()).isEqualTo(IntegrationErrorCode.NOT_FOUND));
  }

  private Integration integration(ProviderType type) {
    Integration integration = new Integration(owner, type);
    ReflectionTestUtils.setField(integration, "id", UUID.randomUUID());
    return integration;
  }
}
