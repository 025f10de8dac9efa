package com.assistme.backend.integration.service;

import com.assistme.backend.integration.api.EmailListQuery;
import com.assistme.backend.integration.api.EmailListResponse;
import com.assistme.backend.integration.domain.Integration;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.persistence.IntegrationRepository;
import com.assistme.backend.integration.provider.gmail.GmailIntegrationProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Email listing on top of {@link IntegrationManager#execute}. Request values win over the
 * integration's stored config ({@code query}, {@code label_ids}, {@code max_results}).
 */
@Service
public class IntegrationEmailService {

  private static final Map<String, String> FILTER_QUERIES =
      Map.of("all", "", "unread", "is:unread", "tasks", "label:tasks");

  private final IntegrationRepository integrationRepository;
  private final IntegrationManager integrationManager;
  private final ObjectMapper objectMapper;

  public IntegrationEmailService(
      IntegrationRepository integrationRepository,
      IntegrationManager integrationManager,
      ObjectMapper objectMapper) {
    this.integrationRepository = integrationRepository;
    this.integrationManager = integrationManager;
    this.objectMapper = objectMapper;
  }

  public EmailListResponse listEmails(UUID ownerId, UUID integrationId, EmailListQuery request) {
    Integration integration =
        integrationRepository
            .findByIdAndOwnerId(integrationId, ownerId)
            .orElseThrow(IntegrationException::notFound);
    ensureEmailProvider(integration.getProviderType());

    ObjectNode params = buildParams(integration.getConfig(), request);
    JsonNode page =
        integrationManager.execute(
            ownerId, integrationId, GmailIntegrationProvider.LIST_EMAILS_PAGINATED, params);
    JsonNode items = page.path("items");
    String nextPageToken = page.path("next_page_token").asText(null);
    return new EmailListResponse(
        items.isArray() ? items : objectMapper.createArrayNode(),
        StringUtils.hasText(nextPageToken) ? nextPageToken : null);
  }

  private void ensureEmailProvider(ProviderType providerType) {
    if (providerType == ProviderType.MICROSOFT) {
      throw new IntegrationException(
          IntegrationErrorCode.PROVIDER_NOT_IMPLEMENTED, "Microsoft email is not supported yet");
    }
    if (!providerType.isEmail()) {
      throw IntegrationException.invalidParams(
          "Integration " + providerType.id() + " does not provide email");
    }
  }

  ObjectNode buildParams(Map<String, Object> config, EmailListQuery request) {
    EmailListQuery query =
        request != null ? request : new EmailListQuery(null, null, null, null, null);
    ObjectNode params = objectMapper.createObjectNode();

    String text = combine(filterQuery(query.filter()), firstText(query.query(), config.get("query")));
    if (StringUtils.hasText(text)) {
      params.put("query", text);
    }

    List<String> labels = query.labelIds();
    if (labels == null || labels.isEmpty()) {
      labels = configLabels(config.get("label_ids"));
    }
    if (!labels.isEmpty()) {
      ArrayNode array = params.putArray("label_ids");
      labels.forEach(array::add);
    }

    Integer maxResults = query.maxResults();
    if (maxResults == null && config.get("max_results") instanceof Number number) {
      maxResults = number.intValue();
    }
    if (maxResults != null) {
      params.put("max_results", maxResults);
    }
    if (StringUtils.hasText(query.pageToken())) {
      params.put("page_token", query.pageToken().trim());
    }
    return params;
  }

  private static String filterQuery(String filter) {
    if (!StringUtils.hasText(filter)) {
      return "";
    }
    String value = FILTER_QUERIES.get(filter.trim().toLowerCase(Locale.ROOT));
    if (value == null) {
      throw IntegrationException.invalidParams("filter must be one of all, unread, tasks");
    }
    return value;
  }

  private static String firstText(String requested, Object configured) {
    String text = "";
    if (StringUtils.hasText(requested)) {
      text = requested.trim();
    } else if (configured instanceof String stored && StringUtils.hasText(stored)) {
      text = stored.trim();
    }
    if (text.length() > EmailListQuery.MAX_QUERY_LENGTH) {
      throw IntegrationException.invalidParams("query is too long");
    }
    return text;
  }

  private static String combine(String left, String right) {
    if (!StringUtils.hasText(left)) {
      return right;
    }
    return StringUtils.hasText(right) ? left + " " + right : left;
  }

  private static List<String> configLabels(Object configured) {
    if (configured instanceof Collection<?> values) {
      return values.stream()
          .filter(String.class::isInstance)
          .map(String.class::cast)
          .filter(StringUtils::hasText)
          .toList();
    }
    if (configured instanceof String text && StringUtils.hasText(text)) {
      return List.of(text.trim());
    }
    return List.of();
  }
}
