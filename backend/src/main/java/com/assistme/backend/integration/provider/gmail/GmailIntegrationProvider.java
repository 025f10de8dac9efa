package com.assistme.backend.integration.provider.gmail;

import com.assistme.backend.integration.config.IntegrationProperties;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.provider.AbstractOAuth2ProviderService;
import com.assistme.backend.integration.provider.ActionParams;
import com.assistme.backend.integration.provider.ProviderHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

/** Read-only Gmail access: listing, searching and fetching messages and threads. */
public class GmailIntegrationProvider extends AbstractOAuth2ProviderService {

  public static final String LIST_EMAILS = "list_emails";
  public static final String LIST_EMAILS_PAGINATED = "list_emails_paginated";
  public static final String SEARCH = "search";
  public static final String GET_EMAIL = "get_email";
  public static final String GET_THREADS = "get_threads";

  static final String DEFAULT_AUTHORIZATION_URI = "https://accounts.google.com/o/oauth2/v2/auth";
  static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";
  static final String DEFAULT_API_BASE_URI = "https://gmail.googleapis.com/gmail/v1";
  static final List<String> DEFAULT_SCOPES =
      List.of("https://www.googleapis.com/auth/gmail.readonly");

  private static final int DEFAULT_MAX_RESULTS = 10;
  private static final int MAX_RESULTS_LIMIT = 100;
  private static final int MAX_QUERY_LENGTH = 500;
  // room for filter prefixes such as "label:tasks" added by the email listing
  private static final int MAX_QUERY_PREFIX_LENGTH = 32;
  private static final int MAX_ID_LENGTH = 256;

  private final GmailMessageMapper messageMapper;

  public GmailIntegrationProvider(
      IntegrationProperties.Provider config,
      Duration refreshMargin,
      ProviderHttpClient httpClient,
      ObjectMapper objectMapper) {
    super(ProviderType.GMAIL, config, refreshMargin, httpClient, objectMapper);
    this.messageMapper = new GmailMessageMapper(objectMapper);
    registerAction(LIST_EMAILS, (token, params) -> listPage(token, params, false).get("items"));
    registerAction(LIST_EMAILS_PAGINATED, (token, params) -> listPage(token, params, false));
    registerAction(SEARCH, (token, params) -> listPage(token, params, true).get("items"));
    registerAction(GET_EMAIL, this::getEmail);
    registerAction(GET_THREADS, this::getThread);
  }

  @Override
  protected String defaultAuthorizationUri() {
    return DEFAULT_AUTHORIZATION_URI;
  }

  @Override
  protected String defaultTokenUri() {
    return DEFAULT_TOKEN_URI;
  }

  @Override
  protected List<String> defaultScopes() {
    return DEFAULT_SCOPES;
  }

  @Override
  protected Map<String, String> extraAuthorizationParameters() {
    Map<String, String> extras = new LinkedHashMap<>();
    extras.put("access_type", "offline");
    extras.put("prompt", "consent");
    extras.put("include_granted_scopes", "true");
    return extras;
  }

  private ObjectNode listPage(String accessToken, ActionParams params, boolean queryRequired) {
    int maxResults = params.integer("max_results", 1, MAX_RESULTS_LIMIT, DEFAULT_MAX_RESULTS);
    Optional<String> query =
        queryRequired
            ? Optional.of(params.requiredText("query", MAX_QUERY_LENGTH))
            : params.text("query", MAX_QUERY_LENGTH + MAX_QUERY_PREFIX_LENGTH);
    List<String> labelIds = params.textList("label_ids");
    Optional<String> pageToken = params.text("page_token", MAX_ID_LENGTH);

    UriComponentsBuilder builder =
        apiUri().path("/users/me/messages").queryParam("maxResults", maxResults);
    query.ifPresent(value -> builder.queryParam("q", value));
    labelIds.forEach(label -> builder.queryParam("labelIds", label));
    pageToken.ifPresent(value -> builder.queryParam("pageToken", value));

    JsonNode listing = httpClient.getJson(builder.encode().build().toUri(), accessToken);

    ObjectNode page = objectMapper.createObjectNode();
    ArrayNode items = page.putArray("items");
    int count = 0;
    for (JsonNode reference : listing.path("messages")) {
      if (count++ >= maxResults) {
        break;
      }
      String messageId = reference.path("id").asText(null);
      if (StringUtils.hasText(messageId)) {
        items.add(messageMapper.toEmail(fetchMessage(accessToken, messageId)));
      }
    }
    String nextPageToken = listing.path("nextPageToken").asText(null);
    if (StringUtils.hasText(nextPageToken)) {
      page.put("next_page_token", nextPageToken);
    } else {
      page.putNull("next_page_token");
    }
    return page;
  }

  private JsonNode getEmail(String accessToken, ActionParams params) {
    String messageId = params.requiredText("message_id", MAX_ID_LENGTH);
    return messageMapper.toEmail(fetchMessage(accessToken, messageId));
  }

  private JsonNode getThread(String accessToken, ActionParams params) {
    String threadId = params.requiredText("thread_id", MAX_ID_LENGTH);
    URI uri =
        apiUri()
            .path("/users/me/threads/{threadId}")
            .queryParam("format", "full")
            .buildAndExpand(threadId)
            .encode()
            .toUri();
    return messageMapper.toThread(httpClient.getJson(uri, accessToken));
  }

  private JsonNode fetchMessage(String accessToken, String messageId) {
    URI uri =
        apiUri()
            .path("/users/me/messages/{messageId}")
            .queryParam("format", "full")
            .buildAndExpand(messageId)
            .encode()
            .toUri();
    return httpClient.getJson(uri, accessToken);
  }

  private UriComponentsBuilder apiUri() {
    String base =
        StringUtils.hasText(config.getApiBaseUri()) ? config.getApiBaseUri() : DEFAULT_API_BASE_URI;
    return UriComponentsBuilder.fromUriString(base);
  }
}
