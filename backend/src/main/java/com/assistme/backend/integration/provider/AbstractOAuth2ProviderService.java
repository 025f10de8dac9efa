package com.assistme.backend.integration.provider;

import com.assistme.backend.integration.config.IntegrationProperties;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.service.IntegrationErrorCode;
import com.assistme.backend.integration.service.IntegrationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Authorization-code flow shared by OAuth2 providers: consent URL construction, code exchange and
 * refresh against the provider's token endpoint. Subclasses contribute endpoint defaults and
 * register their closed set of actions from the constructor.
 */
public abstract class AbstractOAuth2ProviderService implements IntegrationProviderService {

  private static final Logger log = LoggerFactory.getLogger(AbstractOAuth2ProviderService.class);

  private static final Set<String> TERMINAL_REFRESH_ERRORS =
      Set.of("invalid_grant", "invalid_client", "unauthorized_client", "invalid_scope");

  private final ProviderType providerType;
  private final Duration refreshMargin;
  private final Map<String, ActionHandler> actions = new LinkedHashMap<>();

  protected final IntegrationProperties.Provider config;
  protected final ProviderHttpClient httpClient;
  protected final ObjectMapper objectMapper;

  protected AbstractOAuth2ProviderService(
      ProviderType providerType,
      IntegrationProperties.Provider config,
      Duration refreshMargin,
      ProviderHttpClient httpClient,
      ObjectMapper objectMapper) {
    this.providerType = providerType;
    this.config = config != null ? config : new IntegrationProperties.Provider();
    this.refreshMargin = refreshMargin != null ? refreshMargin : Duration.ofSeconds(60);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @FunctionalInterface
  protected interface ActionHandler {
    JsonNode handle(String accessToken, ActionParams params);
  }

  protected abstract String defaultAuthorizationUri();

  protected abstract String defaultTokenUri();

  protected abstract List<String> defaultScopes();

  protected Map<String, String> extraAuthorizationParameters() {
    return Map.of();
  }

  protected final void registerAction(String name, ActionHandler handler) {
    if (actions.putIfAbsent(name, handler) != null) {
      throw new IllegalStateException("Action already registered: " + name);
    }
  }

  @Override
  public ProviderType providerType() {
    return providerType;
  }

  @Override
  public ProviderDescriptor descriptor() {
    String name =
        StringUtils.hasText(config.getDisplayName())
            ? config.getDisplayName()
            : StringUtils.capitalize(providerType.id());
    String description =
        StringUtils.hasText(config.getDescription())
            ? config.getDescription()
            : "Connect to " + name;
    return new ProviderDescriptor(providerType.id(), name, description);
  }

  @Override
  public boolean isAvailable() {
    return config.isEnabled() && config.hasCredentials();
  }

  @Override
  public URI buildAuthorizationUri(String state, String redirectUri, List<String> requestedScopes) {
    List<String> scopes =
        !CollectionUtils.isEmpty(requestedScopes) ? requestedScopes : configuredScopes();
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(authorizationUri())
            .queryParam("response_type", "code")
            .queryParam("client_id", config.getClientId())
            .queryParam("redirect_uri", redirectUri)
            .queryParam("scope", String.join(" ", scopes))
            .queryParam("state", state);
    extraAuthorizationParameters().forEach(builder::queryParam);
    return builder.encode().build().toUri();
  }

  @Override
  public TokenBundle exchangeCode(String code, String redirectUri) {
    if (!StringUtils.hasText(code)) {
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED, "Authorization code is missing");
    }
    MultiValueMap<String, String> form = clientForm("authorization_code");
    form.add("code", code);
    form.add("redirect_uri", redirectUri);
    JsonNode response;
    try {
      response = httpClient.postForm(URI.create(tokenUri()), form);
    } catch (ProviderHttpException ex) {
      log.warn(
          "Code exchange with {} failed: status={}, error={}",
          providerType.id(),
          ex.status(),
          ex.errorCode());
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED, exchangeFailureMessage(ex), ex);
    }
    TokenBundle bundle = parseTokenResponse(response);
    if (bundle == null) {
      log.warn("Code exchange with {} returned no access token", providerType.id());
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED, "Provider returned no access token");
    }
    return bundle;
  }

  @Override
  public boolean needsRefresh(ProviderTokens tokens, Instant now) {
    if (tokens == null || tokens.expiresAt() == null) {
      return false;
    }
    return !now.plus(refreshMargin).isBefore(tokens.expiresAt());
  }

  @Override
  public TokenBundle refresh(ProviderTokens tokens) {
    if (tokens == null || !StringUtils.hasText(tokens.refreshToken())) {
      throw TokenRefreshException.terminal("No refresh token available, reconnect required");
    }
    MultiValueMap<String, String> form = clientForm("refresh_token");
    form.add("refresh_token", tokens.refreshToken());
    JsonNode response;
    try {
      response = httpClient.postForm(URI.create(tokenUri()), form);
    } catch (ProviderHttpException ex) {
      if (ex.isNetworkFailure() || ex.isServerError()) {
        log.warn("Token refresh with {} failed transiently: status={}", providerType.id(), ex.status());
        throw TokenRefreshException.transientFailure(
            IntegrationErrorCode.TOKEN_REFRESH_TRANSIENT.defaultMessage(), ex);
      }
      String errorCode =
          ex.errorCode() != null ? ex.errorCode().toLowerCase(Locale.ROOT) : "unknown";
      log.warn(
          "Token refresh with {} rejected: status={}, error={}",
          providerType.id(),
          ex.status(),
          errorCode);
      if (TERMINAL_REFRESH_ERRORS.contains(errorCode) || ex.status() == 400 || ex.status() == 401) {
        throw TokenRefreshException.terminal(
            IntegrationErrorCode.INTEGRATION_EXPIRED.defaultMessage());
      }
      throw TokenRefreshException.transientFailure(
          IntegrationErrorCode.TOKEN_REFRESH_TRANSIENT.defaultMessage(), ex);
    }
    TokenBundle bundle = parseTokenResponse(response);
    if (bundle == null) {
      throw TokenRefreshException.transientFailure("Provider returned no access token", null);
    }
    return bundle;
  }

  @Override
  public Set<String> supportedActions() {
    return Set.copyOf(actions.keySet());
  }

  @Override
  public JsonNode execute(ProviderTokens tokens, String action, JsonNode params) {
    ActionHandler handler = action != null ? actions.get(action) : null;
    if (handler == null) {
      throw IntegrationException.unsupportedAction(action);
    }
    ActionParams actionParams = ActionParams.of(params);
    try {
      return handler.handle(tokens.accessToken(), actionParams);
    } catch (ProviderHttpException ex) {
      log.warn(
          "Action {} on {} failed: status={}, error={}",
          action,
          providerType.id(),
          ex.status(),
          ex.errorCode());
      throw new IntegrationException(
          IntegrationErrorCode.UPSTREAM_ACTION_FAILED, actionFailureMessage(ex), ex);
    }
  }

  protected String authorizationUri() {
    return StringUtils.hasText(config.getAuthorizationUri())
        ? config.getAuthorizationUri()
        : defaultAuthorizationUri();
  }

  protected String tokenUri() {
    return StringUtils.hasText(config.getTokenUri()) ? config.getTokenUri() : defaultTokenUri();
  }

  protected List<String> configuredScopes() {
    return !CollectionUtils.isEmpty(config.getScopes()) ? config.getScopes() : defaultScopes();
  }

  private MultiValueMap<String, String> clientForm(String grantType) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", grantType);
    form.add("client_id", config.getClientId());
    form.add("client_secret", config.getClientSecret());
    return form;
  }

  private TokenBundle parseTokenResponse(JsonNode response) {
    if (response == null || !StringUtils.hasText(response.path("access_token").asText(null))) {
      return null;
    }
    String refreshToken = response.path("refresh_token").asText(null);
    Long expiresIn =
        response.hasNonNull("expires_in") ? response.path("expires_in").asLong() : null;
    String scope = response.path("scope").asText("");
    List<String> scopes =
        StringUtils.hasText(scope)
            ? Arrays.stream(scope.trim().split("\\s+")).toList()
            : List.of();
    return new TokenBundle(
        response.path("access_token").asText(),
        StringUtils.hasText(refreshToken) ? refreshToken : null,
        response.path("token_type").asText("Bearer"),
        expiresIn,
        scopes);
  }

  private String exchangeFailureMessage(ProviderHttpException ex) {
    if (ex.isNetworkFailure()) {
      return "Provider is unreachable";
    }
    return "Provider rejected the authorization code (status " + ex.status() + ")";
  }

  private String actionFailureMessage(ProviderHttpException ex) {
    if (ex.isNetworkFailure()) {
      return "Provider is unreachable";
    }
    return StringUtils.capitalize(providerType.id()) + " request failed (status " + ex.status() + ")";
  }
}
