package com.assistme.backend.integration.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Blocking facade over {@link WebClient} for provider calls. Each call is bounded by the call
 * timeout and retried according to the injected {@link RetryTemplate}.
 */
public class ProviderHttpClient {

  private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

  private final WebClient webClient;
  private final RetryTemplate retryTemplate;
  private final Duration callTimeout;
  private final ObjectMapper objectMapper;

  public ProviderHttpClient(
      WebClient webClient,
      RetryTemplate retryTemplate,
      Duration callTimeout,
      ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.retryTemplate = retryTemplate;
    this.callTimeout = callTimeout;
    this.objectMapper = objectMapper;
  }

  public JsonNode postForm(URI uri, MultiValueMap<String, String> form) {
    return retryTemplate.execute(
        context ->
            webClient
                .post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(callTimeout)
                .onErrorMap(this::translate)
                .blockOptional()
                .orElseGet(objectMapper::createObjectNode));
  }

  public JsonNode getJson(URI uri, String bearerToken) {
    return retryTemplate.execute(
        context ->
            webClient
                .get()
                .uri(uri)
                .headers(headers -> headers.setBearerAuth(bearerToken))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(callTimeout)
                .onErrorMap(this::translate)
                .blockOptional()
                .orElseGet(objectMapper::createObjectNode));
  }

  private Throwable translate(Throwable error) {
    if (error instanceof ProviderHttpException) {
      return error;
    }
    if (error instanceof WebClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      return new ProviderHttpException(
          status,
          extractErrorCode(responseException.getResponseBodyAsString()),
          "Provider responded with status " + status,
          null);
    }
    if (error instanceof TimeoutException) {
      return new ProviderHttpException(0, null, "Provider call timed out", error);
    }
    return new ProviderHttpException(0, null, "Provider call failed", error);
  }

  private String extractErrorCode(String body) {
    if (!StringUtils.hasText(body)) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      JsonNode error = node.path("error");
      if (error.isTextual()) {
        return error.asText();
      }
      if (error.isObject() && error.path("status").isTextual()) {
        return error.path("status").asText();
      }
      return null;
    } catch (JsonProcessingException ex) {
      log.debug("Provider error body is not JSON: {}", ex.getOriginalMessage());
      return null;
    }
  }
}
