package com.assistme.backend.integration.config;

import com.assistme.backend.integration.provider.IntegrationProviderRegistry;
import com.assistme.backend.integration.provider.IntegrationProviderService;
import com.assistme.backend.integration.provider.ProviderHttpClient;
import com.assistme.backend.integration.provider.ProviderHttpException;
import com.assistme.backend.integration.security.TokenCipher;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(IntegrationProperties.class)
public class IntegrationConfiguration {

  private static final Logger log = LoggerFactory.getLogger(IntegrationConfiguration.class);
  private static final long MAX_BACKOFF_MS = 5_000L;

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public TokenCipher tokenCipher(IntegrationProperties properties) {
    return TokenCipher.fromBase64Key(properties.getEncryptionKey());
  }

  @Bean
  public WebClient integrationWebClient(IntegrationProperties properties) {
    IntegrationProperties.Http http = properties.getHttp();
    return WebClient.builder()
        .defaultHeader(HttpHeaders.USER_AGENT, "assistme-backend/0.1")
        .clientConnector(
            new ProviderConnectorBuilder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .build())
        .build();
  }

  @Bean
  public RetryTemplate integrationRetryTemplate(IntegrationProperties properties) {
    IntegrationProperties.Retry retry = properties.getHttp().getRetry();
    int attempts = Math.max(1, retry.getAttempts());
    long initialInterval =
        retry.getInitialDelay() != null ? Math.max(1L, retry.getInitialDelay().toMillis()) : 350L;
    Double configuredMultiplier = retry.getMultiplier();
    boolean useExponential = configuredMultiplier != null && configuredMultiplier > 1.0;
    Set<Integer> retryableStatuses =
        retry.getRetryableStatuses() != null
            ? Set.copyOf(retry.getRetryableStatuses())
            : Set.of(429, 500, 502, 503, 504);

    RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(attempts);
    if (useExponential) {
      builder = builder.exponentialBackoff(initialInterval, configuredMultiplier, MAX_BACKOFF_MS);
    } else {
      builder = builder.fixedBackoff(initialInterval);
    }
    return builder
        .retryOn(
            throwable ->
                throwable instanceof ProviderHttpException providerFailure
                    && (providerFailure.isNetworkFailure()
                        || retryableStatuses.contains(providerFailure.status())))
        .build();
  }

  @Bean
  public ProviderHttpClient providerHttpClient(
      WebClient integrationWebClient,
      RetryTemplate integrationRetryTemplate,
      IntegrationProperties properties,
      ObjectMapper objectMapper) {
    return new ProviderHttpClient(
        integrationWebClient,
        integrationRetryTemplate,
        properties.getHttp().getCallTimeout(),
        objectMapper);
  }

  /** Every provider service bean is registered once, in provider type order. */
  @Bean
  public IntegrationProviderRegistry integrationProviderRegistry(
      List<IntegrationProviderService> providerServices) {
    IntegrationProviderRegistry.Builder builder = IntegrationProviderRegistry.builder();
    providerServices.stream()
        .sorted(Comparator.comparing(IntegrationProviderService::providerType))
        .forEach(
            service -> {
              builder.register(service);
              log.info(
                  "Registered integration provider {} (available={})",
                  service.providerType().id(),
                  service.isAvailable());
            });
    return builder.build();
  }
}
