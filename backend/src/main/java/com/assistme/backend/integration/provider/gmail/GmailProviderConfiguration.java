package com.assistme.backend.integration.provider.gmail;

import com.assistme.backend.integration.config.IntegrationProperties;
import com.assistme.backend.integration.domain.ProviderType;
import com.assistme.backend.integration.provider.IntegrationProviderService;
import com.assistme.backend.integration.provider.ProviderHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GmailProviderConfiguration {

  @Bean
  public IntegrationProviderService gmailIntegrationProvider(
      IntegrationProperties properties,
      ProviderHttpClient providerHttpClient,
      ObjectMapper objectMapper) {
    return new GmailIntegrationProvider(
        properties.provider(ProviderType.GMAIL.id()),
        properties.getRefreshMargin(),
        providerHttpClient,
        objectMapper);
  }
}
