package com.assistme.backend.integration.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/** Reactor Netty connector for provider calls with bounded pooling and timeouts. */
public class ProviderConnectorBuilder {

  private Duration connectTimeout = Duration.ofSeconds(5);
  private Duration readTimeout = Duration.ofSeconds(15);
  private int maxConnections = 50;
  private Duration maxIdleTime = Duration.ofSeconds(30);

  public ProviderConnectorBuilder connectTimeout(Duration connectTimeout) {
    if (connectTimeout != null) {
      this.connectTimeout = connectTimeout;
    }
    return this;
  }

  public ProviderConnectorBuilder readTimeout(Duration readTimeout) {
    if (readTimeout != null) {
      this.readTimeout = readTimeout;
    }
    return this;
  }

  public ProviderConnectorBuilder maxConnections(int maxConnections) {
    if (maxConnections > 0) {
      this.maxConnections = maxConnections;
    }
    return this;
  }

  public ClientHttpConnector build() {
    ConnectionProvider pool =
        ConnectionProvider.builder("integration-providers")
            .maxConnections(maxConnections)
            .maxIdleTime(maxIdleTime)
            .build();
    HttpClient client =
        HttpClient.create(pool)
            .responseTimeout(readTimeout)
            .proxyWithSystemProperties()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    return new ReactorClientHttpConnector(client);
  }
}
