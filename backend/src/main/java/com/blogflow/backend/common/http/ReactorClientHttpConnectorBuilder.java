package com.blogflow.backend.common.http;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Reactor Netty connector shared by the outbound integrations, with bounded connect and response
 * timeouts so a hung upstream surfaces as a transient failure instead of blocking a step.
 */
public class ReactorClientHttpConnectorBuilder {

  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(30);
  private int maxInMemoryBytes = 256 * 1024;

  public ReactorClientHttpConnectorBuilder connectTimeout(Duration connectTimeout) {
    if (connectTimeout != null) {
      this.connectTimeout = connectTimeout;
    }
    return this;
  }

  public ReactorClientHttpConnectorBuilder readTimeout(Duration readTimeout) {
    if (readTimeout != null) {
      this.readTimeout = readTimeout;
    }
    return this;
  }

  /** Largest response body the client buffers; media downloads need more than API replies. */
  public ReactorClientHttpConnectorBuilder maxInMemoryBytes(int maxInMemoryBytes) {
    if (maxInMemoryBytes > 0) {
      this.maxInMemoryBytes = maxInMemoryBytes;
    }
    return this;
  }

  public ClientHttpConnector build() {
    HttpClient client =
        HttpClient.create()
            .responseTimeout(readTimeout)
            .proxyWithSystemProperties()
            .compress(true)
            .keepAlive(true)
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    return new ReactorClientHttpConnector(client);
  }

  public WebClient.Builder webClientBuilder() {
    int limit = maxInMemoryBytes;
    return WebClient.builder()
        .clientConnector(build())
        .exchangeStrategies(
            ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(limit))
                .build());
  }
}
