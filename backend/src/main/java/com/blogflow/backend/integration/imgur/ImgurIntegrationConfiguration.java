package com.blogflow.backend.integration.imgur;

import com.blogflow.backend.capability.MediaSourceResolver;
import com.blogflow.backend.common.http.ReactorClientHttpConnectorBuilder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(ImgurProperties.class)
@ConditionalOnProperty(prefix = "app.integrations.imgur", name = "enabled", havingValue = "true")
public class ImgurIntegrationConfiguration {

  @Bean
  public ImgurMediaUploader imgurMediaUploader(
      ImgurProperties properties, ObjectProvider<MediaSourceResolver> sourceResolvers) {
    if (!StringUtils.hasText(properties.getClientId())) {
      throw new IllegalStateException("app.integrations.imgur.client-id must be configured");
    }
    ReactorClientHttpConnectorBuilder connector =
        new ReactorClientHttpConnectorBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .readTimeout(properties.getReadTimeout())
            .maxInMemoryBytes(properties.getMaxMediaBytes());
    WebClient imgurClient =
        connector
            .webClientBuilder()
            .baseUrl(properties.getBaseUrl())
            .defaultHeader(
                HttpHeaders.AUTHORIZATION, "Client-ID " + properties.getClientId().trim())
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .build();
    WebClient downloadClient = connector.webClientBuilder().build();
    return new ImgurMediaUploader(
        imgurClient, downloadClient, sourceResolvers.orderedStream().toList(), properties);
  }
}
