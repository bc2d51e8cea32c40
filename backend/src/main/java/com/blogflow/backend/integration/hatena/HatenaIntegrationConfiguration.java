package com.blogflow.backend.integration.hatena;

import com.blogflow.backend.common.http.ReactorClientHttpConnectorBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(HatenaProperties.class)
@ConditionalOnProperty(prefix = "app.integrations.hatena", name = "enabled", havingValue = "true")
public class HatenaIntegrationConfiguration {

  @Bean
  public HatenaBlogPublisher hatenaBlogPublisher(HatenaProperties properties) {
    requireText(properties.getHatenaId(), "hatena-id");
    requireText(properties.getBlogId(), "blog-id");
    requireText(properties.getApiKey(), "api-key");
    WebClient client =
        new ReactorClientHttpConnectorBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .readTimeout(properties.getReadTimeout())
            .webClientBuilder()
            .baseUrl(properties.getBaseUrl())
            .defaultHeaders(
                headers ->
                    headers.setBasicAuth(
                        properties.getHatenaId().trim(), properties.getApiKey().trim()))
            .defaultHeader(HttpHeaders.ACCEPT, "application/atom+xml")
            .build();
    return new HatenaBlogPublisher(client, properties);
  }

  private static void requireText(String value, String key) {
    if (!StringUtils.hasText(value)) {
      throw new IllegalStateException("app.integrations.hatena." + key + " must be configured");
    }
  }
}
