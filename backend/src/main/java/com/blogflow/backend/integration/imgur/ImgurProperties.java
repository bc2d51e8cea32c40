package com.blogflow.backend.integration.imgur;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.integrations.imgur")
public class ImgurProperties {

  private boolean enabled;

  @NotBlank private String baseUrl = "https://api.imgur.com";

  private String clientId;

  private Duration connectTimeout = Duration.ofSeconds(10);

  private Duration readTimeout = Duration.ofSeconds(45);

  /** Media larger than this is rejected instead of uploaded. */
  private int maxMediaBytes = 20 * 1024 * 1024;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public int getMaxMediaBytes() {
    return maxMediaBytes;
  }

  public void setMaxMediaBytes(int maxMediaBytes) {
    this.maxMediaBytes = maxMediaBytes;
  }
}
