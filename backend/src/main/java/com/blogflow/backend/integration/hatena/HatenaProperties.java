package com.blogflow.backend.integration.hatena;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.integrations.hatena")
public class HatenaProperties {

  private boolean enabled;

  private String baseUrl = "https://blog.hatena.ne.jp";

  private String hatenaId;

  /** Blog domain, e.g. {@code example.hatenablog.com}. */
  private String blogId;

  private String apiKey;

  /** Post entries as drafts instead of publishing them. */
  private boolean draft;

  private Duration connectTimeout = Duration.ofSeconds(10);

  private Duration readTimeout = Duration.ofSeconds(30);

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

  public String getHatenaId() {
    return hatenaId;
  }

  public void setHatenaId(String hatenaId) {
    this.hatenaId = hatenaId;
  }

  public String getBlogId() {
    return blogId;
  }

  public void setBlogId(String blogId) {
    this.blogId = blogId;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public boolean isDraft() {
    return draft;
  }

  public void setDraft(boolean draft) {
    this.draft = draft;
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
}
