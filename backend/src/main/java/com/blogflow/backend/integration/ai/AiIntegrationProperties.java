package com.blogflow.backend.integration.ai;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.integrations.ai")
public class AiIntegrationProperties {

  private boolean enabled;

  /** Maximum number of tags kept from the analysis. */
  @Min(1)
  private int maxTags = 5;

  /** Text beyond this many characters is cut before it is sent to the model. */
  @Min(100)
  private int maxInputChars = 8000;

  private String language = "en";

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getMaxTags() {
    return maxTags;
  }

  public void setMaxTags(int maxTags) {
    this.maxTags = maxTags;
  }

  public int getMaxInputChars() {
    return maxInputChars;
  }

  public void setMaxInputChars(int maxInputChars) {
    this.maxInputChars = maxInputChars;
  }

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }
}
