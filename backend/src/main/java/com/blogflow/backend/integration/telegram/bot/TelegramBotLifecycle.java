package com.blogflow.backend.integration.telegram.bot;

import com.blogflow.backend.integration.telegram.config.TelegramBotProperties;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.util.StringUtils;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/** Registers the webhook with Telegram on startup and removes it on shutdown. */
public class TelegramBotLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(TelegramBotLifecycle.class);

  private final TelegramBotProperties properties;
  private final TelegramWebhookRegistrar webhookRegistrar;

  private volatile boolean running;

  public TelegramBotLifecycle(
      TelegramBotProperties properties, TelegramWebhookRegistrar webhookRegistrar) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.webhookRegistrar = Objects.requireNonNull(webhookRegistrar, "webhookRegistrar");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    String webhookUrl = resolveWebhookUrl();
    if (!StringUtils.hasText(webhookUrl)) {
      throw new IllegalStateException(
          "Webhook URL must be configured (app.telegram.webhook.external-url)");
    }
    try {
      SetWebhook.SetWebhookBuilder builder = SetWebhook.builder().url(webhookUrl);
      List<String> allowedUpdates = properties.getAllowedUpdates();
      if (allowedUpdates != null && !allowedUpdates.isEmpty()) {
        builder.allowedUpdates(List.copyOf(allowedUpdates));
      }
      String secretToken = properties.getWebhook().getSecretToken();
      if (StringUtils.hasText(secretToken)) {
        builder.secretToken(secretToken);
      }
      webhookRegistrar.setWebhook(builder.build());
      running = true;
      log.info("Telegram webhook registered at {}", webhookUrl);
    } catch (TelegramApiException ex) {
      throw new IllegalStateException("Failed to register Telegram webhook", ex);
    }
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    try {
      webhookRegistrar.execute(new DeleteWebhook());
    } catch (TelegramApiException ex) {
      log.warn("Failed to delete Telegram webhook: {}", ex.getMessage());
    } finally {
      running = false;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  String resolveWebhookUrl() {
    String externalUrl = properties.getWebhook().getExternalUrl();
    String path = properties.getWebhook().getPath();
    if (!StringUtils.hasText(externalUrl)) {
      return null;
    }
    if (!StringUtils.hasText(path)) {
      return externalUrl;
    }
    String base =
        externalUrl.endsWith("/")
            ? externalUrl.substring(0, externalUrl.length() - 1)
            : externalUrl;
    return path.startsWith("/") ? base + path : base + '/' + path;
  }
}
