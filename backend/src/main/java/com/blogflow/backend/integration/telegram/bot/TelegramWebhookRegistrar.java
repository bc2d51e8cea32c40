package com.blogflow.backend.integration.telegram.bot;

import com.blogflow.backend.integration.telegram.config.TelegramBotProperties;
import java.util.Objects;
import org.telegram.telegrambots.bots.TelegramWebhookBot;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Bot identity used to register and remove the webhook. Updates themselves are received by
 * {@link com.blogflow.backend.integration.telegram.web.TelegramWebhookController}.
 */
public class TelegramWebhookRegistrar extends TelegramWebhookBot {

  private final TelegramBotProperties properties;

  public TelegramWebhookRegistrar(TelegramBotProperties properties) {
    super(Objects.requireNonNull(properties, "properties").getBot().getToken());
    this.properties = properties;
  }

  @Override
  public String getBotUsername() {
    return properties.getBot().getUsername();
  }

  @Override
  public String getBotPath() {
    return properties.getWebhook().getPath();
  }

  @Override
  public BotApiMethod<?> onWebhookUpdateReceived(Update update) {
    throw new UnsupportedOperationException("Updates are received by the webhook controller");
  }
}
