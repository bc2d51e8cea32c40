package com.blogflow.backend.integration.telegram.bot;

import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;

/**
 * Outbound Bot API client. Kept apart from the webhook adapter so that sending results back to a
 * chat does not depend on the inbound side.
 */
public class TelegramMessageSender extends DefaultAbsSender {

  private final String botToken;

  public TelegramMessageSender(String botToken) {
    super(new DefaultBotOptions(), botToken);
    this.botToken = botToken;
  }

  public String botToken() {
    return botToken;
  }
}
