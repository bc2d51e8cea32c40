package com.blogflow.backend.integration.telegram.service;

import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;

public interface TelegramUpdateHandler {

  /** Handles one update; a non-null result is sent back as the webhook reply. */
  BotApiMethod<?> handle(Update update);
}
