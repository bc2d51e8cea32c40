package com.blogflow.backend.integration.telegram.web;

import com.blogflow.backend.integration.telegram.config.TelegramBotProperties;
import com.blogflow.backend.integration.telegram.service.TelegramUpdateHandler;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Entry point for chat messages. Each accepted update is handed to the inbound handler, which
 * turns it into buffered units; a command reply, if any, goes back in the response body.
 */
@RestController
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
@RequestMapping("${app.telegram.webhook.path:/telegram/update}")
public class TelegramWebhookController {

  private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);

  static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

  private final TelegramBotProperties properties;
  private final TelegramUpdateHandler updateHandler;

  public TelegramWebhookController(
      TelegramBotProperties properties, TelegramUpdateHandler updateHandler) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.updateHandler = Objects.requireNonNull(updateHandler, "updateHandler");
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> ingestUpdate(
      @RequestBody Update update,
      @RequestHeader(name = SECRET_HEADER, required = false) String providedSecret) {
    if (!secretMatches(providedSecret)) {
      log.warn("Rejected update {} with a missing or wrong secret token", update.getUpdateId());
      return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }
    try {
      BotApiMethod<?> reply = updateHandler.handle(update);
      return reply == null ? ResponseEntity.ok().build() : ResponseEntity.ok(reply);
    } catch (IllegalStateException ex) {
      // buffer is shutting down; a non-2xx answer makes Telegram deliver the update again later
      log.warn("Update {} not accepted: {}", update.getUpdateId(), ex.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  private boolean secretMatches(String providedSecret) {
    String expected = properties.getWebhook().getSecretToken();
    if (!StringUtils.hasText(expected)) {
      return true;
    }
    return providedSecret != null
        && MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            providedSecret.getBytes(StandardCharsets.UTF_8));
  }
}
