package com.blogflow.backend.integration.telegram.service;

import com.blogflow.backend.capability.MediaSourceResolver;
import com.blogflow.backend.integration.telegram.bot.TelegramMessageSender;
import com.blogflow.backend.workflow.error.TransientExternalException;
import java.util.Objects;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Resolves {@code telegram-file:<fileId>} payloads to a download link. Links expire, so this runs
 * when the media is uploaded rather than when the message arrives.
 */
@Component
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
public class TelegramFileSourceResolver implements MediaSourceResolver {

  public static final String PREFIX = "telegram-file:";

  private final TelegramMessageSender sender;

  public TelegramFileSourceResolver(TelegramMessageSender sender) {
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  public static String reference(String fileId) {
    return PREFIX + fileId;
  }

  @Override
  public boolean supports(String payload) {
    return payload != null && payload.startsWith(PREFIX);
  }

  @Override
  public String downloadUrl(String payload) {
    String fileId = payload.substring(PREFIX.length());
    try {
      File file = sender.execute(GetFile.builder().fileId(fileId).build());
      return file.getFileUrl(sender.botToken());
    } catch (TelegramApiException ex) {
      throw new TransientExternalException("Unable to resolve Telegram file " + fileId, ex);
    }
  }
}
