package com.blogflow.backend.integration.telegram.service;

import com.blogflow.backend.capability.UserNotifier;
import com.blogflow.backend.capability.model.WorkflowOutcome;
import com.blogflow.backend.integration.OutcomeMessageFormatter;
import com.blogflow.backend.integration.telegram.bot.TelegramMessageSender;
import com.blogflow.backend.workflow.error.TransientExternalException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Component
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
public class TelegramUserNotifier implements UserNotifier {

  private static final Logger log = LoggerFactory.getLogger(TelegramUserNotifier.class);

  private final TelegramMessageSender sender;

  public TelegramUserNotifier(TelegramMessageSender sender) {
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  @Override
  public void notify(WorkflowOutcome outcome) {
    String userId = outcome.userId();
    if (!userId.startsWith(TelegramInboundUpdateHandler.USER_PREFIX)) {
      log.info(
          "Workflow {} belongs to non-Telegram user {}, outcome logged only:\n{}",
          outcome.workflowId(),
          userId,
          OutcomeMessageFormatter.format(outcome));
      return;
    }
    String chatId = userId.substring(TelegramInboundUpdateHandler.USER_PREFIX.length());
    SendMessage message =
        SendMessage.builder()
            .chatId(chatId)
            .text(OutcomeMessageFormatter.format(outcome))
            .disableWebPagePreview(!outcome.isSuccess())
            .build();
    try {
      sender.execute(message);
    } catch (TelegramApiException ex) {
      throw new TransientExternalException("Failed to notify chat " + chatId, ex);
    }
  }
}
