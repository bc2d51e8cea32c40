package com.blogflow.backend.integration.telegram.service;

import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.ingest.service.InboundEventService;
import com.blogflow.backend.integration.telegram.config.TelegramBotProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Turns chat messages into inbound units. Nothing is answered for accepted content: the user hears
 * back once, when the workflow for the batch finishes.
 */
@Component
@ConditionalOnProperty(prefix = "app.telegram", name = "enabled", havingValue = "true")
public class TelegramInboundUpdateHandler implements TelegramUpdateHandler {

  private static final Logger log = LoggerFactory.getLogger(TelegramInboundUpdateHandler.class);

  public static final String USER_PREFIX = "telegram:";

  private static final String COMMAND_START = "/start";

  static final String GREETING =
      "Send me text, photos or videos. When you stop for a moment I will turn them into a blog"
          + " post and reply with the link.";
  static final String UNSUPPORTED =
      "Only text, photos and videos are supported. This message was ignored.";

  private final InboundEventService inboundEventService;
  private final TelegramBotProperties properties;
  private final Clock clock;

  public TelegramInboundUpdateHandler(
      InboundEventService inboundEventService, TelegramBotProperties properties, Clock clock) {
    this.inboundEventService = Objects.requireNonNull(inboundEventService, "inboundEventService");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static String userId(long chatId) {
    return USER_PREFIX + chatId;
  }

  @Override
  public BotApiMethod<?> handle(Update update) {
    if (update == null || !update.hasMessage()) {
      log.debug("Ignoring unsupported update type: {}", update);
      return null;
    }
    Message message = update.getMessage();
    if (message.getChatId() == null) {
      return null;
    }
    long chatId = message.getChatId();
    if (!isAllowed(chatId)) {
      log.warn("Ignoring message from chat {} that is not on the allow list", chatId);
      return null;
    }
    if (message.isCommand()) {
      return handleCommand(chatId, message.getText());
    }

    List<InboundUnit> units = toUnits(chatId, message);
    if (units.isEmpty()) {
      return reply(chatId, UNSUPPORTED);
    }
    units.forEach(inboundEventService::accept);
    log.debug("Buffered {} unit(s) from chat {}", units.size(), chatId);
    return null;
  }

  List<InboundUnit> toUnits(long chatId, Message message) {
    String userId = userId(chatId);
    Instant receivedAt =
        message.getDate() != null ? Instant.ofEpochSecond(message.getDate()) : clock.instant();
    List<InboundUnit> units = new ArrayList<>();
    if (message.hasPhoto()) {
      largestPhoto(message.getPhoto())
          .ifPresent(
              photo ->
                  units.add(
                      InboundUnit.of(
                          userId,
                          UnitKind.IMAGE,
                          TelegramFileSourceResolver.reference(photo.getFileId()),
                          receivedAt)));
    } else if (message.hasVideo()) {
      units.add(
          InboundUnit.of(
              userId,
              UnitKind.VIDEO,
              TelegramFileSourceResolver.reference(message.getVideo().getFileId()),
              receivedAt));
    } else if (message.hasDocument()) {
      UnitKind kind = documentKind(message.getDocument());
      if (kind != null) {
        units.add(
            InboundUnit.of(
                userId,
                kind,
                TelegramFileSourceResolver.reference(message.getDocument().getFileId()),
                receivedAt));
      }
    } else if (message.hasText() && StringUtils.hasText(message.getText())) {
      units.add(InboundUnit.of(userId, UnitKind.TEXT, message.getText().trim(), receivedAt));
    }
    if (!units.isEmpty() && StringUtils.hasText(message.getCaption())) {
      units.add(InboundUnit.of(userId, UnitKind.TEXT, message.getCaption().trim(), receivedAt));
    }
    return units;
  }

  private BotApiMethod<?> handleCommand(long chatId, String rawCommand) {
    String command = rawCommand != null ? rawCommand.trim().toLowerCase(Locale.ROOT) : "";
    if (command.startsWith(COMMAND_START)) {
      return reply(chatId, GREETING);
    }
    return reply(chatId, "Unknown command. Available: /start");
  }

  private boolean isAllowed(long chatId) {
    List<Long> allowed = properties.getAllowedUserIds();
    return CollectionUtils.isEmpty(allowed) || allowed.contains(chatId);
  }

  private static Optional<PhotoSize> largestPhoto(List<PhotoSize> sizes) {
    if (CollectionUtils.isEmpty(sizes)) {
      return Optional.empty();
    }
    return sizes.stream()
        .max(
            Comparator.comparingLong(
                (PhotoSize size) ->
                    (long) nullToZero(size.getWidth()) * nullToZero(size.getHeight()))
                .thenComparingInt(size -> nullToZero(size.getFileSize())));
  }

  private static UnitKind documentKind(Document document) {
    String mimeType = document.getMimeType();
    if (mimeType == null) {
      return null;
    }
    if (mimeType.startsWith("image/")) {
      return UnitKind.IMAGE;
    }
    if (mimeType.startsWith("video/")) {
      return UnitKind.VIDEO;
    }
    return null;
  }

  private static int nullToZero(Integer value) {
    return value != null ? value : 0;
  }

  private static SendMessage reply(long chatId, String text) {
    return SendMessage.builder().chatId(Long.toString(chatId)).text(text).build();
  }
}
