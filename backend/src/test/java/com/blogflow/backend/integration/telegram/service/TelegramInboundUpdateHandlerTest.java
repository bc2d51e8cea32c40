package com.blogflow.backend.integration.telegram.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.ingest.service.InboundEventService;
import com.blogflow.backend.integration.telegram.config.TelegramBotProperties;
import com.blogflow.backend.support.MutableClock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.stickers.Sticker;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.Video;

@ExtendWith(MockitoExtension.class)
class TelegramInboundUpdateHandlerTest {

  private static final long CHAT_ID = 123456789L;
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private InboundEventService inboundEventService;

  private TelegramBotProperties properties;
  private TelegramInboundUpdateHandler handler;

  @BeforeEach
  void setUp() {
    properties = new TelegramBotProperties();
    handler =
        new TelegramInboundUpdateHandler(inboundEventService, properties, new MutableClock(NOW));
  }

  @Test
  void textMessageIsBufferedWithoutReply() {
    Message message = message();
    message.setText("  Went to Kyoto  ");
    message.setDate(1_772_359_200);

    BotApiMethod<?> reply = handler.handle(update(message));

    assertThat(reply).isNull();
    ArgumentCaptor<InboundUnit> unit = ArgumentCaptor.forClass(InboundUnit.class);
    verify(inboundEventService).accept(unit.capture());
    assertThat(unit.getValue().userId()).isEqualTo("telegram:" + CHAT_ID);
    assertThat(unit.getValue().kind()).isEqualTo(UnitKind.TEXT);
    assertThat(unit.getValue().payload()).isEqualTo("Went to Kyoto");
    assertThat(unit.getValue().receivedAt()).isEqualTo(Instant.ofEpochSecond(1_772_359_200));
  }

  @Test
  void captionedPhotoBecomesLargestImageThenCaption() {
    Message message = message();
    message.setPhoto(
        List.of(photo("small", 90, 90), photo("large", 1280, 960), photo("mid", 320, 240)));
    message.setCaption("Golden pavilion");

    handler.handle(update(message));

    ArgumentCaptor<InboundUnit> units = ArgumentCaptor.forClass(InboundUnit.class);
    verify(inboundEventService, times(2)).accept(units.capture());
    assertThat(units.getAllValues())
        .extracting(InboundUnit::kind, InboundUnit::payload)
        .containsExactly(
            tuple(UnitKind.IMAGE, "telegram-file:large"),
            tuple(UnitKind.TEXT, "Golden pavilion"));
    assertThat(units.getValue().receivedAt()).isEqualTo(NOW);
  }

  @Test
  void videoAndMediaDocumentsAreAccepted() {
    Message video = message();
    Video clip = new Video();
    clip.setFileId("clip");
    video.setVideo(clip);
    Message document = message();
    Document file = new Document();
    file.setFileId("doc");
    file.setMimeType("image/png");
    document.setDocument(file);

    assertThat(handler.toUnits(CHAT_ID, video))
        .singleElement()
        .satisfies(unit -> assertThat(unit.kind()).isEqualTo(UnitKind.VIDEO));
    assertThat(handler.toUnits(CHAT_ID, document))
        .singleElement()
        .satisfies(unit -> assertThat(unit.payload()).isEqualTo("telegram-file:doc"));
  }

  @Test
  void unsupportedContentGetsExplanation() {
    Message message = message();
    message.setSticker(new Sticker());

    BotApiMethod<?> reply = handler.handle(update(message));

    assertThat(reply).isInstanceOf(SendMessage.class);
    assertThat(((SendMessage) reply).getText())
        .isEqualTo(TelegramInboundUpdateHandler.UNSUPPORTED);
    verifyNoInteractions(inboundEventService);
  }

  @Test
  void startCommandIsAnsweredAndNotBuffered() {
    Message message = message();
    message.setText("/start");
    MessageEntity command = new MessageEntity();
    command.setType("bot_command");
    command.setOffset(0);
    command.setLength(6);
    message.setEntities(List.of(command));

    BotApiMethod<?> reply = handler.handle(update(message));

    assertThat(((SendMessage) reply).getText()).isEqualTo(TelegramInboundUpdateHandler.GREETING);
    assertThat(((SendMessage) reply).getChatId()).isEqualTo(Long.toString(CHAT_ID));
    verifyNoInteractions(inboundEventService);
  }

  @Test
  void chatsOutsideAllowListAreIgnored() {
    properties.getAllowedUserIds().add(42L);
    Message message = message();
    message.setText("hello");

    assertThat(handler.handle(update(message))).isNull();
    verifyNoInteractions(inboundEventService);
  }

  @Test
  void updatesWithoutMessageAreIgnored() {
    assertThat(handler.handle(new Update())).isNull();
    verifyNoInteractions(inboundEventService);
  }

  private static Message message() {
    Message message = new Message();
    Chat chat = new Chat();
    chat.setId(CHAT_ID);
    message.setChat(chat);
    message.setMessageId(7);
    return message;
  }

  private static PhotoSize photo(String fileId, int width, int height) {
    PhotoSize photo = new PhotoSize();
    photo.setFileId(fileId);
    photo.setWidth(width);
    photo.setHeight(height);
    return photo;
  }

  private static Update update(Message message) {
    Update update = new Update();
    update.setUpdateId(1);
    update.setMessage(message);
    return update;
  }
}
