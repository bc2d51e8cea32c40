package com.blogflow.backend.integration.telegram.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.blogflow.backend.capability.model.Draft;
import com.blogflow.backend.capability.model.MediaResolution;
import com.blogflow.backend.capability.model.PublishedPost;
import com.blogflow.backend.capability.model.WorkflowOutcome;
import com.blogflow.backend.integration.telegram.bot.TelegramMessageSender;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.error.FailureCategory;
import com.blogflow.backend.workflow.error.TransientExternalException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.File;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@ExtendWith(MockitoExtension.class)
class TelegramUserNotifierTest {

  @Mock private TelegramMessageSender sender;

  @Test
  void sendsPublishedLinkToChat() throws Exception {
    doReturn(new Message()).when(sender).execute(any(SendMessage.class));

    new TelegramUserNotifier(sender).notify(success("telegram:555"));

    ArgumentCaptor<SendMessage> message = ArgumentCaptor.forClass(SendMessage.class);
    verify(sender).execute(message.capture());
    assertThat(message.getValue().getChatId()).isEqualTo("555");
    assertThat(message.getValue().getText()).contains("https://blog.example/entry/1");
    assertThat(message.getValue().getDisableWebPagePreview()).isFalse();
  }

  @Test
  void failureMessageDisablesPreview() throws Exception {
    doReturn(new Message()).when(sender).execute(any(SendMessage.class));
    WorkflowOutcome failed =
        WorkflowOutcome.failed(
            UUID.randomUUID(),
            "telegram:555",
            PipelineStep.PUBLISH,
            FailureCategory.TRANSIENT_EXTERNAL,
            "The blog could not be reached.",
            4,
            Duration.ofSeconds(30));

    new TelegramUserNotifier(sender).notify(failed);

    ArgumentCaptor<SendMessage> message = ArgumentCaptor.forClass(SendMessage.class);
    verify(sender).execute(message.capture());
    assertThat(message.getValue().getDisableWebPagePreview()).isTrue();
  }

  @Test
  void otherChannelsAreOnlyLogged() {
    new TelegramUserNotifier(sender).notify(success("web-user"));

    verifyNoInteractions(sender);
  }

  @Test
  void sendFailureIsTransient() throws Exception {
    doThrow(new TelegramApiException("Bad Gateway")).when(sender).execute(any(SendMessage.class));

    assertThatThrownBy(() -> new TelegramUserNotifier(sender).notify(success("telegram:555")))
        .isInstanceOf(TransientExternalException.class)
        .hasCauseInstanceOf(TelegramApiException.class);
  }

  @Test
  void fileReferenceResolvesToDownloadUrl() throws Exception {
    File file = new File();
    file.setFileId("AgAC");
    file.setFilePath("photos/file_1.jpg");
    doReturn(file).when(sender).execute(any(GetFile.class));
    doReturn("123:abc").when(sender).botToken();
    TelegramFileSourceResolver resolver = new TelegramFileSourceResolver(sender);

    assertThat(resolver.supports(TelegramFileSourceResolver.reference("AgAC"))).isTrue();
    assertThat(resolver.supports("https://cdn/x.png")).isFalse();
    assertThat(resolver.downloadUrl("telegram-file:AgAC"))
        .isEqualTo("https://api.telegram.org/file/bot123:abc/photos/file_1.jpg");
  }

  private static WorkflowOutcome success(String userId) {
    return WorkflowOutcome.succeeded(
        UUID.randomUUID(),
        userId,
        new Draft("Kyoto", "body", List.of()),
        new PublishedPost("https://blog.example/entry/1", "1", false),
        MediaResolution.none(),
        Duration.ofSeconds(5));
  }
}
