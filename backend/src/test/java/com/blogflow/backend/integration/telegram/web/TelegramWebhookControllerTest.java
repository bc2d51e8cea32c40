package com.blogflow.backend.integration.telegram.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.blogflow.backend.integration.telegram.config.TelegramBotProperties;
import com.blogflow.backend.integration.telegram.service.TelegramUpdateHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

@WebMvcTest(controllers = TelegramWebhookController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(TelegramWebhookControllerTest.TelegramTestConfig.class)
@TestPropertySource(
    properties = {
      "app.telegram.enabled=true",
      "app.telegram.bot.token=test-token",
      "app.telegram.bot.username=test_bot",
      "app.telegram.webhook.external-url=https://example.com",
      "app.telegram.webhook.secret-token=test-secret"
    })
class TelegramWebhookControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @MockBean private TelegramUpdateHandler updateHandler;

  @Test
  void forwardsUpdateAndReturnsEmptyOk() throws Exception {
    doReturn(null).when(updateHandler).handle(any(Update.class));

    mockMvc
        .perform(
            post("/telegram/update")
                .contentType(MediaType.APPLICATION_JSON)
                .header(TelegramWebhookController.SECRET_HEADER, "test-secret")
                .content(objectMapper.writeValueAsString(textUpdate("hello"))))
        .andExpect(status().isOk())
        .andExpect(content().string(""));
  }

  @Test
  void replyIsReturnedInWebhookResponse() throws Exception {
    SendMessage reply = SendMessage.builder().chatId("99").text("Unknown command").build();
    doReturn(reply).when(updateHandler).handle(any(Update.class));

    mockMvc
        .perform(
            post("/telegram/update")
                .contentType(MediaType.APPLICATION_JSON)
                .header(TelegramWebhookController.SECRET_HEADER, "test-secret")
                .content(objectMapper.writeValueAsString(textUpdate("/help"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.method").value("sendmessage"))
        .andExpect(jsonPath("$.chat_id").value("99"))
        .andExpect(jsonPath("$.text").value("Unknown command"));
  }

  @Test
  void missingSecretIsForbidden() throws Exception {
    mockMvc
        .perform(
            post("/telegram/update")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(textUpdate("hello"))))
        .andExpect(status().isForbidden());
    verifyNoInteractions(updateHandler);
  }

  @Test
  void updateRefusedDuringShutdownIsLeftForRedelivery() throws Exception {
    doThrow(new IllegalStateException("Aggregation buffer is shut down"))
        .when(updateHandler)
        .handle(any(Update.class));

    mockMvc
        .perform(
            post("/telegram/update")
                .contentType(MediaType.APPLICATION_JSON)
                .header(TelegramWebhookController.SECRET_HEADER, "test-secret")
                .content(objectMapper.writeValueAsString(textUpdate("late"))))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void wrongSecretIsForbidden() throws Exception {
    mockMvc
        .perform(
            post("/telegram/update")
                .contentType(MediaType.APPLICATION_JSON)
                .header(TelegramWebhookController.SECRET_HEADER, "nope")
                .content(objectMapper.writeValueAsString(textUpdate("hello"))))
        .andExpect(status().isForbidden());
    verifyNoInteractions(updateHandler);
  }

  private static Update textUpdate(String text) {
    Chat chat = new Chat();
    chat.setId(99L);
    chat.setType("private");
    Message message = new Message();
    message.setMessageId(1);
    message.setChat(chat);
    message.setDate(1_772_359_200);
    message.setText(text);
    Update update = new Update();
    update.setUpdateId(10);
    update.setMessage(message);
    return update;
  }

  @TestConfiguration
  @EnableConfigurationProperties(TelegramBotProperties.class)
  static class TelegramTestConfig {}
}
