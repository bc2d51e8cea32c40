package com.blogflow.backend.integration.ai;

import com.blogflow.backend.capability.DraftGenerator;
import com.blogflow.backend.capability.model.Draft;
import com.blogflow.backend.capability.model.DraftSeed;
import com.blogflow.backend.workflow.error.ContentValidationException;
import java.util.Objects;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.util.StringUtils;

public class ChatClientDraftGenerator implements DraftGenerator {

  private static final String SYSTEM_PROMPT =
      """
      You write short, friendly blog posts from a plan.
      The body is Markdown, in language '%s', and must not repeat the title.
      %s
      """;

  private final ChatClient chatClient;
  private final BeanOutputConverter<DraftReply> outputConverter;
  private final AiIntegrationProperties properties;

  public ChatClientDraftGenerator(
      ChatClient chatClient,
      BeanOutputConverter<DraftReply> outputConverter,
      AiIntegrationProperties properties) {
    this.chatClient = Objects.requireNonNull(chatClient, "chatClient");
    this.outputConverter = Objects.requireNonNull(outputConverter, "outputConverter");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public Draft generate(DraftSeed seed) {
    String userMessage =
        "Topic: "
            + seed.topic()
            + "\nSummary: "
            + seed.summary()
            + "\nTags: "
            + String.join(", ", seed.tags())
            + "\nOriginal messages:\n"
            + seed.sourceText();
    String content =
        chatClient
            .prompt()
            .system(
                SYSTEM_PROMPT.formatted(
                    properties.getLanguage(), outputConverter.getFormat().trim()))
            .user(userMessage)
            .call()
            .content();
    DraftReply reply = ModelReplies.convert(outputConverter, content, "draft");
    if (!StringUtils.hasText(reply.title()) || !StringUtils.hasText(reply.body())) {
      throw new ContentValidationException("Model draft lacks 'title' or 'body'");
    }
    return new Draft(reply.title().trim(), reply.body().trim(), seed.tags());
  }
}
