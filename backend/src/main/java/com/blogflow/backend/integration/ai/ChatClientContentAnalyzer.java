package com.blogflow.backend.integration.ai;

import com.blogflow.backend.capability.ContentAnalyzer;
import com.blogflow.backend.capability.model.DraftSeed;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.error.ContentValidationException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.util.StringUtils;

public class ChatClientContentAnalyzer implements ContentAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(ChatClientContentAnalyzer.class);

  private static final String SYSTEM_PROMPT =
      """
      You turn a user's chat messages into the plan for one blog post.
      Write the topic and summary in language '%s'. Use at most %d short tags.
      %s
      """;

  private final ChatClient chatClient;
  private final BeanOutputConverter<AnalysisReply> outputConverter;
  private final AiIntegrationProperties properties;

  public ChatClientContentAnalyzer(
      ChatClient chatClient,
      BeanOutputConverter<AnalysisReply> outputConverter,
      AiIntegrationProperties properties) {
    this.chatClient = Objects.requireNonNull(chatClient, "chatClient");
    this.outputConverter = Objects.requireNonNull(outputConverter, "outputConverter");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public DraftSeed analyze(UserBatch batch) {
    String sourceText = sourceText(batch);
    if (sourceText.isBlank() && !batch.hasMedia()) {
      throw new ContentValidationException("Batch " + batch.batchId() + " has no usable content");
    }
    String content =
        chatClient
            .prompt()
            .system(
                SYSTEM_PROMPT.formatted(
                    properties.getLanguage(),
                    properties.getMaxTags(),
                    outputConverter.getFormat().trim()))
            .user(describe(batch, sourceText))
            .call()
            .content();
    AnalysisReply reply = ModelReplies.convert(outputConverter, content, "analysis");
    if (!StringUtils.hasText(reply.topic())) {
      throw new ContentValidationException("Model analysis lacks 'topic'");
    }
    DraftSeed seed =
        new DraftSeed(
            reply.topic().trim(),
            reply.summary() != null ? reply.summary().trim() : "",
            tags(reply.tags()),
            sourceText);
    log.debug("Batch {} analysed as topic '{}'", batch.batchId(), seed.topic());
    return seed;
  }

  private List<String> tags(List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    Set<String> tags = new LinkedHashSet<>();
    for (String tag : raw) {
      if (tags.size() >= properties.getMaxTags()) {
        break;
      }
      if (StringUtils.hasText(tag)) {
        tags.add(tag.trim());
      }
    }
    return new ArrayList<>(tags);
  }

  private String sourceText(UserBatch batch) {
    String text =
        batch.textUnits().stream()
            .map(InboundUnit::payload)
            .map(String::trim)
            .filter(payload -> !payload.isEmpty())
            .collect(Collectors.joining("\n"));
    int limit = properties.getMaxInputChars();
    return text.length() > limit ? text.substring(0, limit) : text;
  }

  private String describe(UserBatch batch, String sourceText) {
    StringBuilder builder = new StringBuilder();
    builder.append("Messages:\n").append(sourceText.isBlank() ? "(no text)" : sourceText);
    long images = batch.mediaUnits().stream().filter(unit -> unit.kind() == UnitKind.IMAGE).count();
    long videos = batch.mediaUnits().size() - images;
    builder.append("\nAttached images: ").append(images).append(", videos: ").append(videos);
    return builder.toString();
  }
}
