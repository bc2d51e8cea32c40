package com.blogflow.backend.integration.fallback;

import com.blogflow.backend.capability.ContentAnalyzer;
import com.blogflow.backend.capability.model.DraftSeed;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.error.ContentValidationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Model-free analysis: the first line becomes the topic, the opening sentences the summary and
 * {@code #hashtags} the tags.
 */
@Component
@ConditionalOnProperty(
    prefix = "app.integrations.ai",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class ExcerptContentAnalyzer implements ContentAnalyzer {

  static final int TOPIC_LIMIT = 60;
  static final int SUMMARY_LIMIT = 200;
  private static final int TAG_LIMIT = 5;
  private static final Pattern HASHTAG = Pattern.compile("#([\\p{L}\\p{N}_]+)");

  @Override
  public DraftSeed analyze(UserBatch batch) {
    String text =
        batch.textUnits().stream()
            .map(InboundUnit::payload)
            .map(String::trim)
            .filter(payload -> !payload.isEmpty())
            .collect(Collectors.joining("\n"));
    if (text.isEmpty()) {
      if (!batch.hasMedia()) {
        throw new ContentValidationException("Batch " + batch.batchId() + " has no usable content");
      }
      return new DraftSeed("Photo update", "", List.of(), "");
    }
    String firstLine =
        text.lines().findFirst().orElse(text).replaceAll(HASHTAG.pattern(), "").trim();
    String topic = truncate(firstLine.isEmpty() ? "Untitled" : firstLine, TOPIC_LIMIT);
    return new DraftSeed(topic, truncate(text, SUMMARY_LIMIT), hashtags(text), text);
  }

  static List<String> hashtags(String text) {
    Set<String> tags = new LinkedHashSet<>();
    Matcher matcher = HASHTAG.matcher(text);
    while (matcher.find() && tags.size() < TAG_LIMIT) {
      tags.add(matcher.group(1).toLowerCase(Locale.ROOT));
    }
    return List.copyOf(tags);
  }

  static String truncate(String value, int limit) {
    if (value.length() <= limit) {
      return value;
    }
    return value.substring(0, limit - 1).trim() + "…";
  }
}
