package com.blogflow.backend.integration.fallback;

import com.blogflow.backend.capability.BlogPublisher;
import com.blogflow.backend.capability.model.PublishRequest;
import com.blogflow.backend.capability.model.PublishedPost;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Dry-run publisher: logs the post and returns a {@code dry-run:} locator. */
@Component
@ConditionalOnProperty(
    prefix = "app.integrations.hatena",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LoggingBlogPublisher implements BlogPublisher {

  private static final Logger log = LoggerFactory.getLogger(LoggingBlogPublisher.class);

  @Override
  public PublishedPost publish(PublishRequest request) {
    String entryId = UUID.randomUUID().toString();
    log.info(
        "Dry-run publish '{}' ({} chars, {} media, tags {}) as {}",
        request.title(),
        request.body().length(),
        request.media().size(),
        request.tags(),
        entryId);
    return new PublishedPost("dry-run:" + entryId, entryId, true);
  }
}
