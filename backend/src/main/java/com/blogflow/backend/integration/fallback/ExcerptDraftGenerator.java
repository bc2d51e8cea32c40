package com.blogflow.backend.integration.fallback;

import com.blogflow.backend.capability.DraftGenerator;
import com.blogflow.backend.capability.model.Draft;
import com.blogflow.backend.capability.model.DraftSeed;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Builds the post straight from the user's own words. */
@Component
@ConditionalOnProperty(
    prefix = "app.integrations.ai",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class ExcerptDraftGenerator implements DraftGenerator {

  @Override
  public Draft generate(DraftSeed seed) {
    String body = seed.sourceText().isBlank() ? seed.summary() : seed.sourceText();
    return new Draft(seed.topic(), body.isBlank() ? seed.topic() : body, seed.tags());
  }
}
