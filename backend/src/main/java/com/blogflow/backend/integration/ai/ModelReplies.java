package com.blogflow.backend.integration.ai;

import com.blogflow.backend.workflow.error.ContentValidationException;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.util.StringUtils;

final class ModelReplies {

  private ModelReplies() {}

  static <T> T convert(BeanOutputConverter<T> converter, String content, String what) {
    if (!StringUtils.hasText(content)) {
      throw new ContentValidationException("Model returned an empty " + what);
    }
    T reply;
    try {
      reply = converter.convert(content);
    } catch (RuntimeException ex) {
      throw new ContentValidationException("Model " + what + " does not match its schema", ex);
    }
    if (reply == null) {
      throw new ContentValidationException("Model returned an empty " + what);
    }
    return reply;
  }
}
