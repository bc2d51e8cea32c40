package com.blogflow.backend.workflow.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Maps raw failures raised by capability calls onto a {@link FailureCategory}. */
@Component
public class FailureClassifier {

  private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 500, 502, 503, 504);
  private static final Set<Integer> AUTHORIZATION_STATUSES = Set.of(401, 403);
  private static final int TOO_MANY_REQUESTS = 429;

  public FailureCategory classify(Throwable error) {
    Throwable failure = unwrap(error);
    if (failure == null) {
      return FailureCategory.UNCLASSIFIED;
    }
    if (failure instanceof PipelineStepException stepException) {
      return stepException.category();
    }
    if (failure instanceof WebClientResponseException responseException) {
      return classifyStatus(responseException.getStatusCode().value());
    }
    if (failure instanceof WebClientRequestException) {
      return FailureCategory.TRANSIENT_EXTERNAL;
    }
    if (failure instanceof TransientAiException) {
      return FailureCategory.TRANSIENT_EXTERNAL;
    }
    if (failure instanceof NonTransientAiException) {
      return FailureCategory.VALIDATION;
    }
    if (failure instanceof JsonProcessingException) {
      return FailureCategory.VALIDATION;
    }
    if (failure instanceof SocketTimeoutException
        || failure instanceof TimeoutException
        || failure instanceof IOException
        || failure instanceof UncheckedIOException) {
      return FailureCategory.TRANSIENT_EXTERNAL;
    }
    return FailureCategory.UNCLASSIFIED;
  }

  FailureCategory classifyStatus(int status) {
    if (status == TOO_MANY_REQUESTS) {
      return FailureCategory.RESOURCE_EXHAUSTION;
    }
    if (TRANSIENT_STATUSES.contains(status) || status >= 500) {
      return FailureCategory.TRANSIENT_EXTERNAL;
    }
    if (AUTHORIZATION_STATUSES.contains(status)) {
      return FailureCategory.AUTHORIZATION;
    }
    if (status >= 400) {
      return FailureCategory.VALIDATION;
    }
    return FailureCategory.UNCLASSIFIED;
  }

  /** Strips executor and proxy wrappers so the classification sees the original failure. */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current != null
        && current.getCause() != null
        && (current instanceof ExecutionException
            || current instanceof CompletionException
            || current instanceof UndeclaredThrowableException)) {
      current = current.getCause();
    }
    return current;
  }
}
