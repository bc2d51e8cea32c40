package com.blogflow.backend.workflow.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.blogflow.backend.workflow.domain.PipelineStep;
import com.fasterxml.jackson.core.JsonParseException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

class FailureClassifierTest {

  private final FailureClassifier classifier = new FailureClassifier();

  @ParameterizedTest
  @CsvSource({
    "429, RESOURCE_EXHAUSTION",
    "408, TRANSIENT_EXTERNAL",
    "500, TRANSIENT_EXTERNAL",
    "503, TRANSIENT_EXTERNAL",
    "599, TRANSIENT_EXTERNAL",
    "401, AUTHORIZATION",
    "403, AUTHORIZATION",
    "400, VALIDATION",
    "404, VALIDATION",
    "413, VALIDATION"
  })
  void mapsHttpStatuses(int status, FailureCategory expected) {
    WebClientResponseException error =
        WebClientResponseException.create(
            status, "status " + status, HttpHeaders.EMPTY, null, null);

    assertThat(classifier.classify(error)).isEqualTo(expected);
  }

  @Test
  void usesCategoryCarriedByPipelineExceptions() {
    assertThat(classifier.classify(new ContentValidationException("empty")))
        .isEqualTo(FailureCategory.VALIDATION);
    assertThat(classifier.classify(new ResourceExhaustedException("quota")))
        .isEqualTo(FailureCategory.RESOURCE_EXHAUSTION);
    assertThat(classifier.classify(new AuthorizationException("bad key")))
        .isEqualTo(FailureCategory.AUTHORIZATION);
    assertThat(
            classifier.classify(
                new StepTimeoutException(PipelineStep.ANALYZE, Duration.ofSeconds(1))))
        .isEqualTo(FailureCategory.TRANSIENT_EXTERNAL);
  }

  @Test
  void mapsAiAndIoFailures() {
    assertThat(classifier.classify(new TransientAiException("overloaded")))
        .isEqualTo(FailureCategory.TRANSIENT_EXTERNAL);
    assertThat(classifier.classify(new NonTransientAiException("bad prompt")))
        .isEqualTo(FailureCategory.VALIDATION);
    assertThat(classifier.classify(new JsonParseException(null, "not json")))
        .isEqualTo(FailureCategory.VALIDATION);
    assertThat(classifier.classify(new SocketTimeoutException("read timed out")))
        .isEqualTo(FailureCategory.TRANSIENT_EXTERNAL);
    assertThat(classifier.classify(new IOException("reset")))
        .isEqualTo(FailureCategory.TRANSIENT_EXTERNAL);
  }

  @Test
  void unwrapsExecutorWrappers() {
    Throwable wrapped =
        new ExecutionException(
            new CompletionException(new TransientExternalException("upstream down")));

    assertThat(FailureClassifier.unwrap(wrapped)).isInstanceOf(TransientExternalException.class);
    assertThat(classifier.classify(wrapped)).isEqualTo(FailureCategory.TRANSIENT_EXTERNAL);
  }

  @Test
  void unknownFailuresAreUnclassified() {
    assertThat(classifier.classify(new IllegalStateException("bug")))
        .isEqualTo(FailureCategory.UNCLASSIFIED);
    assertThat(classifier.classify(null)).isEqualTo(FailureCategory.UNCLASSIFIED);
  }
}
