package com.blogflow.backend.integration.hatena;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.blogflow.backend.capability.model.Draft;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.capability.model.PublishRequest;
import com.blogflow.backend.capability.model.PublishedPost;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.workflow.error.FailureCategory;
import com.blogflow.backend.workflow.error.FailureClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class HatenaBlogPublisherTest {

  private final List<ClientRequest> requests = new ArrayList<>();
  private HatenaProperties properties;
  private HttpStatus status;

  @BeforeEach
  void setUp() {
    properties = new HatenaProperties();
    properties.setHatenaId(" alice ");
    properties.setBlogId("alice.hatenablog.com");
    properties.setApiKey("key");
    status = HttpStatus.CREATED;
  }

  @Test
  void postsEntryToCollectionAndReturnsAlternateLink() {
    PublishedPost post = publisher().publish(request(List.of()));

    assertThat(post.locator()).isEqualTo("https://alice.hatenablog.com/entry/2026/03/01/100000");
    assertThat(requests).singleElement().satisfies(request -> {
      assertThat(request.method()).isEqualTo(HttpMethod.POST);
      assertThat(request.url().getPath()).isEqualTo("/alice/alice.hatenablog.com/atom/entry");
      assertThat(request.headers().getContentType()).hasToString("application/atom+xml");
    });
  }

  @Test
  void draftFlagIsCarriedToResult() {
    properties.setDraft(true);

    assertThat(publisher().publish(request(List.of())).draft()).isTrue();
  }

  @Test
  void unauthorizedIsClassifiedAsAuthorizationFailure() {
    status = HttpStatus.UNAUTHORIZED;

    assertThatThrownBy(() -> publisher().publish(request(List.of())))
        .satisfies(
            error ->
                assertThat(new FailureClassifier().classify(error))
                    .isEqualTo(FailureCategory.AUTHORIZATION));
  }

  @Test
  void bodyEmbedsHostedMediaAfterText() {
    PublishRequest request =
        request(
            List.of(
                new HostedMedia(UUID.randomUUID(), UnitKind.IMAGE, "https://i/1.png", null),
                new HostedMedia(UUID.randomUUID(), UnitKind.VIDEO, "https://i/2.mp4", null)));

    assertThat(HatenaBlogPublisher.renderBody(request))
        .isEqualTo("Temples and tea.\n\n![](https://i/1.png)\n\n[video](https://i/2.mp4)");
  }

  private HatenaBlogPublisher publisher() {
    WebClient client =
        WebClient.builder()
            .baseUrl("https://blog.hatena.test")
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, "application/atom+xml")
                          .body(status.is2xxSuccessful() ? AtomEntryCodecTest.CREATED_ENTRY : "")
                          .build());
                })
            .build();
    return new HatenaBlogPublisher(client, properties);
  }

  private static PublishRequest request(List<HostedMedia> media) {
    return PublishRequest.of(
        new Draft("A weekend in Kyoto", "  Temples and tea.\n", List.of("travel")), media);
  }
}
