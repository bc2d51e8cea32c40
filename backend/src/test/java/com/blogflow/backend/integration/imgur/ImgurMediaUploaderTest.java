package com.blogflow.backend.integration.imgur;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.blogflow.backend.capability.MediaSourceResolver;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.workflow.error.ContentValidationException;
import com.blogflow.backend.workflow.error.FailureCategory;
import com.blogflow.backend.workflow.error.FailureClassifier;
import com.blogflow.backend.workflow.error.TransientExternalException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class ImgurMediaUploaderTest {

  private static final String IMGUR_OK =
      "{\"data\":{\"link\":\"https://i.imgur.com/abc.png\",\"deletehash\":\"dh1\"},"
          + "\"success\":true,\"status\":200}";

  private final List<ClientRequest> imgurRequests = new ArrayList<>();
  private final List<URI> downloads = new ArrayList<>();
  private ImgurProperties properties;
  private HttpStatus imgurStatus;
  private String imgurBody;
  private byte[] mediaBytes;

  @BeforeEach
  void setUp() {
    properties = new ImgurProperties();
    properties.setClientId("client");
    imgurStatus = HttpStatus.OK;
    imgurBody = IMGUR_OK;
    mediaBytes = new byte[] {1, 2, 3, 4, 5};
  }

  @Test
  void uploadsImageAndReturnsLinkWithDeleteHash() {
    HostedMedia hosted = uploader(List.of()).upload(unit(UnitKind.IMAGE, "https://cdn/x.png"));

    assertThat(hosted.url()).isEqualTo("https://i.imgur.com/abc.png");
    assertThat(hosted.deleteHandle()).isEqualTo("dh1");
    assertThat(downloads).containsExactly(URI.create("https://cdn/x.png"));
    assertThat(imgurRequests).singleElement().satisfies(request -> {
      assertThat(request.method()).isEqualTo(HttpMethod.POST);
      assertThat(request.url().getPath()).isEqualTo("/3/image");
    });
  }

  @Test
  void videosGoToUploadEndpoint() {
    uploader(List.of()).upload(unit(UnitKind.VIDEO, "https://cdn/clip.mp4"));

    assertThat(imgurRequests).singleElement().satisfies(request -> {
      assertThat(request.url().getPath()).isEqualTo("/3/upload");
      MediaType contentType = request.headers().getContentType();
      assertThat(contentType.isCompatibleWith(MediaType.MULTIPART_FORM_DATA)).isTrue();
    });
  }

  @Test
  void channelReferenceIsResolvedBeforeDownload() {
    MediaSourceResolver resolver =
        new MediaSourceResolver() {
          @Override
          public boolean supports(String payload) {
            return payload.startsWith("chan:");
          }

          @Override
          public String downloadUrl(String payload) {
            return "https://files.example/" + payload.substring("chan:".length());
          }
        };

    uploader(List.of(resolver)).upload(unit(UnitKind.IMAGE, "chan:photo-1"));

    assertThat(downloads).containsExactly(URI.create("https://files.example/photo-1"));
  }

  @Test
  void unresolvableReferenceIsRejectedWithoutCalls() {
    assertThatThrownBy(() -> uploader(List.of()).upload(unit(UnitKind.IMAGE, "chan:photo-1")))
        .isInstanceOf(ContentValidationException.class);
    assertThat(downloads).isEmpty();
    assertThat(imgurRequests).isEmpty();
  }

  @Test
  void oversizedMediaIsRejected() {
    properties.setMaxMediaBytes(4);

    InboundUnit unit = unit(UnitKind.IMAGE, "https://cdn/x.png");
    assertThatThrownBy(() -> uploader(List.of()).upload(unit))
        .isInstanceOf(ContentValidationException.class)
        .hasMessageContaining("exceeds 4 bytes");
    assertThat(imgurRequests).isEmpty();
  }

  @Test
  void responseWithoutLinkIsTransient() {
    imgurBody = "{\"data\":{},\"success\":true}";

    InboundUnit unit = unit(UnitKind.IMAGE, "https://cdn/x.png");
    assertThatThrownBy(() -> uploader(List.of()).upload(unit))
        .isInstanceOf(TransientExternalException.class);
  }

  @Test
  void rateLimitIsClassifiedAsResourceExhaustion() {
    imgurStatus = HttpStatus.TOO_MANY_REQUESTS;
    imgurBody = "{\"data\":{\"error\":\"rate limited\"},\"success\":false}";

    InboundUnit unit = unit(UnitKind.IMAGE, "https://cdn/x.png");
    assertThatThrownBy(() -> uploader(List.of()).upload(unit))
        .satisfies(
            error ->
                assertThat(new FailureClassifier().classify(error))
                    .isEqualTo(FailureCategory.RESOURCE_EXHAUSTION));
  }

  @Test
  void textUnitIsRejected() {
    assertThatThrownBy(() -> uploader(List.of()).upload(unit(UnitKind.TEXT, "hello")))
        .isInstanceOf(ContentValidationException.class);
  }

  private ImgurMediaUploader uploader(List<MediaSourceResolver> resolvers) {
    WebClient imgurClient =
        WebClient.builder()
            .baseUrl("https://api.imgur.test")
            .exchangeFunction(
                request -> {
                  imgurRequests.add(request);
                  return Mono.just(
                      ClientResponse.create(imgurStatus)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(imgurBody)
                          .build());
                })
            .build();
    WebClient downloadClient =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  downloads.add(request.url());
                  return Mono.just(
                      ClientResponse.create(HttpStatus.OK)
                          .header(
                              HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                          .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(mediaBytes)))
                          .build());
                })
            .build();
    return new ImgurMediaUploader(imgurClient, downloadClient, resolvers, properties);
  }

  private static InboundUnit unit(UnitKind kind, String payload) {
    return InboundUnit.of("telegram:1", kind, payload, Instant.EPOCH);
  }
}
