package com.blogflow.backend.integration.hatena;

import com.blogflow.backend.capability.BlogPublisher;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.capability.model.PublishRequest;
import com.blogflow.backend.capability.model.PublishedPost;
import com.blogflow.backend.ingest.domain.UnitKind;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/** Publishes entries through the Hatena Blog AtomPub API. */
public class HatenaBlogPublisher implements BlogPublisher {

  private static final Logger log = LoggerFactory.getLogger(HatenaBlogPublisher.class);
  private static final MediaType ATOM_XML = MediaType.parseMediaType("application/atom+xml");

  private final WebClient webClient;
  private final HatenaProperties properties;

  public HatenaBlogPublisher(WebClient webClient, HatenaProperties properties) {
    this.webClient = Objects.requireNonNull(webClient, "webClient");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public PublishedPost publish(PublishRequest request) {
    AtomEntryCodec.AtomEntry entry =
        new AtomEntryCodec.AtomEntry(
            request.title(),
            properties.getHatenaId(),
            renderBody(request),
            request.tags(),
            properties.isDraft());
    String response =
        webClient
            .post()
            .uri(
                "/{hatenaId}/{blogId}/atom/entry",
                properties.getHatenaId().trim(),
                properties.getBlogId().trim())
            .contentType(ATOM_XML)
            .bodyValue(AtomEntryCodec.writeEntry(entry))
            .retrieve()
            .bodyToMono(String.class)
            .block();
    PublishedPost post = AtomEntryCodec.readPublished(response, properties.isDraft());
    log.info(
        "Published '{}' at {}{}", request.title(), post.locator(), post.draft() ? " (draft)" : "");
    return post;
  }

  static String renderBody(PublishRequest request) {
    StringBuilder body = new StringBuilder(request.body().strip());
    for (HostedMedia media : request.media()) {
      body.append("\n\n");
      if (media.kind() == UnitKind.VIDEO) {
        body.append("[video](").append(media.url()).append(')');
      } else {
        body.append("![](").append(media.url()).append(')');
      }
    }
    return body.toString();
  }
}
