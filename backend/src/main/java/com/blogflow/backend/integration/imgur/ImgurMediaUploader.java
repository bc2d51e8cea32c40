package com.blogflow.backend.integration.imgur;

import com.blogflow.backend.capability.MediaSourceResolver;
import com.blogflow.backend.capability.MediaUploader;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.workflow.error.ContentValidationException;
import com.blogflow.backend.workflow.error.TransientExternalException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Hosts media on Imgur. The bytes are fetched by the service and uploaded, so source URLs (a
 * Telegram file link carries the bot token) never leave the service.
 */
public class ImgurMediaUploader implements MediaUploader {

  private static final Logger log = LoggerFactory.getLogger(ImgurMediaUploader.class);

  private final WebClient imgurClient;
  private final WebClient downloadClient;
  private final List<MediaSourceResolver> sourceResolvers;
  private final ImgurProperties properties;

  public ImgurMediaUploader(
      WebClient imgurClient,
      WebClient downloadClient,
      List<MediaSourceResolver> sourceResolvers,
      ImgurProperties properties) {
    this.imgurClient = Objects.requireNonNull(imgurClient, "imgurClient");
    this.downloadClient = Objects.requireNonNull(downloadClient, "downloadClient");
    this.sourceResolvers = sourceResolvers != null ? List.copyOf(sourceResolvers) : List.of();
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public HostedMedia upload(InboundUnit mediaUnit) {
    if (!mediaUnit.isMedia()) {
      throw new ContentValidationException("Unit " + mediaUnit.id() + " is not media");
    }
    byte[] content = download(mediaUnit);
    JsonNode response =
        mediaUnit.kind() == UnitKind.VIDEO ? uploadVideo(mediaUnit, content) : uploadImage(content);
    JsonNode data = response != null ? response.path("data") : null;
    String link = data != null ? data.path("link").asText(null) : null;
    if (!StringUtils.hasText(link)) {
      throw new TransientExternalException(
          "Imgur response for unit " + mediaUnit.id() + " has no link");
    }
    String deleteHash = data.path("deletehash").asText(null);
    log.debug("Unit {} hosted at {}", mediaUnit.id(), link);
    return new HostedMedia(mediaUnit.id(), mediaUnit.kind(), link, deleteHash);
  }

  private byte[] download(InboundUnit mediaUnit) {
    String source = resolveSource(mediaUnit);
    byte[] content = downloadClient.get().uri(source).retrieve().bodyToMono(byte[].class).block();
    if (content == null || content.length == 0) {
      throw new ContentValidationException("Media unit " + mediaUnit.id() + " is empty");
    }
    if (content.length > properties.getMaxMediaBytes()) {
      throw new ContentValidationException(
          "Media unit " + mediaUnit.id() + " exceeds " + properties.getMaxMediaBytes() + " bytes");
    }
    return content;
  }

  private String resolveSource(InboundUnit mediaUnit) {
    String payload = mediaUnit.payload().trim();
    for (MediaSourceResolver resolver : sourceResolvers) {
      if (resolver.supports(payload)) {
        return resolver.downloadUrl(payload);
      }
    }
    if (payload.startsWith("http://") || payload.startsWith("https://")) {
      return payload;
    }
    throw new ContentValidationException(
        "Media unit " + mediaUnit.id() + " has no downloadable source");
  }

  private JsonNode uploadImage(byte[] content) {
    return imgurClient
        .post()
        .uri("/3/image")
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(
            BodyInserters.fromFormData("image", Base64.getEncoder().encodeToString(content))
                .with("type", "base64"))
        .retrieve()
        .bodyToMono(JsonNode.class)
        .block();
  }

  private JsonNode uploadVideo(InboundUnit mediaUnit, byte[] content) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part(
            "video",
            new ByteArrayResource(content) {
              @Override
              public String getFilename() {
                return mediaUnit.id() + ".mp4";
              }
            })
        .contentType(MediaType.parseMediaType("video/mp4"));
    body.part("type", "file");
    return imgurClient
        .post()
        .uri("/3/upload")
        .contentType(MediaType.MULTIPART_FORM_DATA)
        .body(BodyInserters.fromMultipartData(body.build()))
        .retrieve()
        .bodyToMono(JsonNode.class)
        .block();
  }
}
