package com.blogflow.backend.integration.fallback;

import com.blogflow.backend.capability.MediaUploader;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.workflow.error.ContentValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when no media host is configured: a unit is "hosted" only if it already is a public URL.
 * Channel file references are not links and get dropped.
 */
@Component
@ConditionalOnProperty(
    prefix = "app.integrations.imgur",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LinkMediaUploader implements MediaUploader {

  @Override
  public HostedMedia upload(InboundUnit mediaUnit) {
    String payload = mediaUnit.payload().trim();
    try {
      URI uri = new URI(payload);
      String scheme = uri.getScheme();
      if (uri.getHost() == null || scheme == null || !scheme.matches("(?i)https?")) {
        throw new ContentValidationException(
            "Media unit " + mediaUnit.id() + " is not an http(s) link");
      }
      return new HostedMedia(mediaUnit.id(), mediaUnit.kind(), uri.toString(), null);
    } catch (URISyntaxException ex) {
      throw new ContentValidationException(
          "Media unit " + mediaUnit.id() + " is not a valid link", ex);
    }
  }
}
